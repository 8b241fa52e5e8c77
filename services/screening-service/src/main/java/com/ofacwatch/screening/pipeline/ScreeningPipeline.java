package com.ofacwatch.screening.pipeline;

import com.ofacwatch.screening.classify.ClassificationContext;
import com.ofacwatch.screening.classify.ScreeningClassifier;
import com.ofacwatch.screening.dedup.DedupKeys;
import com.ofacwatch.screening.dedup.DedupStore;
import com.ofacwatch.screening.domain.AlertRecord;
import com.ofacwatch.screening.domain.AliasScore;
import com.ofacwatch.screening.domain.EntityKind;
import com.ofacwatch.screening.domain.MatchLabel;
import com.ofacwatch.screening.domain.MatchResult;
import com.ofacwatch.screening.domain.Mention;
import com.ofacwatch.screening.domain.RawDocument;
import com.ofacwatch.screening.domain.SourceConfig;
import com.ofacwatch.screening.domain.Span;
import com.ofacwatch.screening.exception.ExtractionException;
import com.ofacwatch.screening.exception.FetchException;
import com.ofacwatch.screening.extract.EntityExtractor;
import com.ofacwatch.screening.index.Candidate;
import com.ofacwatch.screening.index.SanctionsIndex;
import com.ofacwatch.screening.match.MatchScorer;
import com.ofacwatch.screening.metrics.ScreeningMetrics;
import com.ofacwatch.screening.normalize.NameNormalizer;
import com.ofacwatch.screening.presenter.Presenter;
import com.ofacwatch.screening.relevance.RelevanceGate;
import com.ofacwatch.screening.source.SourceFetcher;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Phase logic of one polling cycle: fetch, extract, match, emit.
 *
 * <p>Each phase is a separate call so the scheduler can track state and stop between phases.
 * Matching works against the index generation it is handed; the caller keeps that generation
 * pinned for the whole phase.</p>
 */
@Slf4j
public class ScreeningPipeline {

    static final int CONTEXT_RADIUS = 100;

    private final SourceFetcher fetcher;
    private final EntityExtractor extractor;
    private final RelevanceGate relevanceGate;
    private final NameNormalizer normalizer;
    private final MatchScorer scorer;
    private final ScreeningClassifier classifier;
    private final DedupStore dedupStore;
    private final Presenter presenter;
    private final ScreeningMetrics metrics;
    private final TimeBoundedInvoker invoker;
    private final Set<EntityKind> screenedKinds;

    @Builder
    public ScreeningPipeline(SourceFetcher fetcher,
                             EntityExtractor extractor,
                             RelevanceGate relevanceGate,
                             NameNormalizer normalizer,
                             MatchScorer scorer,
                             ScreeningClassifier classifier,
                             DedupStore dedupStore,
                             Presenter presenter,
                             ScreeningMetrics metrics,
                             TimeBoundedInvoker invoker,
                             Set<EntityKind> screenedKinds) {
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.relevanceGate = relevanceGate;
        this.normalizer = normalizer;
        this.scorer = scorer;
        this.classifier = classifier;
        this.dedupStore = dedupStore;
        this.presenter = presenter;
        this.metrics = metrics;
        this.invoker = invoker;
        this.screenedKinds = screenedKinds == null || screenedKinds.isEmpty()
                ? EnumSet.of(EntityKind.PERSON)
                : EnumSet.copyOf(screenedKinds);
    }

    /**
     * Fetch new documents, bounded by the fetch time limit.
     */
    public List<RawDocument> fetch(SourceConfig source) throws FetchException {
        try {
            List<RawDocument> documents = invoker.call(source.sourceId(), TimeBoundedInvoker.FETCH,
                    () -> fetcher.fetch(source));
            log.debug("Fetched {} documents from {}", documents.size(), source.sourceId());
            return documents;
        } catch (FetchException e) {
            throw e;
        } catch (TimeoutException e) {
            throw FetchException.timeout(source.sourceId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(source.sourceId(), "Fetch interrupted", e);
        } catch (Exception e) {
            throw new FetchException(source.sourceId(), "Fetch failed: " + e.getMessage(), e);
        }
    }

    /**
     * Turn documents into normalized mentions. A failure on any document fails the whole batch.
     */
    public List<Mention> extract(SourceConfig source, List<RawDocument> documents) throws ExtractionException {
        List<Mention> mentions = new ArrayList<>();
        for (RawDocument document : documents) {
            mentions.addAll(extractDocument(source, document));
        }
        log.debug("Extracted {} mentions from {} documents of {}", mentions.size(), documents.size(), source.sourceId());
        return mentions;
    }

    private List<Mention> extractDocument(SourceConfig source, RawDocument document) throws ExtractionException {
        String itemId = document.itemId();
        List<Span> spans;
        try {
            spans = invoker.call(source.sourceId(), TimeBoundedInvoker.EXTRACTION,
                    () -> extractor.extractPersons(document.text()));
        } catch (TimeoutException e) {
            throw ExtractionException.timeout(itemId, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Extraction interrupted for item " + itemId, e);
        } catch (Exception e) {
            throw new ExtractionException("Extraction failed for item " + itemId + ": " + e.getMessage(), e);
        }
        if (spans == null || spans.isEmpty()) {
            return List.of();
        }

        boolean relevant = relevanceGate.isRelevant(document, source);
        Set<String> seen = new HashSet<>();
        List<Mention> mentions = new ArrayList<>(spans.size());
        for (Span span : spans) {
            String normalized = normalizer.normalize(span.text());
            if (normalized.isEmpty() || !seen.add(normalized)) {
                continue;
            }
            mentions.add(new Mention(
                    span.text(),
                    normalized,
                    itemId,
                    document.sourceId(),
                    document.url(),
                    document.publishedAt(),
                    context(document.text(), span),
                    span.offset(),
                    relevant));
        }
        return mentions;
    }

    /**
     * Screen every mention against {@code index}, keeping the reportable ones.
     */
    public List<ScreenedMention> match(List<Mention> mentions, SanctionsIndex index) {
        List<ScreenedMention> screened = new ArrayList<>();
        for (Mention mention : mentions) {
            ClassificationContext context = new ClassificationContext(mention.keywordRelevant());
            MatchResult result = screen(mention.normalizedName(), context, index);
            if (result.label().isReportable()) {
                screened.add(new ScreenedMention(mention, result));
            }
        }
        return screened;
    }

    /**
     * Best entity for one normalized name, classified.
     * Ties go to the higher pre-score, then to the smaller entity id.
     */
    public MatchResult screen(String normalizedName, ClassificationContext context, SanctionsIndex index) {
        Candidate best = null;
        List<AliasScore> bestScores = List.of();
        double bestScore = -1.0;

        for (Candidate candidate : index.candidates(normalizedName)) {
            if (!screenedKinds.contains(candidate.entity().kind())) {
                continue;
            }
            List<AliasScore> scores = scorer.scoreAliases(normalizedName, candidate.indexed().normalizedNames());
            double score = MatchScorer.best(scores);
            if (best == null || beats(score, candidate, bestScore, best)) {
                best = candidate;
                bestScores = scores;
                bestScore = score;
            }
        }

        if (best == null) {
            return MatchResult.none();
        }
        MatchLabel label = classifier.classify(bestScore, context);
        return new MatchResult(best.indexed().id(), best.entity().primaryName(), bestScore, bestScores, label);
    }

    private static boolean beats(double score, Candidate candidate, double bestScore, Candidate best) {
        int byScore = Double.compare(score, bestScore);
        if (byScore != 0) {
            return byScore > 0;
        }
        int byPreScore = Double.compare(candidate.preScore(), best.preScore());
        if (byPreScore != 0) {
            return byPreScore > 0;
        }
        return candidate.indexed().id().compareTo(best.indexed().id()) < 0;
    }

    /**
     * Record and publish new alerts. Every detection is recorded before the next one is looked at.
     *
     * @return number of alerts that were new
     */
    public int emit(List<ScreenedMention> screened) {
        int emitted = 0;
        for (ScreenedMention item : screened) {
            String key = DedupKeys.of(item.mention().sourceItemId(), item.match().entityId());
            AlertRecord alert = new AlertRecord(key, item.mention(), item.match(), Instant.now());
            if (!dedupStore.recordIfNew(key, alert)) {
                metrics.recordDuplicateSuppressed();
                continue;
            }
            emitted++;
            metrics.recordAlert(item.match().label());
            publish(alert);
        }
        return emitted;
    }

    private void publish(AlertRecord alert) {
        try {
            presenter.publish(alert);
        } catch (RuntimeException e) {
            // recorded already; the alert is not emitted twice
            metrics.recordPublishFailure();
            log.error("Presenter rejected alert {} for entity {}", alert.dedupKey(), alert.match().entityId(), e);
        }
    }

    static String context(String text, Span span) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int start = Math.max(0, Math.min(span.offset(), text.length()) - CONTEXT_RADIUS);
        int end = Math.min(text.length(), span.offset() + span.text().length() + CONTEXT_RADIUS);
        return text.substring(start, Math.max(start, end)).trim();
    }
}
