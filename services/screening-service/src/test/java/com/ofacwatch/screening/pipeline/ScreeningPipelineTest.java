package com.ofacwatch.screening.pipeline;

import com.ofacwatch.common.exception.ErrorCode;
import com.ofacwatch.screening.classify.ClassificationContext;
import com.ofacwatch.screening.classify.ScreeningClassifier;
import com.ofacwatch.screening.dedup.DedupKeys;
import com.ofacwatch.screening.dedup.InMemoryDedupStore;
import com.ofacwatch.screening.domain.AlertRecord;
import com.ofacwatch.screening.domain.EntityKind;
import com.ofacwatch.screening.domain.MatchLabel;
import com.ofacwatch.screening.domain.MatchResult;
import com.ofacwatch.screening.domain.Mention;
import com.ofacwatch.screening.domain.RawDocument;
import com.ofacwatch.screening.domain.SanctionEntity;
import com.ofacwatch.screening.domain.SourceConfig;
import com.ofacwatch.screening.domain.SourceType;
import com.ofacwatch.screening.exception.ExtractionException;
import com.ofacwatch.screening.exception.FetchException;
import com.ofacwatch.screening.extract.CapitalizedNameExtractor;
import com.ofacwatch.screening.extract.EntityExtractor;
import com.ofacwatch.screening.index.SanctionsIndex;
import com.ofacwatch.screening.index.TokenPhoneticBlockingKeyStrategy;
import com.ofacwatch.screening.match.MatchScorer;
import com.ofacwatch.screening.metrics.ScreeningMetrics;
import com.ofacwatch.screening.normalize.NameNormalizer;
import com.ofacwatch.screening.presenter.Presenter;
import com.ofacwatch.screening.relevance.KeywordRelevanceGate;
import com.ofacwatch.screening.source.SourceFetcher;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScreeningPipeline")
class ScreeningPipelineTest {

    private static final SourceConfig SOURCE = new SourceConfig(
            "bbc-world", SourceType.RSS, "https://example.org/rss", Duration.ofMinutes(3), List.of());

    private final NameNormalizer normalizer = new NameNormalizer();
    private final InMemoryDedupStore dedupStore = new InMemoryDedupStore();
    private final List<AlertRecord> published = new ArrayList<>();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private TimeBoundedInvoker invoker;
    private SanctionsIndex index;

    @BeforeEach
    void setUp() throws Exception {
        TimeLimiterRegistry registry = TimeLimiterRegistry.ofDefaults();
        registry.timeLimiter(TimeBoundedInvoker.FETCH,
                TimeLimiterConfig.custom().timeoutDuration(Duration.ofMillis(200)).build());
        registry.timeLimiter(TimeBoundedInvoker.EXTRACTION,
                TimeLimiterConfig.custom().timeoutDuration(Duration.ofMillis(200)).build());
        invoker = new TimeBoundedInvoker(registry, "test-worker-");

        index = SanctionsIndex.build(List.of(
                new SanctionEntity("E1", "John Smith", List.of("Johnny Smith"), EntityKind.PERSON, null),
                new SanctionEntity("V1", "Maria Lopez", List.of(), EntityKind.VESSEL, null)),
                normalizer, new TokenPhoneticBlockingKeyStrategy(), 1);
    }

    @AfterEach
    void tearDown() {
        invoker.shutdown();
    }

    private ScreeningPipeline pipeline(SourceFetcher fetcher, EntityExtractor extractor, Presenter presenter)
            throws Exception {
        return ScreeningPipeline.builder()
                .fetcher(fetcher)
                .extractor(extractor)
                .relevanceGate(new KeywordRelevanceGate(List.of("sanctions")))
                .normalizer(normalizer)
                .scorer(new MatchScorer(normalizer))
                .classifier(new ScreeningClassifier(0.9, 0.75))
                .dedupStore(dedupStore)
                .presenter(presenter)
                .metrics(new ScreeningMetrics(meterRegistry))
                .invoker(invoker)
                .screenedKinds(Set.of(EntityKind.PERSON))
                .build();
    }

    private ScreeningPipeline pipeline() throws Exception {
        return pipeline(source -> List.of(), new CapitalizedNameExtractor(), published::add);
    }

    @Nested
    @DisplayName("Screening")
    class Screening {

        @Test
        @DisplayName("Should label an exact alias hit as a possible OFAC match")
        void shouldMatchExactName() throws Exception {
            MatchResult result = pipeline().screen("john smith", ClassificationContext.notRelevant(), index);

            assertThat(result.entityId()).isEqualTo("E1");
            assertThat(result.score()).isEqualTo(1.0);
            assertThat(result.label()).isEqualTo(MatchLabel.MATCH);
            assertThat(result.aliasScores()).hasSize(2);
        }

        @Test
        @DisplayName("Should label a near spelling as a candidate only in a relevant context")
        void shouldGateCandidateOnContext() throws Exception {
            ScreeningPipeline pipeline = pipeline();

            MatchResult relevant = pipeline.screen("jon smyth", ClassificationContext.relevant(), index);
            MatchResult notRelevant = pipeline.screen("jon smyth", ClassificationContext.notRelevant(), index);

            assertThat(relevant.score()).isBetween(0.6, 0.85);
            assertThat(relevant.label()).isEqualTo(MatchLabel.CANDIDATE);
            assertThat(notRelevant.label()).isEqualTo(MatchLabel.NONE);
        }

        @Test
        @DisplayName("Should not screen against kinds outside the configured set")
        void shouldSkipUnscreenedKinds() throws Exception {
            MatchResult result = pipeline().screen("maria lopez", ClassificationContext.relevant(), index);

            assertThat(result.hasEntity()).isFalse();
            assertThat(result.label()).isEqualTo(MatchLabel.NONE);
        }

        @Test
        @DisplayName("Should break score ties by the smaller entity id")
        void shouldBreakTiesById() throws Exception {
            SanctionsIndex twins = SanctionsIndex.build(List.of(
                    new SanctionEntity("E9", "John Smith", List.of(), EntityKind.PERSON, null),
                    new SanctionEntity("E2", "John Smith", List.of(), EntityKind.PERSON, null)),
                    normalizer, new TokenPhoneticBlockingKeyStrategy(), 2);

            MatchResult result = pipeline().screen("john smith", ClassificationContext.relevant(), twins);

            assertThat(result.entityId()).isEqualTo("E2");
        }
    }

    @Nested
    @DisplayName("Extraction")
    class Extraction {

        @Test
        @DisplayName("Should produce normalized mentions with context and relevance")
        void shouldProduceMentions() throws Exception {
            RawDocument document = new RawDocument("bbc-world",
                    "New sanctions name John Smith. Officials said John Smith fled.", "https://example.org/1", null);

            List<Mention> mentions = pipeline().extract(SOURCE, List.of(document));

            assertThat(mentions).singleElement().satisfies(mention -> {
                assertThat(mention.rawText()).isEqualTo("John Smith");
                assertThat(mention.normalizedName()).isEqualTo("john smith");
                assertThat(mention.sourceItemId()).isEqualTo(document.itemId());
                assertThat(mention.keywordRelevant()).isTrue();
                assertThat(mention.context()).contains("John Smith");
                assertThat(mention.offset()).isEqualTo(document.text().indexOf("John Smith"));
            });
        }

        @Test
        @DisplayName("Should fail the batch when extraction fails")
        void shouldFailOnExtractionError() throws Exception {
            EntityExtractor broken = text -> {
                throw new IllegalStateException("model not loaded");
            };
            ScreeningPipeline pipeline = pipeline(source -> List.of(), broken, published::add);
            RawDocument document = new RawDocument("bbc-world", "John Smith", "https://example.org/1", null);

            assertThatThrownBy(() -> pipeline.extract(SOURCE, List.of(document)))
                    .isInstanceOf(ExtractionException.class)
                    .hasMessageContaining("model not loaded");
        }

        @Test
        @DisplayName("Should fail the batch when extraction exceeds its time limit")
        void shouldFailOnExtractionTimeout() throws Exception {
            EntityExtractor slow = text -> {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of();
            };
            ScreeningPipeline pipeline = pipeline(source -> List.of(), slow, published::add);
            RawDocument document = new RawDocument("bbc-world", "John Smith", "https://example.org/1", null);

            assertThatThrownBy(() -> pipeline.extract(SOURCE, List.of(document)))
                    .isInstanceOf(ExtractionException.class)
                    .satisfies(e -> assertThat(((ExtractionException) e).getErrorCode())
                            .isEqualTo(ErrorCode.EXT_EXTRACTION_TIMEOUT));
        }
    }

    @Test
    @DisplayName("Should turn a fetch that outlives its limit into a fetch timeout")
    void shouldTimeOutSlowFetch() throws Exception {
        SourceFetcher slow = source -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        };
        ScreeningPipeline pipeline = pipeline(slow, new CapitalizedNameExtractor(), published::add);

        assertThatThrownBy(() -> pipeline.fetch(SOURCE))
                .isInstanceOf(FetchException.class)
                .satisfies(e -> assertThat(((FetchException) e).getErrorCode()).isEqualTo(ErrorCode.SRC_FETCH_TIMEOUT));
    }

    @Nested
    @DisplayName("Emission")
    class Emission {

        private ScreenedMention screened(ScreeningPipeline pipeline) {
            Mention mention = new Mention("John Smith", "john smith", "item-1", "bbc-world",
                    "https://example.org/1", null, "John Smith", 0, true);
            return new ScreenedMention(mention,
                    pipeline.screen("john smith", ClassificationContext.relevant(), index));
        }

        @Test
        @DisplayName("Should emit one alert per item and entity, however often it is seen")
        void shouldEmitOnce() throws Exception {
            ScreeningPipeline pipeline = pipeline();
            ScreenedMention item = screened(pipeline);

            assertThat(pipeline.emit(List.of(item))).isEqualTo(1);
            assertThat(pipeline.emit(List.of(item))).isZero();

            assertThat(published).hasSize(1);
            assertThat(dedupStore.find(DedupKeys.of("item-1", "E1"))).isPresent();
            assertThat(meterRegistry.counter("ofacwatch.alerts.duplicates.total").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should keep the dedup record when the presenter fails")
        void shouldSurvivePresenterFailure() throws Exception {
            ScreeningPipeline pipeline = pipeline(source -> List.of(), new CapitalizedNameExtractor(), alert -> {
                throw new IllegalStateException("feed closed");
            });

            assertThat(pipeline.emit(List.of(screened(pipeline)))).isEqualTo(1);

            assertThat(dedupStore.size()).isEqualTo(1);
            assertThat(meterRegistry.counter("ofacwatch.alerts.publish.failures.total").count()).isEqualTo(1.0);
        }
    }
}
