package com.ofacwatch.screening.search;

import com.ofacwatch.screening.domain.AliasScore;
import com.ofacwatch.screening.exception.SnapshotUnavailableException;
import com.ofacwatch.screening.index.Candidate;
import com.ofacwatch.screening.index.IndexLease;
import com.ofacwatch.screening.index.IndexSnapshotManager;
import com.ofacwatch.screening.match.MatchScorer;
import com.ofacwatch.screening.normalize.NameNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Free-text lookup of the sanctions list for operators.
 *
 * <p>Hits below the minimum score are dropped. Hits whose matched names share the same
 * first two tokens are collapsed to the best one, so spelling variants of one listing
 * do not crowd the result.</p>
 */
@Slf4j
@RequiredArgsConstructor
public class SanctionsSearchService {

    public static final int MAX_LIMIT = 50;

    private static final Comparator<SearchHit> HIT_ORDER = Comparator
            .comparingDouble(SearchHit::score).reversed()
            .thenComparing(SearchHit::matchedName)
            .thenComparing(SearchHit::entityId);

    private final IndexSnapshotManager snapshotManager;
    private final NameNormalizer normalizer;
    private final MatchScorer scorer;
    private final double minScore;

    public List<SearchHit> search(String query, int limit) {
        int bounded = Math.max(1, Math.min(limit, MAX_LIMIT));
        String normalized = normalizer.normalize(query);
        if (normalized.isEmpty()) {
            return List.of();
        }

        List<SearchHit> hits = new ArrayList<>();
        try (IndexLease lease = snapshotManager.acquire()) {
            for (Candidate candidate : lease.index().candidates(normalized)) {
                AliasScore best = bestAlias(scorer.scoreAliases(normalized, candidate.indexed().normalizedNames()));
                if (best != null && best.score() >= minScore) {
                    hits.add(new SearchHit(
                            candidate.indexed().id(),
                            candidate.entity().primaryName(),
                            best.alias(),
                            best.score(),
                            candidate.entity().kind(),
                            candidate.entity().listing().programs()));
                }
            }
        } catch (SnapshotUnavailableException e) {
            log.debug("Search for '{}' before any sanctions snapshot was loaded", query);
            return List.of();
        }

        hits.sort(HIT_ORDER);
        return collapseByCoreKey(hits, bounded);
    }

    static String coreKey(String normalizedName) {
        String[] tokens = normalizedName.split(" ");
        return tokens.length < 2 ? tokens[0] : tokens[0] + " " + tokens[1];
    }

    private static List<SearchHit> collapseByCoreKey(List<SearchHit> sorted, int limit) {
        Set<String> seen = new HashSet<>();
        List<SearchHit> result = new ArrayList<>(Math.min(limit, sorted.size()));
        for (SearchHit hit : sorted) {
            if (seen.add(coreKey(hit.matchedName()))) {
                result.add(hit);
                if (result.size() == limit) {
                    break;
                }
            }
        }
        return result;
    }

    private static AliasScore bestAlias(List<AliasScore> scores) {
        AliasScore best = null;
        for (AliasScore score : scores) {
            if (best == null || score.score() > best.score()) {
                best = score;
            }
        }
        return best;
    }
}
