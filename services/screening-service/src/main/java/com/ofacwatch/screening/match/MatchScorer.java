package com.ofacwatch.screening.match;

import com.ofacwatch.screening.domain.AliasScore;
import com.ofacwatch.screening.domain.SanctionEntity;
import com.ofacwatch.screening.index.IndexedEntity;
import com.ofacwatch.screening.normalize.NameNormalizer;
import org.apache.commons.text.similarity.LevenshteinDistance;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scores a normalized name against every name of an entity.
 *
 * <p>The entity score is the maximum over its names: one matching alias is evidence enough,
 * and entities with many unrelated aliases are not diluted. Name similarity is the larger of
 * the Levenshtein ratio {@code 1 - distance / maxLength} on the raw strings and on their
 * token-sorted forms. Identical names score 1.0; an empty side scores 0.0.</p>
 */
public class MatchScorer {

    private final LevenshteinDistance levenshtein = LevenshteinDistance.getDefaultInstance();
    private final NameNormalizer normalizer;

    public MatchScorer(NameNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Score against an entity whose names are not yet normalized.
     */
    public double score(String normalizedName, SanctionEntity entity) {
        if (entity == null) {
            return 0.0;
        }
        Set<String> names = new LinkedHashSet<>();
        for (String name : entity.allNames()) {
            String normalized = normalizer.normalize(name);
            if (!normalized.isEmpty()) {
                names.add(normalized);
            }
        }
        return best(scoreAliases(normalizedName, new ArrayList<>(names)));
    }

    public double score(String normalizedName, IndexedEntity entity) {
        return best(scoreAliases(normalizedName, entity.normalizedNames()));
    }

    /**
     * Per-name scores in the entity's name order.
     */
    public List<AliasScore> scoreAliases(String normalizedName, List<String> normalizedNames) {
        List<AliasScore> scores = new ArrayList<>(normalizedNames.size());
        for (String alias : normalizedNames) {
            scores.add(new AliasScore(alias, similarity(normalizedName, alias)));
        }
        return scores;
    }

    public double similarity(String left, String right) {
        if (left == null || right == null || left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        if (left.equals(right)) {
            return 1.0;
        }
        double direct = ratio(left, right);
        double sorted = ratio(sortTokens(left), sortTokens(right));
        return Math.max(direct, sorted);
    }

    public static double best(List<AliasScore> scores) {
        double best = 0.0;
        for (AliasScore score : scores) {
            best = Math.max(best, score.score());
        }
        return best;
    }

    private double ratio(String left, String right) {
        int maxLength = Math.max(left.length(), right.length());
        int distance = levenshtein.apply(left, right);
        return Math.max(0.0, 1.0 - (double) distance / maxLength);
    }

    private static String sortTokens(String value) {
        String[] tokens = value.split(" ");
        Arrays.sort(tokens);
        return String.join(" ", tokens);
    }
}
