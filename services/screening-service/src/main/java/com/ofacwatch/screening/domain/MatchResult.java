package com.ofacwatch.screening.domain;

import java.util.List;

/**
 * Outcome of scoring a mention against the index.
 *
 * @param entityId    best matching entity, null when no candidate was found
 * @param entityName  primary name of the best entity
 * @param score       best score in [0,1]
 * @param aliasScores per-alias scores of the best entity, kept for audit
 * @param label       classification
 */
public record MatchResult(
        String entityId,
        String entityName,
        double score,
        List<AliasScore> aliasScores,
        MatchLabel label
) {

    public MatchResult {
        aliasScores = aliasScores == null ? List.of() : List.copyOf(aliasScores);
        label = label == null ? MatchLabel.NONE : label;
    }

    public static MatchResult none() {
        return new MatchResult(null, null, 0.0, List.of(), MatchLabel.NONE);
    }

    public boolean hasEntity() {
        return entityId != null;
    }
}
