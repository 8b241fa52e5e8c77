package com.ofacwatch.screening.search;

import com.ofacwatch.screening.domain.EntityKind;

import java.util.List;

/**
 * @param matchedName normalized entity name that scored best against the query
 */
public record SearchHit(
        String entityId,
        String primaryName,
        String matchedName,
        double score,
        EntityKind kind,
        List<String> programs
) {
}
