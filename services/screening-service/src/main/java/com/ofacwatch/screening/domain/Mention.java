package com.ofacwatch.screening.domain;

import java.time.Instant;

/**
 * One extracted name occurrence. Transient unless it becomes part of an alert.
 *
 * @param keywordRelevant whether the containing document passed the keyword relevance gate
 */
public record Mention(
        String rawText,
        String normalizedName,
        String sourceItemId,
        String sourceId,
        String url,
        Instant publishedAt,
        String context,
        int offset,
        boolean keywordRelevant
) {
}
