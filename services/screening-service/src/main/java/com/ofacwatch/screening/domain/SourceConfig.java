package com.ofacwatch.screening.domain;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Polling configuration of a single source.
 */
public record SourceConfig(
        String sourceId,
        SourceType type,
        String url,
        Duration fetchInterval,
        List<String> keywordFilters
) {

    public SourceConfig {
        Objects.requireNonNull(sourceId, "sourceId");
        type = type == null ? SourceType.RSS : type;
        keywordFilters = keywordFilters == null ? List.of() : List.copyOf(keywordFilters);
    }
}
