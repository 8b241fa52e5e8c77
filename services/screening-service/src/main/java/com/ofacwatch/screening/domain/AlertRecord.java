package com.ofacwatch.screening.domain;

import java.time.Instant;

/**
 * Persisted unit of output. At most one exists per dedup key.
 */
public record AlertRecord(String dedupKey, Mention mention, MatchResult match, Instant firstSeenAt) {
}
