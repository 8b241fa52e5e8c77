package com.ofacwatch.screening.support;

import com.ofacwatch.screening.domain.AliasScore;
import com.ofacwatch.screening.domain.AlertRecord;
import com.ofacwatch.screening.domain.MatchLabel;
import com.ofacwatch.screening.domain.MatchResult;
import com.ofacwatch.screening.domain.Mention;

import java.time.Instant;
import java.util.List;

/**
 * Alert fixtures shared by store, presenter and controller tests.
 */
public final class TestAlerts {

    private TestAlerts() {
    }

    public static Mention mention(String rawText, String normalizedName) {
        return new Mention(rawText, normalizedName, "item-1", "bbc-world", "https://example.org/a",
                Instant.parse("2025-03-01T10:15:30Z"), "... " + rawText + " was sanctioned ...", 4, true);
    }

    public static AlertRecord alert(String dedupKey, MatchLabel label) {
        MatchResult match = new MatchResult("E1", "SMITH, John", label == MatchLabel.MATCH ? 1.0 : 0.8,
                List.of(new AliasScore("john smith", label == MatchLabel.MATCH ? 1.0 : 0.8)), label);
        return new AlertRecord(dedupKey, mention("John Smith", "john smith"), match,
                Instant.parse("2025-03-01T10:16:00Z"));
    }
}
