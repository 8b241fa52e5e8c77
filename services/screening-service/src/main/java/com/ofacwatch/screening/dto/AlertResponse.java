package com.ofacwatch.screening.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ofacwatch.screening.domain.AlertRecord;
import com.ofacwatch.screening.domain.MatchLabel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AlertResponse {

    private String dedupKey;
    private MatchLabel label;
    private String labelText;
    private String candidate;
    private String normalizedName;
    private String entityId;
    private String entityName;
    private double score;
    private String sourceId;
    private String url;
    private Instant publishedAt;
    private String context;
    private boolean keywordRelevant;
    private Instant firstSeenAt;

    public static AlertResponse from(AlertRecord alert) {
        return AlertResponse.builder()
                .dedupKey(alert.dedupKey())
                .label(alert.match().label())
                .labelText(alert.match().label().getDisplayName())
                .candidate(alert.mention().rawText())
                .normalizedName(alert.mention().normalizedName())
                .entityId(alert.match().entityId())
                .entityName(alert.match().entityName())
                .score(alert.match().score())
                .sourceId(alert.mention().sourceId())
                .url(alert.mention().url())
                .publishedAt(alert.mention().publishedAt())
                .context(alert.mention().context())
                .keywordRelevant(alert.mention().keywordRelevant())
                .firstSeenAt(alert.firstSeenAt())
                .build();
    }
}
