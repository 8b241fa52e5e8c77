package com.ofacwatch.screening.relevance;

import com.ofacwatch.screening.domain.RawDocument;
import com.ofacwatch.screening.domain.SourceConfig;
import com.ofacwatch.screening.domain.SourceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("KeywordRelevanceGate")
class KeywordRelevanceGateTest {

    private final KeywordRelevanceGate gate = new KeywordRelevanceGate(List.of("Sanctions", "lavado de activos"));

    private static SourceConfig source(List<String> keywords) {
        return new SourceConfig("src", SourceType.RSS, "https://example.org/rss", Duration.ofMinutes(3), keywords);
    }

    private static RawDocument document(String text) {
        return new RawDocument("src", text, "https://example.org/a", null);
    }

    @Test
    @DisplayName("Should match global keywords case-insensitively")
    void shouldMatchGlobalKeywords() {
        assertThat(gate.isRelevant(document("Treasury announces new SANCTIONS on ..."), source(List.of()))).isTrue();
        assertThat(gate.isRelevant(document("Fiscalía investiga Lavado de Activos"), source(List.of()))).isTrue();
        assertThat(gate.isRelevant(document("Local team wins the cup"), source(List.of()))).isFalse();
    }

    @Test
    @DisplayName("Should use the source's own filters instead of the global list")
    void shouldPreferSourceKeywords() {
        SourceConfig source = source(List.of("indicted"));

        assertThat(gate.isRelevant(document("Businessman indicted in Miami"), source)).isTrue();
        assertThat(gate.isRelevant(document("New sanctions announced"), source)).isFalse();
    }

    @Test
    @DisplayName("Should treat nothing as relevant when no keywords are configured")
    void shouldRejectWithoutKeywords() {
        KeywordRelevanceGate empty = new KeywordRelevanceGate(List.of());

        assertThat(empty.isRelevant(document("sanctions"), source(List.of()))).isFalse();
    }
}
