package com.ofacwatch.screening.match;

import com.ofacwatch.screening.domain.AliasScore;
import com.ofacwatch.screening.domain.EntityKind;
import com.ofacwatch.screening.domain.SanctionEntity;
import com.ofacwatch.screening.normalize.NameNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("MatchScorer")
class MatchScorerTest {

    private final MatchScorer scorer = new MatchScorer(new NameNormalizer());

    private final SanctionEntity smith = new SanctionEntity(
            "E1", "John Smith", List.of("Johnny Smith", "SMITH, J."), EntityKind.PERSON, null);

    @Test
    @DisplayName("Should score an exact alias match as 1.0")
    void shouldScoreExactMatch() {
        assertThat(scorer.score("john smith", smith)).isEqualTo(1.0);
        assertThat(scorer.score("johnny smith", smith)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should score a near spelling between the thresholds")
    void shouldScoreNearSpelling() {
        double score = scorer.score("jon smyth", smith);

        assertThat(score).isCloseTo(0.8, within(1e-9));
    }

    @Test
    @DisplayName("Should ignore token order")
    void shouldIgnoreTokenOrder() {
        assertThat(scorer.similarity("smith john", "john smith")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should be symmetric and bounded")
    void shouldBeSymmetric() {
        double forward = scorer.similarity("maria lopez", "mario lopes");
        double backward = scorer.similarity("mario lopes", "maria lopez");

        assertThat(forward).isEqualTo(backward).isBetween(0.0, 1.0);
    }

    @Test
    @DisplayName("Should score empty names as 0.0")
    void shouldScoreEmptyAsZero() {
        assertThat(scorer.similarity("", "john smith")).isZero();
        assertThat(scorer.score("", smith)).isZero();
    }

    @Test
    @DisplayName("Should take the maximum over aliases and report each of them")
    void shouldTakeMaximumOverAliases() {
        List<AliasScore> scores = scorer.scoreAliases("johnny smith", List.of("john smith", "johnny smith"));

        assertThat(scores).extracting(AliasScore::alias).containsExactly("john smith", "johnny smith");
        assertThat(scores.get(0).score()).isLessThan(1.0);
        assertThat(MatchScorer.best(scores)).isEqualTo(1.0);
    }
}
