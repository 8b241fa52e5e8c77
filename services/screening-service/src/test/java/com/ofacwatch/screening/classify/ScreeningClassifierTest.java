package com.ofacwatch.screening.classify;

import com.ofacwatch.screening.domain.MatchLabel;
import com.ofacwatch.screening.exception.InvalidThresholdConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScreeningClassifier")
class ScreeningClassifierTest {

    @ParameterizedTest(name = "score {0}, relevant {1} -> {2}")
    @CsvSource({
            "1.0,  false, MATCH",
            "0.92, false, MATCH",
            "0.91, true,  CANDIDATE",
            "0.91, false, NONE",
            "0.75, true,  CANDIDATE",
            "0.74, true,  NONE",
            "0.0,  true,  NONE"
    })
    @DisplayName("Should label scores against the thresholds")
    void shouldLabelScores(double score, boolean relevant, MatchLabel expected) throws Exception {
        ScreeningClassifier classifier = new ScreeningClassifier(0.92, 0.75);

        assertThat(classifier.classify(score, new ClassificationContext(relevant))).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should never lower the label when the score rises")
    void shouldBeMonotonic() throws Exception {
        ScreeningClassifier classifier = new ScreeningClassifier(0.9, 0.6);
        MatchLabel previous = MatchLabel.NONE;

        for (int i = 0; i <= 100; i++) {
            MatchLabel label = classifier.classify(i / 100.0, ClassificationContext.relevant());
            assertThat(label.compareTo(previous)).isGreaterThanOrEqualTo(0);
            previous = label;
        }
    }

    @ParameterizedTest
    @CsvSource({"0.75, 0.75", "0.7, 0.8", "1.1, 0.5", "0.9, -0.1", "NaN, 0.5", "0.9, NaN"})
    @DisplayName("Should reject thresholds outside 0 <= low < high <= 1")
    void shouldRejectInvalidThresholds(double high, double low) {
        assertThatThrownBy(() -> new ScreeningClassifier(high, low))
                .isInstanceOf(InvalidThresholdConfigException.class);
    }
}
