package com.ofacwatch.screening.classify;

import com.ofacwatch.screening.domain.MatchLabel;
import com.ofacwatch.screening.exception.InvalidThresholdConfigException;
import lombok.Getter;

/**
 * Maps a best score to a label.
 *
 * <ul>
 *   <li>{@code score >= high}: MATCH</li>
 *   <li>{@code low <= score < high}: CANDIDATE if the context is keyword relevant, NONE otherwise</li>
 *   <li>{@code score < low}: NONE</li>
 * </ul>
 */
@Getter
public class ScreeningClassifier {

    private final double highThreshold;
    private final double lowThreshold;

    /**
     * @throws InvalidThresholdConfigException unless {@code 0 <= low < high <= 1}
     */
    public ScreeningClassifier(double highThreshold, double lowThreshold) throws InvalidThresholdConfigException {
        boolean valid = lowThreshold >= 0.0
                && highThreshold <= 1.0
                && lowThreshold < highThreshold;
        if (!valid) {
            throw new InvalidThresholdConfigException(highThreshold, lowThreshold);
        }
        this.highThreshold = highThreshold;
        this.lowThreshold = lowThreshold;
    }

    public MatchLabel classify(double score, ClassificationContext context) {
        if (score >= highThreshold) {
            return MatchLabel.MATCH;
        }
        if (score >= lowThreshold && context != null && context.keywordRelevant()) {
            return MatchLabel.CANDIDATE;
        }
        return MatchLabel.NONE;
    }
}
