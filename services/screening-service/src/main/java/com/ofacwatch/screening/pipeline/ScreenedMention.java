package com.ofacwatch.screening.pipeline;

import com.ofacwatch.screening.domain.MatchResult;
import com.ofacwatch.screening.domain.Mention;

/**
 * A mention together with its reportable match.
 */
public record ScreenedMention(Mention mention, MatchResult match) {
}
