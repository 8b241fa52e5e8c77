package com.ofacwatch.screening.scheduler;

/**
 * Phase a source's polling cycle is in. A source is IDLE between cycles.
 */
public enum SourceState {
    IDLE,
    FETCHING,
    EXTRACTING,
    MATCHING,
    EMITTING
}
