package com.ofacwatch.screening.scheduler;

/**
 * Thrown at a phase boundary when the scheduler is stopping.
 */
class CycleCancelledException extends RuntimeException {

    CycleCancelledException(SourceState nextPhase) {
        super("Cycle cancelled before " + nextPhase);
    }
}
