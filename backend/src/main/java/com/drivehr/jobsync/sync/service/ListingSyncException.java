package com.drivehr.jobsync.sync.service;

/**
 * A reconciliation batch failed as a whole. Work done in the failed phase has been rolled back.
 */
public class ListingSyncException extends RuntimeException {

    public enum Phase {
        UPSERT,
        REMOVAL
    }

    private final Phase phase;

    public ListingSyncException(Phase phase, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
    }

    public Phase getPhase() {
        return phase;
    }
}
