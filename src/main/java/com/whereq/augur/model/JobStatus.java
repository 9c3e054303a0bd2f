package com.whereq.augur.model;

/**
 * Job lifecycle states
 *
 * State transitions:
 * PENDING → RUNNING → {COMPLETED, FAILED}
 * RUNNING → RUNNING only when a redelivered job is re-claimed after its lease expired
 */
public enum JobStatus {
    /**
     * Created by intake, waiting in the queue
     */
    PENDING,

    /**
     * Claimed by a worker
     */
    RUNNING,

    /**
     * Plugin succeeded and, for predictions, the broker write succeeded
     */
    COMPLETED,

    /**
     * Terminated with a classified error
     */
    FAILED;

    /**
     * Check if this is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Check whether moving from this state to {@code target} is a forward transition.
     * RUNNING → RUNNING is accepted here; callers must additionally prove the previous lease expired.
     */
    public boolean canTransitionTo(JobStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING;
            case RUNNING -> target == RUNNING || target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
