package com.whereq.augur.exception;

import com.whereq.augur.model.JobStatus;
import lombok.Getter;

/**
 * Invariant violation: a status change that is backwards, repeats a terminal state,
 * or lost a concurrent compare-and-set on the job record.
 */
@Getter
public class IllegalTransitionException extends IllegalStateException {

    private final String jobId;

    public IllegalTransitionException(String jobId, JobStatus from, JobStatus to) {
        super("Job " + jobId + " cannot move from " + from + " to " + to);
        this.jobId = jobId;
    }

    public IllegalTransitionException(String jobId, JobStatus from, JobStatus to, String reason) {
        super("Job " + jobId + " cannot move from " + from + " to " + to + ": " + reason);
        this.jobId = jobId;
    }

    public static IllegalTransitionException concurrentModification(String jobId, long expectedVersion) {
        return new IllegalTransitionException(jobId,
            "Job " + jobId + " was modified concurrently (expected version " + expectedVersion + ")");
    }

    private IllegalTransitionException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }
}
