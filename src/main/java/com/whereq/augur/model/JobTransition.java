package com.whereq.augur.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A requested status change together with the data that travels with it
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobTransition {

    private final JobStatus target;

    private final JobResult result;

    private final JobError error;

    private final Instant leaseExpiresAt;

    /**
     * Claim the job for execution until {@code leaseExpiresAt}
     */
    public static JobTransition claim(Instant leaseExpiresAt) {
        return new JobTransition(JobStatus.RUNNING, null, null, leaseExpiresAt);
    }

    public static JobTransition complete(JobResult result) {
        return new JobTransition(JobStatus.COMPLETED, result, null, null);
    }

    public static JobTransition fail(JobError error) {
        return new JobTransition(JobStatus.FAILED, null, error, null);
    }

    public static JobTransition fail(ErrorKind kind, String message) {
        return fail(JobError.of(kind, message));
    }
}
