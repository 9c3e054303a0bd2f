package com.whereq.augur.model;

import com.whereq.augur.exception.IllegalTransitionException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable record of one analysis job
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {
    /**
     * Unique job identifier
     */
    private String id;

    /**
     * Tenant that owns the job
     */
    private String tenantId;

    private JobKind kind;

    /**
     * Registry name of the plugin to execute
     */
    private String pluginName;

    private JobPayload payload;

    private JobStatus status;

    /**
     * Present only when COMPLETED
     */
    private JobResult result;

    /**
     * Present only when FAILED
     */
    private JobError error;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant startedAt;

    private Instant completedAt;

    /**
     * Number of times a worker claimed the job
     */
    private int attempts;

    /**
     * End of the current claim while RUNNING
     */
    private Instant leaseExpiresAt;

    /**
     * Set by the owner, honoured before execution starts
     */
    private boolean cancelRequested;

    /**
     * Optimistic concurrency counter, incremented on every stored transition
     */
    private long version;

    /**
     * Create a new PENDING job
     */
    public static Job newPending(String id, String tenantId, JobKind kind, String pluginName,
                                 JobPayload payload, Instant now) {
        return Job.builder()
            .id(id)
            .tenantId(tenantId)
            .kind(kind)
            .pluginName(pluginName)
            .payload(payload)
            .status(JobStatus.PENDING)
            .createdAt(now)
            .updatedAt(now)
            .version(1)
            .build();
    }

    public boolean isOwnedBy(String tenant) {
        return tenantId != null && tenantId.equals(tenant);
    }

    /**
     * True while RUNNING and the claim lease has not run out
     */
    public boolean isLeaseActive(Instant now) {
        return status == JobStatus.RUNNING && leaseExpiresAt != null && now.isBefore(leaseExpiresAt);
    }

    /**
     * Apply a transition and return the resulting job; this instance is left untouched.
     *
     * @throws IllegalTransitionException if the move is backwards, repeats a terminal state,
     *                                    or re-claims a job whose lease is still active
     */
    public Job apply(JobTransition transition, Instant now) {
        JobStatus target = transition.getTarget();
        if (!status.canTransitionTo(target)) {
            throw new IllegalTransitionException(id, status, target);
        }
        if (status == JobStatus.RUNNING && target == JobStatus.RUNNING && isLeaseActive(now)) {
            throw new IllegalTransitionException(id, status, target, "lease held until " + leaseExpiresAt);
        }

        JobBuilder next = toBuilder()
            .status(target)
            .updatedAt(now)
            .version(version + 1);

        switch (target) {
            case RUNNING -> {
                if (transition.getLeaseExpiresAt() == null) {
                    throw new IllegalArgumentException("Claim of job " + id + " requires a lease");
                }
                next.attempts(attempts + 1)
                    .leaseExpiresAt(transition.getLeaseExpiresAt());
                if (startedAt == null) {
                    next.startedAt(now);
                }
            }
            case COMPLETED -> {
                if (transition.getResult() == null) {
                    throw new IllegalArgumentException("Completion of job " + id + " requires a result");
                }
                next.result(transition.getResult())
                    .leaseExpiresAt(null)
                    .completedAt(now);
            }
            case FAILED -> {
                if (transition.getError() == null) {
                    throw new IllegalArgumentException("Failure of job " + id + " requires an error");
                }
                next.error(transition.getError())
                    .leaseExpiresAt(null)
                    .completedAt(now);
            }
            default -> throw new IllegalTransitionException(id, status, target);
        }
        return next.build();
    }
}
