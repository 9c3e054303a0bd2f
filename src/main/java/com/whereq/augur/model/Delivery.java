package com.whereq.augur.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One delivery of a job reference from the queue to a worker.
 * The reference stays in flight until the delivery is acknowledged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Delivery {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * When the worker took the reference
     */
    private Instant deliveredAt;

    /**
     * When the reference becomes visible to other workers again unless acknowledged
     */
    private Instant visibleAgainAt;
}
