package com.whereq.augur.queue;

import com.whereq.augur.model.Delivery;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * At-least-once hand-off of job references from intake to workers
 */
public interface JobQueue {
    /**
     * Enqueue a job reference
     *
     * @param jobId the job to enqueue
     * @return Mono that completes when the reference is stored
     */
    Mono<Void> enqueue(String jobId);

    /**
     * Take the next job reference, blocking up to {@code blockingTimeout}.
     * The reference stays in flight until acknowledged and becomes visible to
     * other workers again once its visibility timeout passes.
     *
     * @param blockingTimeout how long to wait for a reference
     * @return Mono with the delivery, empty if none arrived in time
     */
    Mono<Delivery> dequeue(Duration blockingTimeout);

    /**
     * Acknowledge that a delivery was fully processed
     *
     * @param delivery the delivery to settle
     * @return Mono that completes when the reference is removed for good
     */
    Mono<Void> acknowledge(Delivery delivery);

    /**
     * Return in-flight references whose visibility timeout passed to the queue
     *
     * @return Mono with the number of requeued references
     */
    Mono<Long> requeueExpired();

    /**
     * Get current queue size
     *
     * @return Mono with queue size
     */
    Mono<Long> size();

    /**
     * Check if queue is full
     *
     * @param maxSize maximum allowed size
     * @return Mono with true if queue is full
     */
    default Mono<Boolean> isFull(long maxSize) {
        return size().map(s -> s >= maxSize);
    }
}
