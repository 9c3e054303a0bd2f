package com.whereq.augur.store;

import com.whereq.augur.model.Job;
import com.whereq.augur.model.JobTransition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable job records shared by intake and every worker instance
 */
public interface JobStore {

    /**
     * Persist a new PENDING job
     *
     * @param job the job to store
     * @return Mono with the job id
     */
    Mono<String> create(Job job);

    /**
     * Load a job on behalf of a tenant
     *
     * @param jobId job identifier
     * @param tenantId tenant presenting the request
     * @return Mono with the job, or an error of {@code JobNotFoundException}
     *         when the id is unknown or owned by another tenant
     */
    Mono<Job> get(String jobId, String tenantId);

    /**
     * Load a job without tenant scoping. Worker side only.
     *
     * @param jobId job identifier
     * @return Mono with the job, empty if unknown
     */
    Mono<Job> findById(String jobId);

    /**
     * Apply a status transition atomically
     *
     * @param jobId job identifier
     * @param transition target status with its result, error or lease
     * @return Mono with the updated job; errors with {@code IllegalTransitionException}
     *         when the transition is not allowed or lost a concurrent update
     */
    Mono<Job> updateStatus(String jobId, JobTransition transition);

    /**
     * List PENDING jobs
     *
     * @param tenantId tenant to filter by, or {@code null} for all tenants
     * @return Flux of pending jobs
     */
    Flux<Job> listPending(String tenantId);

    /**
     * Flag a job for cancellation. Workers honour the flag before execution starts.
     *
     * @param jobId job identifier
     * @param tenantId owning tenant
     * @return Mono with the flagged job; errors with {@code JobAlreadyFinishedException} if the job is terminal
     */
    Mono<Job> requestCancel(String jobId, String tenantId);
}
