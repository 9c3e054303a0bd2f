package com.whereq.augur.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.augur.config.AugurProperties;
import com.whereq.augur.exception.IllegalTransitionException;
import com.whereq.augur.exception.JobAlreadyFinishedException;
import com.whereq.augur.exception.JobNotFoundException;
import com.whereq.augur.model.Job;
import com.whereq.augur.model.JobStatus;
import com.whereq.augur.model.JobTransition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Job records in Redis, one hash per job.
 *
 * Hash fields: {@code status}, {@code tenant}, {@code version}, {@code job} (JSON document)
 * and {@code cancel}. Every write goes through a Lua script so status, version and the
 * pending indexes change together.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class RedisJobStore implements JobStore {

    private static final String FIELD_JOB = "job";
    private static final String FIELD_CANCEL = "cancel";

    private final ReactiveRedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final RedisKeys keys;
    private final Clock clock;
    private final Duration retention;

    public RedisJobStore(ReactiveRedisTemplate<String, String> redisTemplate,
                         ObjectMapper objectMapper,
                         RedisKeys keys,
                         Clock clock,
                         AugurProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.keys = keys;
        this.clock = clock;
        this.retention = properties.getStore().getRetention();
    }

    @Override
    public Mono<String> create(Job job) {
        return Mono.fromCallable(() -> serialize(job))
            .flatMap(json -> redisTemplate.execute(RedisScripts.JOB_CREATE,
                    List.of(keys.job(job.getId()), keys.pending(), keys.pending(job.getTenantId())),
                    List.of(job.getId(), job.getStatus().name(), job.getTenantId(),
                        String.valueOf(job.getVersion()), json, ttlSeconds()))
                .next())
            .flatMap(created -> created == 1L
                ? Mono.just(job.getId())
                : Mono.<String>error(new IllegalStateException("Job " + job.getId() + " already exists")))
            .doOnSuccess(id -> log.info("Created job {} ({}, plugin={}) for tenant {}",
                id, job.getKind(), job.getPluginName(), job.getTenantId()));
    }

    @Override
    public Mono<Job> get(String jobId, String tenantId) {
        return findById(jobId)
            .filter(job -> job.isOwnedBy(tenantId))
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException("Job not found: " + jobId)));
    }

    @Override
    public Mono<Job> findById(String jobId) {
        return redisTemplate.<String, String>opsForHash()
            .entries(keys.job(jobId))
            .collectMap(Map.Entry::getKey, Map.Entry::getValue)
            .filter(fields -> fields.containsKey(FIELD_JOB))
            .map(this::toJob);
    }

    @Override
    public Mono<Job> updateStatus(String jobId, JobTransition transition) {
        return findById(jobId)
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException("Job not found: " + jobId)))
            .flatMap(current -> {
                Job next = current.apply(transition, clock.instant());
                return redisTemplate.execute(RedisScripts.JOB_TRANSITION,
                        List.of(keys.job(jobId), keys.pending(), keys.pending(current.getTenantId())),
                        List.of(jobId, String.valueOf(current.getVersion()), String.valueOf(next.getVersion()),
                            next.getStatus().name(), serialize(next), ttlSeconds()))
                    .next()
                    .flatMap(outcome -> {
                        if (outcome == 1L) {
                            return Mono.just(next);
                        }
                        if (outcome == -1L) {
                            return Mono.error(new JobNotFoundException("Job not found: " + jobId));
                        }
                        return Mono.error(IllegalTransitionException.concurrentModification(jobId, current.getVersion()));
                    });
            })
            .doOnSuccess(job -> log.info("Job {} status updated: {}", jobId, job.getStatus()));
    }

    @Override
    public Flux<Job> listPending(String tenantId) {
        String indexKey = tenantId == null ? keys.pending() : keys.pending(tenantId);

        return redisTemplate.opsForSet()
            .members(indexKey)
            .concatMap(jobId -> findById(jobId)
                .switchIfEmpty(Mono.defer(() -> {
                    // record expired, drop the stale index entry
                    log.debug("Removing expired job {} from pending index {}", jobId, indexKey);
                    return redisTemplate.opsForSet().remove(indexKey, jobId).then(Mono.empty());
                })))
            .filter(job -> job.getStatus() == JobStatus.PENDING)
            .filter(job -> tenantId == null || job.isOwnedBy(tenantId))
            .sort((a, b) -> a.getCreatedAt().compareTo(b.getCreatedAt()));
    }

    @Override
    public Mono<Job> requestCancel(String jobId, String tenantId) {
        return get(jobId, tenantId)
            .flatMap(job -> redisTemplate.execute(RedisScripts.JOB_CANCEL, List.of(keys.job(jobId)), List.of())
                .next()
                .flatMap(outcome -> {
                    if (outcome == 1L) {
                        job.setCancelRequested(true);
                        return Mono.just(job);
                    }
                    if (outcome == -1L) {
                        return Mono.error(new JobNotFoundException("Job not found: " + jobId));
                    }
                    return Mono.error(new JobAlreadyFinishedException(jobId, job.getStatus()));
                }))
            .doOnSuccess(job -> log.info("Cancellation requested for job {} by tenant {}", jobId, tenantId));
    }

    private Job toJob(Map<String, String> fields) {
        try {
            Job job = objectMapper.readValue(fields.get(FIELD_JOB), Job.class);
            job.setCancelRequested(job.isCancelRequested() || "1".equals(fields.get(FIELD_CANCEL)));
            return job;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize job record", e);
        }
    }

    private String serialize(Job job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job " + job.getId(), e);
        }
    }

    private String ttlSeconds() {
        return String.valueOf(retention.toSeconds());
    }
}
