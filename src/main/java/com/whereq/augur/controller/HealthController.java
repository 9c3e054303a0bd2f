package com.whereq.augur.controller;

import com.whereq.augur.queue.JobQueue;
import com.whereq.augur.worker.WorkerPool;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness endpoint at the root path, for Kubernetes probes.
 *
 * Reports {@code healthy} when Redis answers and the worker pool (if enabled) has live
 * threads, {@code degraded} otherwise. Always answers 200 so a Redis outage does not
 * restart every replica.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("/health")
@Tag(name = "Health", description = "Service health check endpoints")
public class HealthController {

    private static final Duration REDIS_CHECK_TIMEOUT = Duration.ofSeconds(2);

    @Autowired
    private JobQueue jobQueue;

    @Autowired
    private WorkerPool workerPool;

    @Value("${augur.service-name:intelligence-module}")
    private String serviceName;

    @Value("${augur.service-version:dev}")
    private String serviceVersion;

    @GetMapping
    @Operation(summary = "Health check", description = "Check that Redis is reachable and workers are running")
    public Mono<ResponseEntity<Map<String, Object>>> health() {
        return jobQueue.size()
            .timeout(REDIS_CHECK_TIMEOUT)
            .map(size -> {
                Map<String, Object> redis = new LinkedHashMap<>();
                redis.put("status", "CONNECTED");
                redis.put("queue_size", size);
                return redis;
            })
            .onErrorResume(e -> {
                Map<String, Object> redis = new LinkedHashMap<>();
                redis.put("status", "ERROR");
                redis.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
                return Mono.just(redis);
            })
            .map(redis -> {
                Map<String, Object> workers = new LinkedHashMap<>();
                workers.put("running", workerPool.isRunning());
                workers.put("configured", workerPool.getConfiguredWorkers());
                workers.put("alive", workerPool.getAliveWorkers());

                boolean redisUp = "CONNECTED".equals(redis.get("status"));
                boolean workersUp = !workerPool.isRunning() || workerPool.getAliveWorkers() > 0;

                Map<String, Object> health = new LinkedHashMap<>();
                health.put("status", redisUp && workersUp ? "healthy" : "degraded");
                health.put("service", serviceName);
                health.put("version", serviceVersion);
                health.put("redis", redis);
                health.put("workers", workers);
                return ResponseEntity.ok(health);
            });
    }
}
