package com.whereq.augur.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.augur.config.AugurProperties;
import com.whereq.augur.dto.AnalysisRequest;
import com.whereq.augur.dto.JobCancellationResponse;
import com.whereq.augur.dto.JobStatusResponse;
import com.whereq.augur.dto.JobSubmitResponse;
import com.whereq.augur.dto.TimeSeriesSample;
import com.whereq.augur.dto.WebhookRequest;
import com.whereq.augur.exception.QueueFullException;
import com.whereq.augur.exception.ServiceUnavailableException;
import com.whereq.augur.exception.ValidationException;
import com.whereq.augur.model.DataPoint;
import com.whereq.augur.model.Job;
import com.whereq.augur.model.JobKind;
import com.whereq.augur.model.JobPayload;
import com.whereq.augur.model.JobStatus;
import com.whereq.augur.plugin.PluginRegistry;
import com.whereq.augur.queue.JobQueue;
import com.whereq.augur.store.JobStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Intake: validates submissions, creates job records and enqueues them
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class JobSubmissionService {

    private static final Pattern TENANT_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private static final TypeReference<List<TimeSeriesSample>> SAMPLE_LIST = new TypeReference<>() {
    };

    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final PluginRegistry pluginRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AugurProperties properties;
    private final Counter rejectedCounter;

    public JobSubmissionService(JobStore jobStore,
                                JobQueue jobQueue,
                                PluginRegistry pluginRegistry,
                                ObjectMapper objectMapper,
                                Clock clock,
                                AugurProperties properties,
                                MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.jobQueue = jobQueue;
        this.pluginRegistry = pluginRegistry;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
        this.rejectedCounter = Counter.builder("augur.intake.rejected")
            .description("Number of submissions rejected because the queue was full")
            .register(meterRegistry);
    }

    /**
     * Submit an analysis or prediction job
     *
     * @param request job request
     * @param kind analyze or predict
     * @param tenantId tenant from the request header
     * @return Mono with submission response
     */
    public Mono<JobSubmitResponse> submit(AnalysisRequest request, JobKind kind, String tenantId) {
        return Mono.fromCallable(() -> toJob(request, kind, tenantId))
            .flatMap(this::admit)
            .flatMap(job -> jobStore.create(job)
                .retryWhen(storeRetry())
                .then(Mono.defer(() -> jobQueue.enqueue(job.getId())).retryWhen(storeRetry()))
                .thenReturn(job))
            .map(job -> JobSubmitResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .kind(job.getKind())
                .submittedAt(job.getCreatedAt())
                .message(kind.publishesToBroker()
                    ? "Prediction job created. Results will be written to the context broker."
                    : "Analysis job created")
                .build())
            .doOnSuccess(response -> log.info("Job {} submitted successfully by tenant {}",
                response.getJobId(), tenantId))
            .doOnError(e -> log.error("Job submission failed for tenant {}: {}", tenantId, e.getMessage()));
    }

    /**
     * Submit a job from an n8n workflow
     */
    public Mono<JobSubmitResponse> submitWebhook(WebhookRequest request, String tenantId) {
        return Mono.fromCallable(() -> fromWebhook(request))
            .flatMap(analysis -> submit(analysis, parseKind(request.getAnalysisType()), tenantId));
    }

    /**
     * Poll a job on behalf of a tenant
     */
    public Mono<JobStatusResponse> getJob(String jobId, String tenantId) {
        return Mono.fromRunnable(() -> validateTenant(tenantId))
            .then(Mono.defer(() -> jobStore.get(jobId, tenantId)).retryWhen(storeRetry()))
            .map(JobStatusResponse::from);
    }

    /**
     * List a tenant's PENDING jobs
     */
    public Flux<JobStatusResponse> listPending(String tenantId) {
        return Mono.fromRunnable(() -> validateTenant(tenantId))
            .thenMany(Flux.defer(() -> jobStore.listPending(tenantId)).retryWhen(storeRetry()))
            .map(JobStatusResponse::from);
    }

    /**
     * Request cancellation of a job. Running plugins are not interrupted.
     */
    public Mono<JobCancellationResponse> cancelJob(String jobId, String tenantId) {
        return Mono.fromRunnable(() -> validateTenant(tenantId))
            .then(Mono.defer(() -> jobStore.requestCancel(jobId, tenantId)).retryWhen(storeRetry()))
            .map(job -> JobCancellationResponse.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .cancelRequested(true)
                .requestedAt(clock.instant())
                .message(job.getStatus() == JobStatus.PENDING
                    ? "Job will be cancelled before execution"
                    : "Cancellation requested; a plugin that already started runs to completion")
                .build())
            .doOnSuccess(response -> log.info("Job {} cancellation requested by tenant {}", jobId, tenantId))
            .doOnError(e -> log.error("Failed to cancel job {}: {}", jobId, e.getMessage()));
    }

    private Mono<Job> admit(Job job) {
        return jobQueue.isFull(properties.getQueue().getMaxSize())
            .retryWhen(storeRetry())
            .flatMap(full -> {
                if (full) {
                    rejectedCounter.increment();
                    log.warn("Job for tenant {} rejected: queue is full (size >= {})",
                        job.getTenantId(), properties.getQueue().getMaxSize());
                    return Mono.error(new QueueFullException("Queue is full, cannot accept more jobs"));
                }
                return Mono.just(job);
            });
    }

    /**
     * Validate a request and build the PENDING job
     */
    Job toJob(AnalysisRequest request, JobKind kind, String tenantId) {
        AugurProperties.IntakeConfig intake = properties.getIntake();
        validateTenant(tenantId);

        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        if (isBlank(request.getEntityId())) {
            throw new ValidationException("entity_id is required");
        }
        if (isBlank(request.getAttribute())) {
            throw new ValidationException("attribute is required");
        }
        if (request.getHistoricalData() == null || request.getHistoricalData().isEmpty()) {
            throw new ValidationException("historical_data must contain at least one sample");
        }

        int horizon = request.getPredictionHorizon() != null
            ? request.getPredictionHorizon()
            : intake.getDefaultHorizon();
        if (horizon < 1 || horizon > intake.getMaxHorizon()) {
            throw new ValidationException("prediction_horizon must be between 1 and " + intake.getMaxHorizon());
        }

        String plugin = isBlank(request.getPlugin()) ? intake.getDefaultPlugin() : request.getPlugin().trim();
        if (intake.isRejectUnknownPlugins() && !pluginRegistry.contains(plugin)) {
            throw new ValidationException("Unknown plugin: " + plugin);
        }

        JobPayload payload = JobPayload.builder()
            .entityId(request.getEntityId().trim())
            .attribute(request.getAttribute().trim())
            .samples(toSamples(request.getHistoricalData()))
            .horizon(horizon)
            .build();

        return Job.newPending(generateJobId(), tenantId, kind, plugin, payload, clock.instant());
    }

    private List<DataPoint> toSamples(List<TimeSeriesSample> historicalData) {
        List<DataPoint> samples = new ArrayList<>(historicalData.size());
        Instant previous = null;
        for (int i = 0; i < historicalData.size(); i++) {
            TimeSeriesSample sample = historicalData.get(i);
            if (sample == null || sample.getTimestamp() == null || sample.getValue() == null) {
                throw new ValidationException("historical_data[" + i + "] needs a timestamp and a value");
            }
            if (!Double.isFinite(sample.getValue())) {
                throw new ValidationException("historical_data[" + i + "] has a non-finite value");
            }
            if (previous != null && sample.getTimestamp().isBefore(previous)) {
                throw new ValidationException("historical_data must be ordered by timestamp");
            }
            previous = sample.getTimestamp();
            samples.add(DataPoint.of(sample.getTimestamp(), sample.getValue()));
        }
        return samples;
    }

    AnalysisRequest fromWebhook(WebhookRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        Map<String, Object> data = request.getData() != null ? request.getData() : Map.of();

        String entityId = !isBlank(request.getEntityId()) ? request.getEntityId() : asString(data.get("entity_id"));
        String attribute = !isBlank(request.getAttribute()) ? request.getAttribute() : asString(data.get("attribute"));
        if (isBlank(entityId) || isBlank(attribute)) {
            throw new ValidationException("entity_id and attribute are required");
        }

        List<TimeSeriesSample> samples;
        Integer horizon;
        try {
            samples = objectMapper.convertValue(data.getOrDefault("historical_data", List.of()), SAMPLE_LIST);
            horizon = data.containsKey("prediction_horizon")
                ? objectMapper.convertValue(data.get("prediction_horizon"), Integer.class)
                : null;
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed webhook data: " + e.getMessage(), e);
        }

        return AnalysisRequest.builder()
            .entityId(entityId)
            .attribute(attribute)
            .historicalData(samples)
            .predictionHorizon(horizon)
            .plugin(asString(data.get("plugin")))
            .build();
    }

    private JobKind parseKind(String analysisType) {
        try {
            return JobKind.fromAnalysisType(analysisType);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }

    private void validateTenant(String tenantId) {
        if (tenantId == null || !TENANT_PATTERN.matcher(tenantId).matches()) {
            throw new ValidationException("X-Tenant-ID must be 1-64 characters of letters, digits, '-' or '_'");
        }
    }

    private Retry storeRetry() {
        AugurProperties.IntakeConfig intake = properties.getIntake();
        return Retry.backoff(intake.getStoreRetries(), intake.getStoreBackoff())
            .filter(JobSubmissionService::isTransient)
            .doBeforeRetry(signal -> log.warn("Job store unavailable (attempt {}): {}",
                signal.totalRetries() + 1, signal.failure().getMessage()))
            .onRetryExhaustedThrow((spec, signal) ->
                new ServiceUnavailableException("Job store unavailable, try again later", signal.failure()));
    }

    static boolean isTransient(Throwable error) {
        return error instanceof DataAccessResourceFailureException
            || error instanceof TransientDataAccessException;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Generate unique job ID
     */
    private String generateJobId() {
        return "job-" + UUID.randomUUID();
    }
}
