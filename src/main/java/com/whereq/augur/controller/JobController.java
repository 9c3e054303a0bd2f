package com.whereq.augur.controller;

import com.whereq.augur.dto.AnalysisRequest;
import com.whereq.augur.dto.JobCancellationResponse;
import com.whereq.augur.dto.JobStatusResponse;
import com.whereq.augur.dto.JobSubmitResponse;
import com.whereq.augur.model.JobError;
import com.whereq.augur.model.JobKind;
import com.whereq.augur.model.JobStatus;
import com.whereq.augur.service.JobSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Controller for async analysis and prediction jobs
 *
 * @author WhereQ Inc.
 */
@Slf4j
@RestController
@RequestMapping("${augur.api.prefix:/api/intelligence}")
@Tag(name = "Jobs", description = "Submit, poll and cancel analysis and prediction jobs")
public class JobController {

    @Autowired
    private JobSubmissionService jobSubmissionService;

    @Value("${augur.api.prefix:/api/intelligence}")
    private String apiPrefix;

    /**
     * Submit an analysis job
     *
     * @param request job request
     * @param tenantId tenant header
     * @return Mono with 202 Accepted response
     */
    @PostMapping("/analyze")
    @Operation(summary = "Trigger analysis", description = "Queue an analysis job; results are kept on the job only")
    public Mono<ResponseEntity<JobSubmitResponse>> analyze(
            @Valid @RequestBody AnalysisRequest request,
            @RequestHeader(ApiErrors.TENANT_HEADER) String tenantId) {
        return submit(request, JobKind.ANALYZE, tenantId);
    }

    /**
     * Submit a prediction job whose forecast is written to the context broker
     *
     * @param request job request
     * @param tenantId tenant header
     * @return Mono with 202 Accepted response
     */
    @PostMapping("/predict")
    @Operation(summary = "Trigger prediction", description = "Queue a prediction job; the forecast is published to the context broker")
    public Mono<ResponseEntity<JobSubmitResponse>> predict(
            @Valid @RequestBody AnalysisRequest request,
            @RequestHeader(ApiErrors.TENANT_HEADER) String tenantId) {
        return submit(request, JobKind.PREDICT, tenantId);
    }

    /**
     * Get job status
     *
     * @param jobId job identifier
     * @param tenantId tenant header
     * @return Mono with job status
     */
    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Poll job", description = "Get the status, result or error of a job")
    public Mono<ResponseEntity<JobStatusResponse>> getJobStatus(
            @PathVariable String jobId,
            @RequestHeader(ApiErrors.TENANT_HEADER) String tenantId) {

        log.debug("Job status request for {} from tenant {}", jobId, tenantId);

        return jobSubmissionService.getJob(jobId, tenantId)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                HttpStatus status = ApiErrors.statusOf(e);
                if (status.is5xxServerError()) {
                    log.error("Error reading job {}", jobId, e);
                }
                return Mono.just(ResponseEntity
                    .status(status)
                    .body(JobStatusResponse.error(jobId, ApiErrors.kindOf(e), ApiErrors.messageOf(e))));
            });
    }

    /**
     * List jobs waiting for a worker
     *
     * @param status only PENDING is listable
     * @param tenantId tenant header
     * @return Mono with pending jobs
     */
    @GetMapping("/jobs")
    @Operation(summary = "Pending jobs", description = "List the calling tenant's PENDING jobs")
    public Mono<ResponseEntity<List<JobStatusResponse>>> listJobs(
            @RequestParam(value = "status", defaultValue = "PENDING") JobStatus status,
            @RequestHeader(ApiErrors.TENANT_HEADER) String tenantId) {

        if (status != JobStatus.PENDING) {
            return Mono.just(ResponseEntity.badRequest().<List<JobStatusResponse>>build());
        }

        return Mono.defer(() -> jobSubmissionService.listPending(tenantId).collectList())
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                HttpStatus errorStatus = ApiErrors.statusOf(e);
                if (errorStatus.is5xxServerError()) {
                    log.error("Error listing pending jobs", e);
                }
                return Mono.just(ResponseEntity.status(errorStatus).<List<JobStatusResponse>>build());
            });
    }

    /**
     * Cancel a job
     *
     * @param jobId job identifier
     * @param tenantId tenant header
     * @return Mono with cancellation response
     */
    @DeleteMapping("/jobs/{jobId}")
    @Operation(summary = "Cancel job", description = "Request cancellation of a job that has not finished")
    public Mono<ResponseEntity<JobCancellationResponse>> cancelJob(
            @PathVariable String jobId,
            @RequestHeader(ApiErrors.TENANT_HEADER) String tenantId) {

        log.info("Job cancellation request for {} from tenant {}", jobId, tenantId);

        return jobSubmissionService.cancelJob(jobId, tenantId)
            .map(ResponseEntity::ok)
            .onErrorResume(e -> {
                HttpStatus status = ApiErrors.statusOf(e);
                if (status.is5xxServerError()) {
                    log.error("Error cancelling job {}", jobId, e);
                }
                return Mono.just(ResponseEntity
                    .status(status)
                    .body(JobCancellationResponse.builder()
                        .jobId(jobId)
                        .message(ApiErrors.messageOf(e))
                        .error(JobError.of(ApiErrors.kindOf(e), ApiErrors.messageOf(e)))
                        .build()));
            });
    }

    private Mono<ResponseEntity<JobSubmitResponse>> submit(AnalysisRequest request, JobKind kind, String tenantId) {
        log.info("Received {} job from tenant {}: entity={}, attribute={}, plugin={}",
            kind, tenantId, request.getEntityId(), request.getAttribute(), request.getPlugin());

        return jobSubmissionService.submit(request, kind, tenantId)
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create(apiPrefix + "/jobs/" + response.getJobId()))
                .body(response))
            .onErrorResume(JobController::submissionError);
    }

    static Mono<ResponseEntity<JobSubmitResponse>> submissionError(Throwable e) {
        HttpStatus status = ApiErrors.statusOf(e);
        if (status.is5xxServerError()) {
            log.error("Error during job submission", e);
        } else {
            log.warn("Job submission rejected ({}): {}", status.value(), e.getMessage());
        }
        return Mono.just(ResponseEntity
            .status(status)
            .body(JobSubmitResponse.error(ApiErrors.kindOf(e), ApiErrors.messageOf(e))));
    }
}
