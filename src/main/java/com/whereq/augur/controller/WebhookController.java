package com.whereq.augur.controller;

import com.whereq.augur.dto.JobSubmitResponse;
import com.whereq.augur.dto.WebhookRequest;
import com.whereq.augur.service.JobSubmissionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * Entry point for n8n workflows. Accepts the looser webhook shape and queues the same jobs
 * as the analyze and predict endpoints.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("${augur.api.prefix:/api/intelligence}/webhook")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Webhooks", description = "External workflow triggers")
public class WebhookController {

    private final JobSubmissionService jobSubmissionService;

    @Value("${augur.api.prefix:/api/intelligence}")
    private String apiPrefix;

    @PostMapping("/n8n")
    @Operation(summary = "n8n trigger", description = "Queue an analysis or prediction job from an n8n workflow")
    public Mono<ResponseEntity<JobSubmitResponse>> n8n(
            @RequestBody WebhookRequest request,
            @RequestHeader(ApiErrors.TENANT_HEADER) String tenantId) {

        log.info("Received n8n webhook from tenant {}: entity={}, analysisType={}",
            tenantId, request.getEntityId(), request.getAnalysisType());

        return jobSubmissionService.submitWebhook(request, tenantId)
            .map(response -> ResponseEntity
                .status(HttpStatus.ACCEPTED)
                .location(URI.create(apiPrefix + "/jobs/" + response.getJobId()))
                .body(response))
            .onErrorResume(JobController::submissionError);
    }
}
