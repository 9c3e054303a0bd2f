package com.whereq.augur.dto;

import com.whereq.augur.model.ErrorKind;
import com.whereq.augur.model.Job;
import com.whereq.augur.model.JobError;
import com.whereq.augur.model.JobKind;
import com.whereq.augur.model.JobResult;
import com.whereq.augur.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job status query
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {
    /**
     * Job identifier
     */
    private String id;

    private JobKind type;

    /**
     * Current status
     */
    private JobStatus status;

    private String plugin;

    private String entityId;

    private String attribute;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant startedAt;

    private Instant completedAt;

    private int attempts;

    private boolean cancelRequested;

    /**
     * Job result (if completed)
     */
    private JobResult result;

    /**
     * Classified error (if failed, or if the lookup itself failed)
     */
    private JobError error;

    public static JobStatusResponse from(Job job) {
        JobStatusResponseBuilder builder = JobStatusResponse.builder()
            .id(job.getId())
            .type(job.getKind())
            .status(job.getStatus())
            .plugin(job.getPluginName())
            .createdAt(job.getCreatedAt())
            .updatedAt(job.getUpdatedAt())
            .startedAt(job.getStartedAt())
            .completedAt(job.getCompletedAt())
            .attempts(job.getAttempts())
            .cancelRequested(job.isCancelRequested())
            .result(job.getResult())
            .error(job.getError());
        if (job.getPayload() != null) {
            builder.entityId(job.getPayload().getEntityId())
                .attribute(job.getPayload().getAttribute());
        }
        return builder.build();
    }

    public static JobStatusResponse error(String jobId, ErrorKind kind, String message) {
        return JobStatusResponse.builder()
            .id(jobId)
            .error(JobError.of(kind, message))
            .build();
    }
}
