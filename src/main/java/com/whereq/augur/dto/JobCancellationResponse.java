package com.whereq.augur.dto;

import com.whereq.augur.model.JobError;
import com.whereq.augur.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for job cancellation
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobCancellationResponse {
    /**
     * Job identifier
     */
    private String jobId;

    /**
     * Status when the cancellation was recorded
     */
    private JobStatus status;

    private boolean cancelRequested;

    private Instant requestedAt;

    /**
     * Cancellation message
     */
    private String message;

    private JobError error;
}
