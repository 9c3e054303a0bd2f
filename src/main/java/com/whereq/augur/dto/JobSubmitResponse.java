package com.whereq.augur.dto;

import com.whereq.augur.model.ErrorKind;
import com.whereq.augur.model.JobError;
import com.whereq.augur.model.JobKind;
import com.whereq.augur.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response for async job submission
 *
 * @author WhereQ Inc.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmitResponse {
    /**
     * Unique job identifier
     */
    private String jobId;

    /**
     * Current job status
     */
    private JobStatus status;

    private JobKind kind;

    /**
     * When the job was submitted
     */
    private Instant submittedAt;

    private String message;

    /**
     * Error (if submission failed)
     */
    private JobError error;

    /**
     * Create error response
     */
    public static JobSubmitResponse error(ErrorKind kind, String message) {
        return JobSubmitResponse.builder()
            .error(JobError.of(kind, message))
            .submittedAt(Instant.now())
            .build();
    }
}
