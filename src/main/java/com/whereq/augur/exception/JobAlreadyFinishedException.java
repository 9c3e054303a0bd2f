package com.whereq.augur.exception;

import com.whereq.augur.model.ErrorKind;
import com.whereq.augur.model.JobStatus;

/**
 * Exception thrown when cancelling a job that already reached a terminal status
 */
public class JobAlreadyFinishedException extends AugurException {
    public JobAlreadyFinishedException(String jobId, JobStatus status) {
        super(ErrorKind.JOB_ALREADY_FINISHED, "Cannot cancel job " + jobId + " in terminal status: " + status);
    }
}
