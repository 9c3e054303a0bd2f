package com.whereq.augur.exception;

import com.whereq.augur.model.ErrorKind;

public class JobCancelledException extends AugurException {
    public JobCancelledException(String jobId) {
        super(ErrorKind.CANCELLED, "Job " + jobId + " was cancelled before execution");
    }
}
