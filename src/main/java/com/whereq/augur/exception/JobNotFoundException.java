package com.whereq.augur.exception;

import com.whereq.augur.model.ErrorKind;

/**
 * Exception thrown when a job id is unknown or belongs to another tenant
 */
public class JobNotFoundException extends AugurException {
    public JobNotFoundException(String message) {
        super(ErrorKind.JOB_NOT_FOUND, message);
    }

    public JobNotFoundException(String message, Throwable cause) {
        super(ErrorKind.JOB_NOT_FOUND, message, cause);
    }
}
