package com.whereq.augur.exception;

import com.whereq.augur.model.ErrorKind;

/**
 * Exception thrown when a submission is malformed. Such requests never reach the job store.
 */
public class ValidationException extends AugurException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_ERROR, message, cause);
    }
}
