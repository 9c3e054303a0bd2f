package com.whereq.augur.exception;

import com.whereq.augur.model.ErrorKind;
import com.whereq.augur.model.JobError;
import lombok.Getter;

/**
 * Base class of classified failures. The kind is what gets recorded on a failed job.
 */
@Getter
public abstract class AugurException extends RuntimeException {

    private final ErrorKind kind;

    protected AugurException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected AugurException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public JobError toJobError() {
        return JobError.of(kind, getMessage());
    }
}
