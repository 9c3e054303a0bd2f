package com.whereq.augur.controller;

import com.whereq.augur.exception.AugurException;
import com.whereq.augur.exception.JobAlreadyFinishedException;
import com.whereq.augur.exception.JobNotFoundException;
import com.whereq.augur.exception.QueueFullException;
import com.whereq.augur.exception.ServiceUnavailableException;
import com.whereq.augur.exception.ValidationException;
import com.whereq.augur.model.ErrorKind;
import org.springframework.http.HttpStatus;

/**
 * HTTP status and error classification shared by the controllers
 */
final class ApiErrors {

    static final String TENANT_HEADER = "X-Tenant-ID";

    private ApiErrors() {
    }

    static HttpStatus statusOf(Throwable error) {
        if (error instanceof ValidationException) {
            return HttpStatus.BAD_REQUEST;
        }
        if (error instanceof JobNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (error instanceof QueueFullException) {
            return HttpStatus.TOO_MANY_REQUESTS;
        }
        if (error instanceof ServiceUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (error instanceof JobAlreadyFinishedException) {
            return HttpStatus.CONFLICT;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static ErrorKind kindOf(Throwable error) {
        if (error instanceof AugurException augurException) {
            return augurException.getKind();
        }
        return ErrorKind.INTERNAL_ERROR;
    }

    static String messageOf(Throwable error) {
        if (statusOf(error) == HttpStatus.INTERNAL_SERVER_ERROR) {
            return "Internal server error: " + error.getMessage();
        }
        return error.getMessage();
    }
}
