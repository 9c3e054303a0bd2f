package com.whereq.augur.exception;

/**
 * Exception thrown when the shared store stays unreachable after retries
 */
public class ServiceUnavailableException extends RuntimeException {
    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
