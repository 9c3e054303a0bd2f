package com.whereq.augur.exception;

/**
 * Exception thrown when the job queue is full
 */
public class QueueFullException extends RuntimeException {
    public QueueFullException(String message) {
        super(message);
    }
}
