package com.whereq.augur.model;

/**
 * Classification of job and request failures
 */
public enum ErrorKind {
    /**
     * Malformed request, rejected at intake
     */
    VALIDATION_ERROR,

    PLUGIN_NOT_FOUND,

    /**
     * Plugin returned a forecast of the wrong shape
     */
    PLUGIN_CONTRACT_ERROR,

    PLUGIN_TIMEOUT,

    /**
     * Plugin threw while computing the forecast
     */
    PLUGIN_EXECUTION_ERROR,

    /**
     * Broker publication exhausted its retries or was rejected
     */
    BROKER_WRITE_ERROR,

    /**
     * Unknown id, or id owned by another tenant
     */
    JOB_NOT_FOUND,

    /**
     * Cancellation of a job that is already COMPLETED or FAILED
     */
    JOB_ALREADY_FINISHED,

    /**
     * Cancellation was requested before execution started
     */
    CANCELLED,

    INTERNAL_ERROR
}
