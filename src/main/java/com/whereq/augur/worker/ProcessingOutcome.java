package com.whereq.augur.worker;

/**
 * What a worker did with one delivery
 */
public enum ProcessingOutcome {
    /**
     * Job executed and stored as COMPLETED
     */
    COMPLETED,

    /**
     * Job executed and stored as FAILED
     */
    FAILED,

    /**
     * Job was already terminal; the delivery was a redelivery
     */
    DUPLICATE,

    /**
     * Another worker holds an active lease; delivery left in flight
     */
    LEASE_HELD,

    /**
     * Another worker claimed or finished the job first
     */
    SUPERSEDED,

    /**
     * No record exists for the delivered id
     */
    MISSING
}
