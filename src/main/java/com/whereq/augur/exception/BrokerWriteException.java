package com.whereq.augur.exception;

import com.whereq.augur.model.ErrorKind;

/**
 * Exception thrown when a prediction could not be written to the context broker
 */
public class BrokerWriteException extends AugurException {
    public BrokerWriteException(String message) {
        super(ErrorKind.BROKER_WRITE_ERROR, message);
    }

    public BrokerWriteException(String message, Throwable cause) {
        super(ErrorKind.BROKER_WRITE_ERROR, message, cause);
    }
}
