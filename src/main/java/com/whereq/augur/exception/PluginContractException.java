package com.whereq.augur.exception;

import com.whereq.augur.model.ErrorKind;

/**
 * Exception thrown when a plugin returns a forecast of the wrong shape
 */
public class PluginContractException extends AugurException {
    public PluginContractException(String message) {
        super(ErrorKind.PLUGIN_CONTRACT_ERROR, message);
    }

    public PluginContractException(String message, Throwable cause) {
        super(ErrorKind.PLUGIN_CONTRACT_ERROR, message, cause);
    }
}
