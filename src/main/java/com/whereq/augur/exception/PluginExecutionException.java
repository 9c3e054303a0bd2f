package com.whereq.augur.exception;

import com.whereq.augur.model.ErrorKind;

/**
 * Exception thrown by plugins that cannot compute a forecast for their input
 */
public class PluginExecutionException extends AugurException {
    public PluginExecutionException(String message) {
        super(ErrorKind.PLUGIN_EXECUTION_ERROR, message);
    }

    public PluginExecutionException(String message, Throwable cause) {
        super(ErrorKind.PLUGIN_EXECUTION_ERROR, message, cause);
    }
}
