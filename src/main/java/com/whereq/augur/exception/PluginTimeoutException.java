package com.whereq.augur.exception;

import com.whereq.augur.model.ErrorKind;

import java.time.Duration;

public class PluginTimeoutException extends AugurException {
    public PluginTimeoutException(String pluginName, Duration timeout) {
        super(ErrorKind.PLUGIN_TIMEOUT,
            "Plugin " + pluginName + " did not finish within " + timeout.toMillis() + "ms");
    }
}
