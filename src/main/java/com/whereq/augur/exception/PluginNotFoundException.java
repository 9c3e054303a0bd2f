package com.whereq.augur.exception;

import com.whereq.augur.model.ErrorKind;

public class PluginNotFoundException extends AugurException {
    public PluginNotFoundException(String pluginName) {
        super(ErrorKind.PLUGIN_NOT_FOUND, "Plugin not found: " + pluginName);
    }
}
