package com.questrail.wrpbridge.config;

import com.questrail.wrpbridge.BridgeException;

/**
 * A configuration value is missing or out of range.
 */
public final class ConfigurationException extends BridgeException
{
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
