package com.questrail.wrpbridge.model;

import com.questrail.wrpbridge.BridgeException;

/**
 * A destination locator could not be parsed, or carries no service to route on.
 */
public final class InvalidLocatorException extends BridgeException
{
    private final String locator;

    public InvalidLocatorException(String locator, String reason) {
        super("invalid locator '" + locator + "': " + reason);
        this.locator = locator;
    }

    public String locator() {
        return locator;
    }
}
