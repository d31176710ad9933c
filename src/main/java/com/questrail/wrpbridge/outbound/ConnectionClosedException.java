package com.questrail.wrpbridge.outbound;

import com.questrail.wrpbridge.BridgeException;

/**
 * The connection is not open: never dialed, closed, or torn down after a failure.
 */
public final class ConnectionClosedException extends BridgeException
{
    public ConnectionClosedException(String url) {
        super("connection to " + url + " is closed");
    }
}
