package com.questrail.wrpbridge;

/**
 * A message was structurally valid on the wire but is missing fields its type
 * requires (for example a registration without a service name or URL).
 */
public final class InvalidMessageException extends BridgeException
{
    public InvalidMessageException(String message) {
        super("invalid message: " + message);
    }
}
