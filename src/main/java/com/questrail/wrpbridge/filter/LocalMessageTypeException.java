package com.questrail.wrpbridge.filter;

import com.questrail.wrpbridge.BridgeException;
import com.questrail.wrpbridge.model.MessageType;

/**
 * A message type that only has meaning between the bridge and its peers
 * (authorization, registration, liveness) tried to cross the bridge.
 */
public final class LocalMessageTypeException extends BridgeException
{
    private final MessageType type;

    public LocalMessageTypeException(MessageType type) {
        super("local message type cannot be forwarded: " + type);
        this.type = type;
    }

    public MessageType type() {
        return type;
    }
}
