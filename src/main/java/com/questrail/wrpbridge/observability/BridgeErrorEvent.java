package com.questrail.wrpbridge.observability;

import java.time.Instant;

/**
 * An error the bridge absorbed instead of propagating (failed broadcast,
 * failed handshake, subscriber failure).
 */
public record BridgeErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
