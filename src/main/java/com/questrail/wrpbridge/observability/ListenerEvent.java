package com.questrail.wrpbridge.observability;

import java.time.Instant;

/**
 * Lifecycle transition of the inbound listener.
 *
 * @param cause terminal failure for {@link Kind#FAILED}, otherwise {@code null}
 */
public record ListenerEvent(
    Instant timestamp,
    Kind kind,
    String url,
    Throwable cause
) {
    public enum Kind
    {
        STARTED,
        STOPPED,
        FAILED
    }
}
