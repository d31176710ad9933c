package com.questrail.wrpbridge.observability;

import java.time.Instant;

/**
 * Change to the router's service table.
 *
 * @param cause failure that caused an {@link Kind#EVICTED} entry, otherwise {@code null}
 */
public record ConnectionEvent(
    Instant timestamp,
    Kind kind,
    String service,
    String url,
    Throwable cause
) {
    public enum Kind
    {
        /** A service registered for the first time. */
        REGISTERED,
        /** A service registered again; the previous connection was closed. */
        REPLACED,
        /** An entry was removed explicitly. */
        REMOVED,
        /** A connection failed and removed itself. */
        EVICTED
    }
}
