package com.questrail.wrpbridge.observability;

/**
 * Receives bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks may arrive from any bridge thread and must not block.</p>
 */
public interface BridgeObservabilitySink {
    /**
     * Called when the inbound listener starts, stops or fails.
     */
    void onListenerEvent(ListenerEvent event);

    /**
     * Called when the router's service table changes.
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called when an error is absorbed rather than thrown.
     */
    void onError(BridgeErrorEvent event);
}
