package com.questrail.wrpbridge.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onListenerEvent(ListenerEvent event) {
        switch (event.kind()) {
            case STARTED -> log.info("Listener started on {}", event.url());
            case STOPPED -> log.info("Listener on {} stopped", event.url());
            case FAILED -> log.warn("Listener on {} failed", event.url(), event.cause());
        }
    }

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        switch (event.kind()) {
            case REGISTERED -> log.info("Service '{}' registered at {}", event.service(), event.url());
            case REPLACED -> log.info("Service '{}' re-registered at {}", event.service(), event.url());
            case REMOVED -> log.info("Service '{}' removed", event.service());
            case EVICTED -> log.warn("Service '{}' at {} evicted: {}", event.service(), event.url(),
                    event.cause() == null ? "closed" : event.cause().getMessage());
        }
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        log.error("Bridge error: {}", event.message(), event.cause());
    }
}
