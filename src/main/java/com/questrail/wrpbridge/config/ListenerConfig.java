package com.questrail.wrpbridge.config;

import java.time.Duration;

/**
 * Configuration for the inbound listener.
 *
 * @param url                   transport URL to bind, e.g. {@code tcp://127.0.0.1:6666}
 * @param receiveTimeout        per-receive deadline; {@link Duration#ZERO} means none,
 *                              negative values are treated as zero
 * @param dispatchQueueCapacity frames decoded but not yet dispatched before the loop blocks
 * @param dispatchWorkers       threads delivering messages to subscribers
 */
public record ListenerConfig(
        String url,
        Duration receiveTimeout,
        int dispatchQueueCapacity,
        int dispatchWorkers
) {
    public static final int DEFAULT_DISPATCH_QUEUE_CAPACITY = 64;
    public static final int DEFAULT_DISPATCH_WORKERS = 1;

    public ListenerConfig {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("listener url is required");
        }
        if (receiveTimeout == null || receiveTimeout.isNegative()) {
            receiveTimeout = Duration.ZERO;
        }
        if (dispatchQueueCapacity < 1) {
            throw new ConfigurationException("dispatch queue capacity must be >= 1, was " + dispatchQueueCapacity);
        }
        if (dispatchWorkers < 1) {
            throw new ConfigurationException("dispatch workers must be >= 1, was " + dispatchWorkers);
        }
    }

    public static ListenerConfig of(String url, Duration receiveTimeout) {
        return new ListenerConfig(url, receiveTimeout, DEFAULT_DISPATCH_QUEUE_CAPACITY, DEFAULT_DISPATCH_WORKERS);
    }
}
