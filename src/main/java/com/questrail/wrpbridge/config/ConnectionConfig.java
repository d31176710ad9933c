package com.questrail.wrpbridge.config;

import java.time.Duration;

/**
 * Configuration for one outbound connection.
 *
 * @param url         transport URL of the peer
 * @param sendTimeout per-send deadline; absent or non-positive values fall back to
 *                    {@link #DEFAULT_SEND_TIMEOUT}
 */
public record ConnectionConfig(String url, Duration sendTimeout)
{
    public static final Duration DEFAULT_SEND_TIMEOUT = Duration.ofSeconds(5);

    public ConnectionConfig {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("connection url is required");
        }
        if (sendTimeout == null || sendTimeout.isNegative() || sendTimeout.isZero()) {
            sendTimeout = DEFAULT_SEND_TIMEOUT;
        }
    }

    public static ConnectionConfig of(String url) {
        return new ConnectionConfig(url, DEFAULT_SEND_TIMEOUT);
    }
}
