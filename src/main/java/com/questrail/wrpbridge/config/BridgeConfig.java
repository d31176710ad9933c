package com.questrail.wrpbridge.config;

import com.questrail.wrpbridge.processor.MessageModifier;
import com.questrail.wrpbridge.processor.MessageObserver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * BridgeConfig
 * =============================================================================
 * Aggregated configuration for a {@link com.questrail.wrpbridge.Bridge}.
 *
 * <p>Validated once at construction; every derived config
 * ({@link #listenerConfig()}, {@link #connectionConfig(String)}) is therefore
 * valid as well.</p>
 *
 * <h2>Property keys</h2>
 * <pre>
 *   listen.url               required
 *   receive.timeout.ms       default 0 (no deadline)
 *   send.timeout.ms          default 5000
 *   liveness.interval.ms     default 30000
 *   dispatch.queue.capacity  default 64
 *   dispatch.workers         default 1
 * </pre>
 */
public record BridgeConfig(
        String listenUrl,
        Duration receiveTimeout,
        Duration sendTimeout,
        Duration livenessInterval,
        int dispatchQueueCapacity,
        int dispatchWorkers,
        List<MessageObserver> inboundObservers,
        List<MessageObserver> outboundObservers,
        List<MessageModifier> egressModifiers
) {
    public static final String KEY_LISTEN_URL = "listen.url";
    public static final String KEY_RECEIVE_TIMEOUT_MS = "receive.timeout.ms";
    public static final String KEY_SEND_TIMEOUT_MS = "send.timeout.ms";
    public static final String KEY_LIVENESS_INTERVAL_MS = "liveness.interval.ms";
    public static final String KEY_DISPATCH_QUEUE_CAPACITY = "dispatch.queue.capacity";
    public static final String KEY_DISPATCH_WORKERS = "dispatch.workers";

    public static final Duration DEFAULT_LIVENESS_INTERVAL = Duration.ofSeconds(30);

    public BridgeConfig {
        if (receiveTimeout == null || receiveTimeout.isNegative()) {
            receiveTimeout = Duration.ZERO;
        }
        if (sendTimeout == null || sendTimeout.isNegative() || sendTimeout.isZero()) {
            sendTimeout = ConnectionConfig.DEFAULT_SEND_TIMEOUT;
        }
        if (livenessInterval == null) {
            livenessInterval = DEFAULT_LIVENESS_INTERVAL;
        }
        if (livenessInterval.isNegative() || livenessInterval.isZero()) {
            throw new ConfigurationException("liveness interval must be > 0, was " + livenessInterval);
        }
        inboundObservers = inboundObservers == null ? List.of() : List.copyOf(inboundObservers);
        outboundObservers = outboundObservers == null ? List.of() : List.copyOf(outboundObservers);
        egressModifiers = egressModifiers == null ? List.of() : List.copyOf(egressModifiers);

        // Validates url, capacity and workers.
        new ListenerConfig(listenUrl, receiveTimeout, dispatchQueueCapacity, dispatchWorkers);
    }

    public ListenerConfig listenerConfig() {
        return new ListenerConfig(listenUrl, receiveTimeout, dispatchQueueCapacity, dispatchWorkers);
    }

    public ConnectionConfig connectionConfig(String url) {
        return new ConnectionConfig(url, sendTimeout);
    }

    /**
     * Build a config from string properties using the keys listed above.
     * Unknown keys are ignored.
     *
     * @throws ConfigurationException if a value is missing or not a number
     */
    public static BridgeConfig fromMap(Map<String, String> values) {
        Objects.requireNonNull(values, "values");

        Builder b = builder().withListenUrl(values.get(KEY_LISTEN_URL));
        Long ms;
        if ((ms = longValue(values, KEY_RECEIVE_TIMEOUT_MS)) != null) {
            b.withReceiveTimeout(Duration.ofMillis(ms));
        }
        if ((ms = longValue(values, KEY_SEND_TIMEOUT_MS)) != null) {
            b.withSendTimeout(Duration.ofMillis(ms));
        }
        if ((ms = longValue(values, KEY_LIVENESS_INTERVAL_MS)) != null) {
            b.withLivenessInterval(Duration.ofMillis(ms));
        }
        Long n;
        if ((n = longValue(values, KEY_DISPATCH_QUEUE_CAPACITY)) != null) {
            b.withDispatchQueueCapacity(toInt(KEY_DISPATCH_QUEUE_CAPACITY, n));
        }
        if ((n = longValue(values, KEY_DISPATCH_WORKERS)) != null) {
            b.withDispatchWorkers(toInt(KEY_DISPATCH_WORKERS, n));
        }
        return b.build();
    }

    private static Long longValue(Map<String, String> values, String key) {
        String raw = values.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " must be an integer, was '" + raw + "'", e);
        }
    }

    private static int toInt(String key, long value) {
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new ConfigurationException(key + " out of range: " + value);
        }
        return (int) value;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String listenUrl;
        private Duration receiveTimeout = Duration.ZERO;
        private Duration sendTimeout = ConnectionConfig.DEFAULT_SEND_TIMEOUT;
        private Duration livenessInterval = DEFAULT_LIVENESS_INTERVAL;
        private int dispatchQueueCapacity = ListenerConfig.DEFAULT_DISPATCH_QUEUE_CAPACITY;
        private int dispatchWorkers = ListenerConfig.DEFAULT_DISPATCH_WORKERS;
        private final List<MessageObserver> inboundObservers = new ArrayList<>();
        private final List<MessageObserver> outboundObservers = new ArrayList<>();
        private final List<MessageModifier> egressModifiers = new ArrayList<>();

        public Builder withListenUrl(String listenUrl) {
            this.listenUrl = listenUrl;
            return this;
        }

        public Builder withReceiveTimeout(Duration receiveTimeout) {
            this.receiveTimeout = receiveTimeout;
            return this;
        }

        public Builder withSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
            return this;
        }

        public Builder withLivenessInterval(Duration livenessInterval) {
            this.livenessInterval = livenessInterval;
            return this;
        }

        public Builder withDispatchQueueCapacity(int dispatchQueueCapacity) {
            this.dispatchQueueCapacity = dispatchQueueCapacity;
            return this;
        }

        public Builder withDispatchWorkers(int dispatchWorkers) {
            this.dispatchWorkers = dispatchWorkers;
            return this;
        }

        public Builder addInboundObserver(MessageObserver observer) {
            inboundObservers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        public Builder addOutboundObserver(MessageObserver observer) {
            outboundObservers.add(Objects.requireNonNull(observer, "observer"));
            return this;
        }

        public Builder addEgressModifier(MessageModifier modifier) {
            egressModifiers.add(Objects.requireNonNull(modifier, "modifier"));
            return this;
        }

        public BridgeConfig build() {
            return new BridgeConfig(listenUrl, receiveTimeout, sendTimeout, livenessInterval,
                    dispatchQueueCapacity, dispatchWorkers,
                    inboundObservers, outboundObservers, egressModifiers);
        }
    }
}
