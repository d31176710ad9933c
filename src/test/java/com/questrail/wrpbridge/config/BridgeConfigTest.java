package com.questrail.wrpbridge.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class BridgeConfigTest {

    @Test
    void defaultsApplyWhenOnlyTheUrlIsGiven() {
        BridgeConfig config = BridgeConfig.fromMap(Map.of(BridgeConfig.KEY_LISTEN_URL, "tcp://127.0.0.1:6666"));

        assertEquals("tcp://127.0.0.1:6666", config.listenUrl());
        assertEquals(Duration.ZERO, config.receiveTimeout());
        assertEquals(ConnectionConfig.DEFAULT_SEND_TIMEOUT, config.sendTimeout());
        assertEquals(BridgeConfig.DEFAULT_LIVENESS_INTERVAL, config.livenessInterval());
        assertEquals(ListenerConfig.DEFAULT_DISPATCH_QUEUE_CAPACITY, config.dispatchQueueCapacity());
        assertEquals(ListenerConfig.DEFAULT_DISPATCH_WORKERS, config.dispatchWorkers());
        assertTrue(config.egressModifiers().isEmpty());
    }

    @Test
    void everyKeyIsRead() {
        Map<String, String> values = new HashMap<>();
        values.put(BridgeConfig.KEY_LISTEN_URL, "tcp://*:7000");
        values.put(BridgeConfig.KEY_RECEIVE_TIMEOUT_MS, "250");
        values.put(BridgeConfig.KEY_SEND_TIMEOUT_MS, " 1500 ");
        values.put(BridgeConfig.KEY_LIVENESS_INTERVAL_MS, "10000");
        values.put(BridgeConfig.KEY_DISPATCH_QUEUE_CAPACITY, "8");
        values.put(BridgeConfig.KEY_DISPATCH_WORKERS, "3");
        values.put("unrelated.key", "ignored");

        BridgeConfig config = BridgeConfig.fromMap(values);

        assertEquals(Duration.ofMillis(250), config.receiveTimeout());
        assertEquals(Duration.ofMillis(1500), config.sendTimeout());
        assertEquals(Duration.ofSeconds(10), config.livenessInterval());

        ListenerConfig listener = config.listenerConfig();
        assertEquals("tcp://*:7000", listener.url());
        assertEquals(8, listener.dispatchQueueCapacity());
        assertEquals(3, listener.dispatchWorkers());

        ConnectionConfig connection = config.connectionConfig("tcp://10.0.0.2:6000");
        assertEquals("tcp://10.0.0.2:6000", connection.url());
        assertEquals(Duration.ofMillis(1500), connection.sendTimeout());
    }

    @Test
    void missingUrlIsRejected() {
        assertThrows(ConfigurationException.class, () -> BridgeConfig.fromMap(Map.of()));
        assertThrows(ConfigurationException.class,
                () -> BridgeConfig.fromMap(Map.of(BridgeConfig.KEY_LISTEN_URL, "  ")));
    }

    @Test
    void nonNumericValuesNameTheKey() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> BridgeConfig.fromMap(Map.of(
                BridgeConfig.KEY_LISTEN_URL, "tcp://127.0.0.1:6666",
                BridgeConfig.KEY_SEND_TIMEOUT_MS, "soon")));

        assertTrue(e.getMessage().contains(BridgeConfig.KEY_SEND_TIMEOUT_MS));
    }

    @Test
    void outOfRangeValuesAreRejected() {
        assertThrows(ConfigurationException.class, () -> BridgeConfig.builder()
                .withListenUrl("tcp://127.0.0.1:6666")
                .withLivenessInterval(Duration.ZERO)
                .build());
        assertThrows(ConfigurationException.class, () -> BridgeConfig.builder()
                .withListenUrl("tcp://127.0.0.1:6666")
                .withDispatchWorkers(0)
                .build());
        assertThrows(ConfigurationException.class, () -> BridgeConfig.fromMap(Map.of(
                BridgeConfig.KEY_LISTEN_URL, "tcp://127.0.0.1:6666",
                BridgeConfig.KEY_DISPATCH_QUEUE_CAPACITY, "99999999999")));
    }

    @Test
    void nonPositiveTimeoutsFallBackToDefaults() {
        BridgeConfig config = BridgeConfig.builder()
                .withListenUrl("tcp://127.0.0.1:6666")
                .withReceiveTimeout(Duration.ofMillis(-5))
                .withSendTimeout(Duration.ZERO)
                .build();

        assertEquals(Duration.ZERO, config.receiveTimeout());
        assertEquals(ConnectionConfig.DEFAULT_SEND_TIMEOUT, config.sendTimeout());
        assertThrows(ConfigurationException.class, () -> config.connectionConfig(""));
    }

    @Test
    void builderHooksAreCopied() {
        BridgeConfig.Builder builder = BridgeConfig.builder()
                .withListenUrl("tcp://127.0.0.1:6666")
                .addEgressModifier((ctx, m) -> m)
                .addInboundObserver((ctx, m) -> { });
        BridgeConfig config = builder.build();

        builder.addEgressModifier((ctx, m) -> m);

        assertEquals(1, config.egressModifiers().size());
        assertEquals(1, config.inboundObservers().size());
        assertThrows(UnsupportedOperationException.class, () -> config.outboundObservers().add((ctx, m) -> { }));
    }
}
