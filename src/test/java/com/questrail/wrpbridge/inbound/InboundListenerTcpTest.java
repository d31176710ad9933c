package com.questrail.wrpbridge.inbound;

import com.questrail.wrpbridge.codec.impl.MsgpackMessageCodec;
import com.questrail.wrpbridge.config.ConnectionConfig;
import com.questrail.wrpbridge.config.ListenerConfig;
import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.model.Message;
import com.questrail.wrpbridge.model.MessageType;
import com.questrail.wrpbridge.observability.NullObservabilitySink;
import com.questrail.wrpbridge.outbound.TransportConnection;
import com.questrail.wrpbridge.transport.TransportRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Listener and connection over real loopback TCP.
 */
final class InboundListenerTcpTest {

    private final MsgpackMessageCodec codec = new MsgpackMessageCodec();
    private final TransportRegistry transports = TransportRegistry.defaults();

    private final InboundListener listener = new InboundListener(
            ListenerConfig.of("tcp://127.0.0.1:0", Duration.ofMillis(100)),
            transports, codec, NullObservabilitySink.INSTANCE);

    private TransportConnection connection;

    @AfterEach
    void tearDown() {
        if (connection != null) {
            connection.close();
        }
        listener.close();
    }

    private String listenerUrl() {
        int port = ((InetSocketAddress) listener.localAddress()).getPort();
        return "tcp://127.0.0.1:" + port;
    }

    @Test
    void messagesSentByAConnectionArriveIntact() throws InterruptedException {
        BlockingQueue<Message> received = new LinkedBlockingQueue<>();
        listener.addMessageSubscriber((ctx, m) -> received.add(m));
        listener.listen();

        connection = new TransportConnection(ConnectionConfig.of(listenerUrl()), transports, codec);
        connection.dial();

        Message first = Message.builder(MessageType.SIMPLE_REQUEST_RESPONSE)
                .source("mac:112233445566")
                .destination("event:device-status/mac:112233445566/online")
                .transactionUuid("c07ee5e1-70be-444c-a156-097c767ad8aa")
                .contentType("application/json")
                .headers(List.of("X-A: 1"))
                .metadata(Map.of("/boot-time", "1700000000"))
                .payload("{\"online\":true}".getBytes(StandardCharsets.UTF_8))
                .partnerIds(List.of("comcast"))
                .build();
        Message second = Message.builder(MessageType.SIMPLE_EVENT)
                .source("dns:talaria")
                .destination("mac:112233445566/config")
                .build();

        connection.send(Context.background(), first);
        connection.send(Context.background(), second);

        Set<Message> got = new HashSet<>();
        for (int i = 0; i < 2; i++) {
            Message m = received.poll(5, TimeUnit.SECONDS);
            assertNotNull(m, "message " + i + " did not arrive");
            got.add(m);
        }
        assertEquals(Set.of(first, second), got);
    }

    @Test
    void closingTheListenerDropsTheConnection() throws InterruptedException {
        listener.listen();
        connection = new TransportConnection(ConnectionConfig.of(listenerUrl()), transports, codec);
        connection.dial();

        listener.close();

        Message m = Message.builder(MessageType.SIMPLE_EVENT).destination("dns:x/y").build();
        boolean failed = false;
        for (int i = 0; i < 100 && !failed; i++) {
            try {
                connection.send(Context.background(), m);
                Thread.sleep(20);
            } catch (RuntimeException e) {
                failed = true;
            }
        }
        assertTrue(failed, "sends should fail once the listener is gone");
        assertFalse(connection.isOpen());
    }
}
