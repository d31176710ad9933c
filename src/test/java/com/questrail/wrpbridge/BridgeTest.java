package com.questrail.wrpbridge;

import com.questrail.wrpbridge.codec.impl.MsgpackMessageCodec;
import com.questrail.wrpbridge.config.BridgeConfig;
import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.filter.LocalMessageTypeException;
import com.questrail.wrpbridge.filter.UnsupportedMessageTypeException;
import com.questrail.wrpbridge.internal.time.Cancellable;
import com.questrail.wrpbridge.model.Message;
import com.questrail.wrpbridge.model.MessageType;
import com.questrail.wrpbridge.observability.BridgeErrorEvent;
import com.questrail.wrpbridge.observability.ListenerEvent;
import com.questrail.wrpbridge.observability.RecordingObservabilitySink;
import com.questrail.wrpbridge.processor.ProcessResult;
import com.questrail.wrpbridge.time.DeterministicScheduler;
import com.questrail.wrpbridge.time.ManualMonotonicClock;
import com.questrail.wrpbridge.transport.FakeTransport;
import com.questrail.wrpbridge.transport.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class BridgeTest {

    private static final String LISTEN = "fake://bridge:6666";
    private static final String SERVICE = "fake://svc:7000";
    private static final Duration INTERVAL = Duration.ofSeconds(30);

    private final MsgpackMessageCodec codec = new MsgpackMessageCodec();
    private final FakeTransport fake = new FakeTransport();
    private final ManualMonotonicClock clock = new ManualMonotonicClock();
    private final DeterministicScheduler scheduler = new DeterministicScheduler(clock);
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private final BlockingQueue<Message> egress = new LinkedBlockingQueue<>();
    private final List<Message> inboundSeen = new CopyOnWriteArrayList<>();
    private final List<Message> outboundSeen = new CopyOnWriteArrayList<>();

    private final Bridge bridge = Bridge.builder()
            .withConfig(BridgeConfig.builder()
                    .withListenUrl(LISTEN)
                    .withReceiveTimeout(Duration.ofMillis(20))
                    .withLivenessInterval(INTERVAL)
                    .addInboundObserver((ctx, m) -> inboundSeen.add(m))
                    .addOutboundObserver((ctx, m) -> outboundSeen.add(m))
                    .addEgressModifier((ctx, m) -> {
                        egress.add(m);
                        return m;
                    })
                    .build())
            .withTransports(FakeTransport.registry(fake))
            .withCodec(codec)
            .withScheduler(scheduler)
            .withClock(clock)
            .withObservabilitySink(sink)
            .build();

    @AfterEach
    void tearDown() {
        bridge.close();
    }

    private static Message registration(String name, String url) {
        return Message.builder(MessageType.SERVICE_REGISTRATION).serviceName(name).url(url).build();
    }

    private static Message event(String dest) {
        return Message.builder(MessageType.SIMPLE_EVENT).source("dns:cloud").destination(dest).build();
    }

    private List<Message> sentTo(String url) {
        return fake.outbound(url).sent().stream().map(codec::decode).collect(Collectors.toList());
    }

    private void advanceIntervals(int n) {
        for (int i = 0; i < n; i++) {
            clock.advance(INTERVAL);
            scheduler.runDueTasks();
        }
    }

    @Test
    void registrationOverTheWireCreatesARoute() throws InterruptedException {
        bridge.start();

        fake.inbound(LISTEN).deliver(codec.encode(registration("config", SERVICE)));

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while ((fake.dialCount(SERVICE) == 0 || fake.outbound(SERVICE).sent().isEmpty())
                && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(Set.of("config"), bridge.registeredServices());
        Message auth = sentTo(SERVICE).get(0);
        assertTrue(auth.is(MessageType.AUTHORIZATION));
        assertEquals(200L, auth.status());
        assertTrue(egress.isEmpty(), "registrations are consumed by the bridge");
    }

    @Test
    void registrationWithoutUrlIsRejected() {
        Message noUrl = Message.builder(MessageType.SERVICE_REGISTRATION).serviceName("config").url("").build();

        assertThrows(InvalidMessageException.class, () -> bridge.processInbound(Context.background(), noUrl));
        assertThrows(InvalidMessageException.class,
                () -> bridge.processInbound(Context.background(), registration(null, SERVICE)));
        assertTrue(bridge.registeredServices().isEmpty());
        assertEquals(0, fake.dialCount(SERVICE));
    }

    @Test
    void unreachableRegistrationPropagatesTheDialFailure() {
        fake.failDial(new TransportException("refused"));

        assertThrows(TransportException.class,
                () -> bridge.processInbound(Context.background(), registration("config", SERVICE)));
        assertTrue(bridge.registeredServices().isEmpty());
    }

    @Test
    void inboundEventsReachEgressModifiers() throws InterruptedException {
        bridge.start();

        fake.inbound(LISTEN).deliver(codec.encode(event("mac:112233445566/config")));

        assertEquals(event("mac:112233445566/config"), egress.poll(2, TimeUnit.SECONDS));
        assertEquals(List.of(event("mac:112233445566/config")), inboundSeen);
    }

    @Test
    void inboundLocalAndUnsupportedTypesStopBeforeEgress() {
        Message auth = Message.builder(MessageType.AUTHORIZATION).status(200L).build();
        Message alive = Message.builder(MessageType.SERVICE_ALIVE).build();
        Message odd = Message.builder().typeCode(42).build();

        assertThrows(LocalMessageTypeException.class, () -> bridge.processInbound(Context.background(), auth));
        assertThrows(LocalMessageTypeException.class, () -> bridge.processInbound(Context.background(), alive));
        assertThrows(UnsupportedMessageTypeException.class,
                () -> bridge.processInbound(Context.background(), odd));

        assertTrue(egress.isEmpty());
        // Observers run first and see everything.
        assertEquals(3, inboundSeen.size());
    }

    @Test
    void droppedInboundFramesAreReported() throws InterruptedException {
        bridge.start();

        fake.inbound(LISTEN).deliver(codec.encode(Message.builder(MessageType.SERVICE_REGISTRATION).build()));
        fake.inbound(LISTEN).deliver(codec.encode(event("dns:x/after")));

        assertEquals(event("dns:x/after"), egress.poll(2, TimeUnit.SECONDS));
        assertTrue(sink.hasEventOfType(BridgeErrorEvent.class));
        assertTrue(bridge.isRunning());
    }

    @Test
    void outboundMessagesAreRoutedToTheRegisteredService() {
        bridge.processInbound(Context.background(), registration("config", SERVICE));

        ProcessResult result = bridge.process(Context.background(), event("mac:112233445566/config/x"));

        assertEquals(ProcessResult.HANDLED, result);
        assertEquals(event("mac:112233445566/config/x"), sentTo(SERVICE).get(1));
        assertEquals(List.of(event("mac:112233445566/config/x")), outboundSeen);
    }

    @Test
    void outboundToAnUnknownServiceIsNotHandled() {
        assertEquals(ProcessResult.NOT_HANDLED, bridge.process(Context.background(), event("dns:x/nobody")));
    }

    @Test
    void outboundLocalTypesAreRejectedBeforeObservers() {
        Message reg = registration("config", SERVICE);

        assertThrows(LocalMessageTypeException.class, () -> bridge.process(Context.background(), reg));
        assertThrows(UnsupportedMessageTypeException.class,
                () -> bridge.process(Context.background(), Message.builder().typeCode(-1).build()));
        assertTrue(outboundSeen.isEmpty());
    }

    @Test
    void doubleStartStillAnnouncesOncePerInterval() {
        bridge.processInbound(Context.background(), registration("config", SERVICE));
        bridge.start();
        bridge.start();

        advanceIntervals(5);

        long alive = sentTo(SERVICE).stream().filter(m -> m.is(MessageType.SERVICE_ALIVE)).count();
        assertEquals(5, alive);
        assertEquals(5, outboundSeen.size());
        assertEquals(List.of(ListenerEvent.Kind.STARTED), sink.listenerKinds());
    }

    @Test
    void stopIsIdempotentAndEndsEverything() {
        bridge.processInbound(Context.background(), registration("config", SERVICE));
        bridge.start();

        bridge.stop();
        bridge.stop();

        assertFalse(bridge.isRunning());
        assertNull(bridge.localAddress());
        assertTrue(bridge.registeredServices().isEmpty());
        assertTrue(fake.outbound(SERVICE).isClosed());
        assertTrue(fake.inbound(LISTEN).isClosed());
        assertEquals(0, scheduler.pendingCount());

        advanceIntervals(2);
        assertTrue(outboundSeen.isEmpty());
    }

    @Test
    void bridgeCanBeRestarted() throws InterruptedException {
        bridge.start();
        bridge.stop();
        bridge.start();

        assertTrue(bridge.isRunning());
        fake.inbound(LISTEN).deliver(codec.encode(event("dns:x/again")));
        assertEquals(event("dns:x/again"), egress.poll(2, TimeUnit.SECONDS));
    }

    @Test
    void failedStartKeepsLivenessUntilStop() {
        bridge.processInbound(Context.background(), registration("config", SERVICE));
        fake.failListen(new TransportException("address in use"));

        assertThrows(TransportException.class, bridge::start);

        assertTrue(bridge.isRunning());
        advanceIntervals(1);
        assertEquals(1, outboundSeen.size());

        bridge.stop();
        assertFalse(bridge.isRunning());
        assertEquals(0, scheduler.pendingCount());
        assertTrue(bridge.registeredServices().isEmpty());
    }

    @Test
    void hooksAddedLaterCanBeRemoved() throws InterruptedException {
        BlockingQueue<Message> late = new LinkedBlockingQueue<>();
        Cancellable registration = bridge.addEgressModifier((ctx, m) -> {
            late.add(m);
            return m;
        });
        bridge.start();

        fake.inbound(LISTEN).deliver(codec.encode(event("dns:x/one")));
        assertEquals(event("dns:x/one"), late.poll(2, TimeUnit.SECONDS));
        assertEquals(event("dns:x/one"), egress.poll(2, TimeUnit.SECONDS));

        registration.cancel();
        fake.inbound(LISTEN).deliver(codec.encode(event("dns:x/two")));
        assertEquals(event("dns:x/two"), egress.poll(2, TimeUnit.SECONDS));
        assertTrue(late.isEmpty());
    }
}
