package com.questrail.wrpbridge.router;

import com.questrail.wrpbridge.codec.impl.MsgpackMessageCodec;
import com.questrail.wrpbridge.config.ConnectionConfig;
import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.model.InvalidLocatorException;
import com.questrail.wrpbridge.model.Message;
import com.questrail.wrpbridge.model.MessageType;
import com.questrail.wrpbridge.observability.BridgeErrorEvent;
import com.questrail.wrpbridge.observability.ConnectionEvent;
import com.questrail.wrpbridge.observability.RecordingObservabilitySink;
import com.questrail.wrpbridge.outbound.SendFailedException;
import com.questrail.wrpbridge.outbound.TransportConnection;
import com.questrail.wrpbridge.processor.ProcessResult;
import com.questrail.wrpbridge.transport.FakeTransport;
import com.questrail.wrpbridge.transport.SocketClosedException;
import com.questrail.wrpbridge.transport.TransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class RouterTest {

    private final MsgpackMessageCodec codec = new MsgpackMessageCodec();
    private final FakeTransport fake = new FakeTransport();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final Router router = new Router(TransportConnection.factory(FakeTransport.registry(fake), codec), sink);

    @AfterEach
    void tearDown() {
        router.close();
    }

    private static String url(int port) {
        return "fake://svc:" + port;
    }

    private static Message to(String destination) {
        return Message.builder(MessageType.SIMPLE_EVENT).source("dns:bridge").destination(destination).build();
    }

    private List<Message> received(String url) {
        return fake.outbound(url).sent().stream().map(codec::decode).collect(Collectors.toList());
    }

    private List<ConnectionEvent.Kind> connectionKinds() {
        return sink.connectionEvents().stream().map(ConnectionEvent::kind).collect(Collectors.toList());
    }

    @Test
    void upsertDialsAndAuthorizesTheService() {
        router.upsert("config", ConnectionConfig.of(url(1)));

        assertTrue(router.contains("config"));
        List<Message> sent = received(url(1));
        assertEquals(1, sent.size());
        assertTrue(sent.get(0).is(MessageType.AUTHORIZATION));
        assertEquals(200L, sent.get(0).status());
        assertEquals(List.of(ConnectionEvent.Kind.REGISTERED), connectionKinds());
    }

    @Test
    void messagesAreRoutedByServiceName() {
        router.upsert("config", ConnectionConfig.of(url(1)));
        router.upsert("iot", ConnectionConfig.of(url(2)));

        ProcessResult result = router.process(Context.background(), to("mac:112233445566/iot/some/path"));

        assertEquals(ProcessResult.HANDLED, result);
        assertEquals(1, received(url(1)).size());
        List<Message> iot = received(url(2));
        assertEquals(2, iot.size());
        assertEquals(to("mac:112233445566/iot/some/path"), iot.get(1));
    }

    @Test
    void unknownServiceIsNotHandled() {
        router.upsert("config", ConnectionConfig.of(url(1)));

        assertEquals(ProcessResult.NOT_HANDLED, router.process(Context.background(), to("dns:talaria/other")));
        assertEquals(1, received(url(1)).size());
    }

    @Test
    void badDestinationsAreRejected() {
        assertThrows(InvalidLocatorException.class, () -> router.process(Context.background(), to(null)));
        assertThrows(InvalidLocatorException.class, () -> router.process(Context.background(), to("nonsense")));
        InvalidLocatorException noService = assertThrows(InvalidLocatorException.class,
                () -> router.process(Context.background(), to("dns:talaria")));
        assertTrue(noService.getMessage().contains("no service"));
    }

    @Test
    void sendFailureIsPropagatedAndEvictsTheEntry() {
        router.upsert("config", ConnectionConfig.of(url(1)));
        SocketClosedException reset = new SocketClosedException("reset");
        fake.outbound(url(1)).failWith(reset);

        SendFailedException e = assertThrows(SendFailedException.class,
                () -> router.process(Context.background(), to("dns:x/config")));

        assertSame(reset, e.getCause());
        assertFalse(router.contains("config"));
        ConnectionEvent evicted = sink.connectionEvents().get(1);
        assertEquals(ConnectionEvent.Kind.EVICTED, evicted.kind());
        assertEquals("config", evicted.service());
        assertSame(e, evicted.cause());
    }

    @Test
    void aliveIsBroadcastToEveryServiceDespiteFailures() {
        router.upsert("a", ConnectionConfig.of(url(1)));
        router.upsert("b", ConnectionConfig.of(url(2)));
        router.upsert("c", ConnectionConfig.of(url(3)));
        fake.outbound(url(2)).failWith(new TransportException("broken pipe"));

        Message alive = Message.builder(MessageType.SERVICE_ALIVE).build();
        assertEquals(ProcessResult.HANDLED, router.process(Context.background(), alive));

        assertEquals(alive, received(url(1)).get(1));
        assertEquals(alive, received(url(3)).get(1));
        assertEquals(Set.of("a", "c"), router.names());
    }

    @Test
    void aliveWithNoServicesIsStillHandled() {
        Message alive = Message.builder(MessageType.SERVICE_ALIVE).build();

        assertEquals(ProcessResult.HANDLED, router.process(Context.background(), alive));
    }

    @Test
    void reRegistrationReplacesAndClosesThePreviousConnection() {
        router.upsert("config", ConnectionConfig.of(url(1)));
        FakeTransport.FakeOutboundSocket old = fake.outbound(url(1));

        router.upsert("config", ConnectionConfig.of(url(2)));

        assertEquals(1, old.closeCount());
        assertEquals(1, router.size());
        assertEquals(List.of(ConnectionEvent.Kind.REGISTERED, ConnectionEvent.Kind.REPLACED), connectionKinds());

        router.process(Context.background(), to("dns:x/config"));
        assertEquals(2, received(url(2)).size());
        assertEquals(1, old.sent().size());
    }

    @Test
    void reRegistrationAtTheSameUrlKeepsTheNewEntry() {
        router.upsert("config", ConnectionConfig.of(url(1)));
        router.upsert("config", ConnectionConfig.of(url(1)));

        // The superseded connection's close must not evict its successor.
        assertTrue(router.contains("config"));
        assertEquals(2, fake.dialCount(url(1)));
        assertFalse(connectionKinds().contains(ConnectionEvent.Kind.EVICTED));

        assertEquals(ProcessResult.HANDLED, router.process(Context.background(), to("dns:x/config")));
    }

    @Test
    void failedDialLeavesTheTableUntouched() {
        router.upsert("config", ConnectionConfig.of(url(1)));
        fake.failDial(new TransportException("refused"));

        assertThrows(TransportException.class, () -> router.upsert("config", ConnectionConfig.of(url(2))));
        assertThrows(TransportException.class, () -> router.upsert("other", ConnectionConfig.of(url(3))));

        assertEquals(Set.of("config"), router.names());
        assertFalse(fake.outbound(url(1)).isClosed());
    }

    @Test
    void failedAuthorizationIsReportedNotThrown() {
        fake.failSendsOnNewSockets(new SocketClosedException("gone"));

        router.upsert("config", ConnectionConfig.of(url(1)));

        assertFalse(router.contains("config"));
        assertTrue(fake.outbound(url(1)).isClosed());
        assertEquals(List.of(ConnectionEvent.Kind.REGISTERED, ConnectionEvent.Kind.EVICTED), connectionKinds());
        assertTrue(sink.hasEventOfType(BridgeErrorEvent.class));
    }

    @Test
    void removeClosesTheConnection() {
        router.upsert("config", ConnectionConfig.of(url(1)));

        router.remove("config");
        router.remove("config");

        assertFalse(router.contains("config"));
        assertTrue(fake.outbound(url(1)).isClosed());
        assertEquals(List.of(ConnectionEvent.Kind.REGISTERED, ConnectionEvent.Kind.REMOVED), connectionKinds());
    }

    @Test
    void closeEmptiesTheTable() {
        router.upsert("a", ConnectionConfig.of(url(1)));
        router.upsert("b", ConnectionConfig.of(url(2)));

        router.close();

        assertEquals(0, router.size());
        assertTrue(fake.outbound(url(1)).isClosed());
        assertTrue(fake.outbound(url(2)).isClosed());
        assertEquals(ProcessResult.NOT_HANDLED, router.process(Context.background(), to("dns:x/a")));
    }
}
