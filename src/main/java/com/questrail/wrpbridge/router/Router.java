package com.questrail.wrpbridge.router;

import com.questrail.wrpbridge.config.ConnectionConfig;
import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.internal.time.SystemWallClock;
import com.questrail.wrpbridge.internal.time.WallClock;
import com.questrail.wrpbridge.model.InvalidLocatorException;
import com.questrail.wrpbridge.model.Locator;
import com.questrail.wrpbridge.model.Message;
import com.questrail.wrpbridge.model.MessageType;
import com.questrail.wrpbridge.observability.BridgeErrorEvent;
import com.questrail.wrpbridge.observability.BridgeObservabilitySink;
import com.questrail.wrpbridge.observability.ConnectionEvent;
import com.questrail.wrpbridge.outbound.Connection;
import com.questrail.wrpbridge.outbound.ConnectionFactory;
import com.questrail.wrpbridge.processor.MessageProcessor;
import com.questrail.wrpbridge.processor.ProcessResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Router
 * =============================================================================
 * Table of registered services, each with its own outbound {@link Connection}.
 *
 * <h2>Dispatch</h2>
 * <ul>
 *   <li>{@link MessageType#SERVICE_ALIVE}: sent to every entry; individual
 *       failures are logged and ignored</li>
 *   <li>anything else: routed by the {@code service} component of the
 *       destination locator; an unknown service is
 *       {@link ProcessResult#NOT_HANDLED}</li>
 * </ul>
 *
 * <h2>Locking</h2>
 * The table is guarded by a read/write lock. No transport call (dial, send,
 * close) is ever made while holding it.
 *
 * <h2>Self-pruning</h2>
 * Every connection is created with a close listener that removes its entry,
 * but only while the entry still refers to that same connection. A late
 * failure report from a replaced connection therefore never evicts its
 * successor.
 */
public final class Router implements MessageProcessor, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private static final long AUTHORIZED = 200L;

    private final ConnectionFactory connectionFactory;
    private final BridgeObservabilitySink sink;
    private final WallClock wallClock;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Connection> entries = new HashMap<>();

    public Router(ConnectionFactory connectionFactory, BridgeObservabilitySink sink) {
        this(connectionFactory, sink, SystemWallClock.INSTANCE);
    }

    public Router(ConnectionFactory connectionFactory, BridgeObservabilitySink sink, WallClock wallClock) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    @Override
    public ProcessResult process(Context ctx, Message message) {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(message, "message");

        if (message.is(MessageType.SERVICE_ALIVE)) {
            broadcast(ctx, message);
            return ProcessResult.HANDLED;
        }

        Locator locator = Locator.parse(message.destination());
        if (locator.service().isEmpty()) {
            throw new InvalidLocatorException(message.destination(), "no service to route to");
        }

        Connection connection;
        lock.readLock().lock();
        try {
            connection = entries.get(locator.service());
        } finally {
            lock.readLock().unlock();
        }

        if (connection == null) {
            return ProcessResult.NOT_HANDLED;
        }
        connection.send(ctx, message);
        return ProcessResult.HANDLED;
    }

    /**
     * Register {@code name} at the given endpoint, replacing any previous
     * registration.
     *
     * <p>The new connection is dialed before the table changes; if dialing
     * fails the table is untouched and the error is thrown. On success the
     * superseded connection (if any) is closed and the new peer is sent an
     * authorization message with status 200.</p>
     */
    public void upsert(String name, ConnectionConfig config) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(config, "config");

        Connection connection = connectionFactory.create(config,
                (source, cause) -> evictIfCurrent(name, source, cause));
        try {
            connection.dial();
        } catch (RuntimeException e) {
            connection.close();
            throw e;
        }

        Connection previous;
        lock.writeLock().lock();
        try {
            previous = entries.put(name, connection);
        } finally {
            lock.writeLock().unlock();
        }

        if (previous != null) {
            previous.close();
        }
        sink.onConnectionEvent(new ConnectionEvent(wallClock.now(),
                previous == null ? ConnectionEvent.Kind.REGISTERED : ConnectionEvent.Kind.REPLACED,
                name, config.url(), null));

        Message authorization = Message.builder(MessageType.AUTHORIZATION)
                .status(AUTHORIZED)
                .build();
        try {
            connection.send(Context.background(), authorization);
        } catch (RuntimeException e) {
            log.warn("Authorization to service '{}' at {} failed: {}", name, config.url(), e.getMessage());
            sink.onError(new BridgeErrorEvent(wallClock.now(),
                    "authorization to service '" + name + "' failed", e));
        }
    }

    /**
     * Remove and close the entry for {@code name}, if any.
     */
    public void remove(String name) {
        Connection removed;
        lock.writeLock().lock();
        try {
            removed = entries.remove(name);
        } finally {
            lock.writeLock().unlock();
        }

        if (removed != null) {
            removed.close();
            sink.onConnectionEvent(new ConnectionEvent(wallClock.now(), ConnectionEvent.Kind.REMOVED,
                    name, removed.url(), null));
        }
    }

    /**
     * Empty the table and close every connection.
     */
    @Override
    public void close() {
        List<Connection> closing;
        lock.writeLock().lock();
        try {
            closing = new ArrayList<>(entries.values());
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }

        for (Connection connection : closing) {
            connection.close();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String name) {
        lock.readLock().lock();
        try {
            return entries.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return registered service names, sorted
     */
    public Set<String> names() {
        lock.readLock().lock();
        try {
            return new TreeSet<>(entries.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void broadcast(Context ctx, Message message) {
        List<Map.Entry<String, Connection>> snapshot;
        lock.readLock().lock();
        try {
            snapshot = new ArrayList<>(entries.entrySet().size());
            for (Map.Entry<String, Connection> e : entries.entrySet()) {
                snapshot.add(Map.entry(e.getKey(), e.getValue()));
            }
        } finally {
            lock.readLock().unlock();
        }

        for (Map.Entry<String, Connection> e : snapshot) {
            try {
                e.getValue().send(ctx, message);
            } catch (RuntimeException ex) {
                log.debug("Broadcast to service '{}' failed: {}", e.getKey(), ex.getMessage());
            }
        }
    }

    private void evictIfCurrent(String name, Connection source, Throwable cause) {
        boolean evicted;
        lock.writeLock().lock();
        try {
            evicted = entries.remove(name, source);
        } finally {
            lock.writeLock().unlock();
        }

        if (evicted) {
            sink.onConnectionEvent(new ConnectionEvent(wallClock.now(), ConnectionEvent.Kind.EVICTED,
                    name, source.url(), cause));
        }
    }
}
