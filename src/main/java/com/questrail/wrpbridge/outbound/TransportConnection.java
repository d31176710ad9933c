package com.questrail.wrpbridge.outbound;

import com.questrail.wrpbridge.codec.MessageEncoder;
import com.questrail.wrpbridge.config.ConnectionConfig;
import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.internal.registry.SubscriberRegistry;
import com.questrail.wrpbridge.internal.time.Cancellable;
import com.questrail.wrpbridge.model.Message;
import com.questrail.wrpbridge.transport.OutboundSocket;
import com.questrail.wrpbridge.transport.SendTimeoutException;
import com.questrail.wrpbridge.transport.TransportException;
import com.questrail.wrpbridge.transport.TransportRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * TransportConnection
 * =============================================================================
 * {@link Connection} backed by an {@link OutboundSocket} from a
 * {@link TransportRegistry}.
 *
 * <h2>Send path</h2>
 * <pre>
 *   caller: encode -> acquire permit -> hand frame to send thread -> wait
 *   send thread: socket.send(frame) -> release permit
 * </pre>
 *
 * <p>The permit is released by the send thread, not the caller. A caller whose
 * context completes stops waiting at once, but the next send still queues
 * behind the abandoned one until the transport call returns.</p>
 *
 * <h2>Failure handling</h2>
 * <ul>
 *   <li>{@link SendTimeoutException}: reported, connection stays open</li>
 *   <li>any other {@link TransportException}: socket closed, state CLOSED,
 *       close listeners told once with a {@link SendFailedException}</li>
 * </ul>
 */
public final class TransportConnection implements Connection
{
    private static final Logger log = LoggerFactory.getLogger(TransportConnection.class);

    private enum State
    {
        NEW,
        OPEN,
        CLOSED
    }

    private final ConnectionConfig config;
    private final TransportRegistry transports;
    private final MessageEncoder encoder;

    private final SubscriberRegistry<ConnectionCloseListener> closeListeners = new SubscriberRegistry<>();
    private final Object handleLock = new Object();
    private final Object permitLock = new Object();
    private boolean permitHeld; // guarded by permitLock

    // Guarded by handleLock.
    private State state = State.NEW;
    private OutboundSocket socket;
    private ExecutorService sendExecutor;

    public TransportConnection(ConnectionConfig config, TransportRegistry transports, MessageEncoder encoder) {
        this.config = Objects.requireNonNull(config, "config");
        this.transports = Objects.requireNonNull(transports, "transports");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
    }

    /**
     * A factory producing connections that share {@code transports} and {@code encoder}.
     */
    public static ConnectionFactory factory(TransportRegistry transports, MessageEncoder encoder) {
        Objects.requireNonNull(transports, "transports");
        Objects.requireNonNull(encoder, "encoder");
        return (config, closeListener) -> {
            TransportConnection connection = new TransportConnection(config, transports, encoder);
            if (closeListener != null) {
                connection.addCloseListener(closeListener);
            }
            return connection;
        };
    }

    @Override
    public void dial() {
        synchronized (handleLock) {
            switch (state) {
                case OPEN -> {
                    return;
                }
                case CLOSED -> throw new ConnectionClosedException(config.url());
                case NEW -> {
                    socket = transports.dial(config.url(), config.sendTimeout());
                    sendExecutor = Executors.newSingleThreadExecutor(r -> {
                        Thread t = new Thread(r, "wrp-send " + config.url());
                        t.setDaemon(true);
                        return t;
                    });
                    state = State.OPEN;
                }
            }
        }
        log.debug("Dialed {}", config.url());
    }

    @Override
    public void send(Context ctx, Message message) {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(message, "message");

        ctx.throwIfDone();
        byte[] frame = encoder.encode(message);

        acquirePermit(ctx);

        OutboundSocket s;
        ExecutorService executor;
        synchronized (handleLock) {
            s = socket;
            executor = sendExecutor;
        }
        if (s == null) {
            releasePermit();
            throw new ConnectionClosedException(config.url());
        }

        CompletableFuture<Void> transfer;
        try {
            transfer = CompletableFuture.runAsync(() -> transfer(s, frame), executor);
        } catch (RejectedExecutionException e) {
            // Closed between reading the handle and submitting.
            releasePermit();
            throw new ConnectionClosedException(config.url());
        }

        await(ctx, transfer);
    }

    @Override
    public Cancellable addCloseListener(ConnectionCloseListener listener) {
        return closeListeners.add(listener);
    }

    @Override
    public String url() {
        return config.url();
    }

    @Override
    public boolean isOpen() {
        synchronized (handleLock) {
            return state == State.OPEN;
        }
    }

    @Override
    public void close() {
        OutboundSocket s;
        synchronized (handleLock) {
            if (state == State.CLOSED) {
                return;
            }
            state = State.CLOSED;
            s = socket;
            socket = null;
            if (sendExecutor != null) {
                sendExecutor.shutdown();
            }
        }

        if (s != null) {
            closeQuietly(s);
            log.debug("Closed connection to {}", config.url());
            notifyClosed(null);
        }
    }

    @Override
    public String toString() {
        return "TransportConnection{" + config.url() + "}";
    }

    /**
     * Waits for the send permit. Completion of {@code ctx} wakes the wait.
     */
    private void acquirePermit(Context ctx) {
        Cancellable wake = ctx.onDone(this::wakePermitWaiters);
        try {
            synchronized (permitLock) {
                while (permitHeld) {
                    ctx.throwIfDone();
                    permitLock.wait();
                }
                ctx.throwIfDone();
                permitHeld = true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SendInterruptedException(config.url(), e);
        } finally {
            wake.cancel();
        }
    }

    private void releasePermit() {
        synchronized (permitLock) {
            permitHeld = false;
            permitLock.notifyAll();
        }
    }

    private void wakePermitWaiters() {
        synchronized (permitLock) {
            permitLock.notifyAll();
        }
    }

    // Runs on the send thread and owns the permit until the transport call returns.
    private void transfer(OutboundSocket s, byte[] frame) {
        SendFailedException failure;
        boolean tornDown;
        try {
            s.send(frame);
            return;
        } catch (SendTimeoutException e) {
            throw e;
        } catch (TransportException e) {
            failure = new SendFailedException(config.url(), e);
            tornDown = tearDownIfCurrent(s);
        } finally {
            releasePermit();
        }

        if (tornDown) {
            log.warn("Connection to {} failed: {}", config.url(), failure.getCause().getMessage());
            notifyClosed(failure);
        }
        throw failure;
    }

    private boolean tearDownIfCurrent(OutboundSocket s) {
        synchronized (handleLock) {
            if (socket != s) {
                return false;
            }
            socket = null;
            state = State.CLOSED;
            sendExecutor.shutdown();
        }
        closeQuietly(s);
        return true;
    }

    private void await(Context ctx, CompletableFuture<Void> transfer) {
        if (ctx.isCancellable()) {
            CompletableFuture<Void> abandoned = new CompletableFuture<>();
            Cancellable registration = ctx.onDone(() -> abandoned.complete(null));
            try {
                CompletableFuture.anyOf(transfer, abandoned).handle((r, e) -> null).join();
            } finally {
                registration.cancel();
            }
            ctx.throwIfDone();
        }

        try {
            transfer.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    private void notifyClosed(Throwable cause) {
        closeListeners.visit(listener -> {
            try {
                listener.onClose(this, cause);
            } catch (RuntimeException e) {
                log.warn("Close listener for {} failed", config.url(), e);
            }
        });
    }

    private void closeQuietly(OutboundSocket s) {
        try {
            s.close();
        } catch (RuntimeException e) {
            log.debug("Error closing socket to {}", config.url(), e);
        }
    }
}
