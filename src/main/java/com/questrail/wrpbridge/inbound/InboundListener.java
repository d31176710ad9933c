package com.questrail.wrpbridge.inbound;

import com.questrail.wrpbridge.codec.MessageCodecException;
import com.questrail.wrpbridge.codec.MessageDecoder;
import com.questrail.wrpbridge.config.ListenerConfig;
import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.internal.registry.SubscriberRegistry;
import com.questrail.wrpbridge.internal.time.Cancellable;
import com.questrail.wrpbridge.internal.time.SystemWallClock;
import com.questrail.wrpbridge.internal.time.WallClock;
import com.questrail.wrpbridge.model.Message;
import com.questrail.wrpbridge.observability.BridgeErrorEvent;
import com.questrail.wrpbridge.observability.BridgeObservabilitySink;
import com.questrail.wrpbridge.observability.ListenerEvent;
import com.questrail.wrpbridge.processor.MessageObserver;
import com.questrail.wrpbridge.transport.InboundSocket;
import com.questrail.wrpbridge.transport.ReceiveTimeoutException;
import com.questrail.wrpbridge.transport.TransportException;
import com.questrail.wrpbridge.transport.TransportRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * InboundListener
 * =============================================================================
 * Owns one listening socket and turns its frames into messages for subscribers.
 *
 * <h2>Data flow</h2>
 * <pre>
 *   InboundSocket.receive()
 *        -> MessageDecoder.decode()          (undecodable frames are dropped)
 *            -> bounded dispatch queue       (the loop blocks while it is full)
 *                -> dispatch workers
 *                    -> every message subscriber, each with a background context
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * {@link #listen()} starts a session; {@link #close()} ends it and waits until
 * the receive loop and every dispatch worker have stopped. A session also ends
 * on its own when the socket fails. Either way close subscribers hear about it
 * exactly once, after which the listener may be started again.
 */
public final class InboundListener implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(InboundListener.class);

    private static final long DRAIN_TIMEOUT_SECONDS = 5;

    private final ListenerConfig config;
    private final TransportRegistry transports;
    private final MessageDecoder decoder;
    private final BridgeObservabilitySink sink;
    private final WallClock wallClock;

    private final SubscriberRegistry<MessageObserver> messageSubscribers = new SubscriberRegistry<>();
    private final SubscriberRegistry<ListenerCloseListener> closeSubscribers = new SubscriberRegistry<>();

    private final Object lock = new Object();
    private Session session; // guarded by lock

    public InboundListener(ListenerConfig config,
                           TransportRegistry transports,
                           MessageDecoder decoder,
                           BridgeObservabilitySink sink) {
        this(config, transports, decoder, sink, SystemWallClock.INSTANCE);
    }

    public InboundListener(ListenerConfig config,
                           TransportRegistry transports,
                           MessageDecoder decoder,
                           BridgeObservabilitySink sink,
                           WallClock wallClock) {
        this.config = Objects.requireNonNull(config, "config");
        this.transports = Objects.requireNonNull(transports, "transports");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Deliver every decoded message to {@code subscriber}.
     */
    public Cancellable addMessageSubscriber(MessageObserver subscriber) {
        return messageSubscribers.add(subscriber);
    }

    /**
     * Be told once each time a listening session ends.
     */
    public Cancellable addCloseSubscriber(ListenerCloseListener subscriber) {
        return closeSubscribers.add(subscriber);
    }

    /**
     * Bind the socket and start receiving. A no-op while already listening.
     *
     * @throws TransportException if the socket cannot be bound; nothing is started
     */
    public void listen() {
        synchronized (lock) {
            if (session != null) {
                return;
            }
            InboundSocket socket = transports.listen(config.url(), config.receiveTimeout());
            session = new Session(socket);
            session.start();
        }
        sink.onListenerEvent(new ListenerEvent(wallClock.now(), ListenerEvent.Kind.STARTED, config.url(), null));
    }

    /**
     * Stop receiving and wait for in-flight dispatch to finish. A no-op when
     * not listening.
     *
     * <p>Called from a subscriber callback this only requests the stop, since
     * the calling thread is one the session would wait for.</p>
     */
    @Override
    public void close() {
        Session s;
        synchronized (lock) {
            s = session;
        }
        if (s != null) {
            s.stop();
        }
    }

    public boolean isListening() {
        synchronized (lock) {
            return session != null;
        }
    }

    /**
     * @return the bound address while listening, otherwise {@code null}
     */
    public SocketAddress localAddress() {
        synchronized (lock) {
            return session == null ? null : session.socket.localAddress();
        }
    }

    private void deliver(Message message) {
        messageSubscribers.visit(subscriber -> {
            try {
                subscriber.observe(Context.background(), message);
            } catch (RuntimeException e) {
                log.warn("Message subscriber failed on {}", message, e);
                sink.onError(new BridgeErrorEvent(wallClock.now(), "message subscriber failed", e));
            }
        });
    }

    private void ended(Session s, Throwable failure) {
        synchronized (lock) {
            if (session == s) {
                session = null;
            }
        }

        if (failure == null) {
            sink.onListenerEvent(new ListenerEvent(wallClock.now(), ListenerEvent.Kind.STOPPED, config.url(), null));
        } else {
            sink.onListenerEvent(new ListenerEvent(wallClock.now(), ListenerEvent.Kind.FAILED, config.url(), failure));
        }

        closeSubscribers.visit(subscriber -> {
            try {
                subscriber.onClose(failure);
            } catch (RuntimeException e) {
                log.warn("Close subscriber failed", e);
            }
        });
    }

    /**
     * One listen()..close() cycle: the socket, its receive loop and its
     * dispatch workers.
     */
    private final class Session
    {
        private final InboundSocket socket;
        private final Context ctx = Context.withCancel(Context.background());
        private final Set<Thread> ownThreads = ConcurrentHashMap.newKeySet();
        private final ExecutorService workers;
        private final Thread loopThread;

        private final Object queueLock = new Object();
        private final ArrayDeque<Message> queue = new ArrayDeque<>(); // guarded by queueLock
        private boolean draining; // guarded by queueLock

        private Session(InboundSocket socket) {
            this.socket = socket;

            AtomicInteger seq = new AtomicInteger();
            this.workers = Executors.newFixedThreadPool(config.dispatchWorkers(), r -> {
                Thread t = new Thread(r, "wrp-dispatch-" + seq.incrementAndGet());
                t.setDaemon(true);
                ownThreads.add(t);
                return t;
            });

            this.loopThread = new Thread(this::receiveLoop, "wrp-listener " + config.url());
            loopThread.setDaemon(true);
            ownThreads.add(loopThread);

            // Cancelling releases a receive() blocked without a deadline.
            ctx.onDone(socket::close);
            ctx.onDone(this::wakeQueueWaiters);
        }

        private void start() {
            for (int i = 0; i < config.dispatchWorkers(); i++) {
                workers.execute(this::dispatchLoop);
            }
            loopThread.start();
        }

        private void stop() {
            ctx.cancel();
            if (ownThreads.contains(Thread.currentThread())) {
                return;
            }
            try {
                loopThread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void receiveLoop() {
            Throwable failure = null;
            try {
                while (!ctx.isDone()) {
                    byte[] frame;
                    try {
                        frame = socket.receive();
                    } catch (ReceiveTimeoutException e) {
                        continue;
                    } catch (TransportException e) {
                        if (!ctx.isDone()) {
                            failure = e;
                        }
                        break;
                    }

                    Message message;
                    try {
                        message = decoder.decode(frame);
                    } catch (MessageCodecException e) {
                        log.debug("Discarding undecodable frame ({} bytes): {}", frame.length, e.getMessage());
                        continue;
                    }

                    if (!enqueue(message)) {
                        break;
                    }
                }
            } catch (RuntimeException e) {
                failure = e;
            } catch (Error e) {
                failure = e;
                throw e;
            } finally {
                finish(failure);
            }
        }

        /**
         * Blocks while the queue is full.
         *
         * @return {@code false} if the session ended first
         */
        private boolean enqueue(Message message) {
            synchronized (queueLock) {
                try {
                    while (queue.size() >= config.dispatchQueueCapacity() && !ctx.isDone()) {
                        queueLock.wait();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
                if (ctx.isDone()) {
                    return false;
                }
                queue.addLast(message);
                queueLock.notifyAll();
                return true;
            }
        }

        /**
         * @return the next message, or {@code null} once draining and empty
         */
        private Message take() throws InterruptedException {
            synchronized (queueLock) {
                while (queue.isEmpty() && !draining) {
                    queueLock.wait();
                }
                Message message = queue.pollFirst();
                if (message != null) {
                    queueLock.notifyAll();
                }
                return message;
            }
        }

        private void wakeQueueWaiters() {
            synchronized (queueLock) {
                queueLock.notifyAll();
            }
        }

        private void dispatchLoop() {
            try {
                Message message;
                while ((message = take()) != null) {
                    deliver(message);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void finish(Throwable failure) {
            if (failure != null) {
                log.warn("Listener on {} failed", config.url(), failure);
            }

            ctx.cancel();
            try {
                socket.close();
            } catch (RuntimeException e) {
                log.debug("Error closing listener socket", e);
            }

            synchronized (queueLock) {
                draining = true;
                queueLock.notifyAll();
            }
            workers.shutdown();
            try {
                if (!workers.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Dispatch workers did not drain within {}s; interrupting", DRAIN_TIMEOUT_SECONDS);
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }

            ended(this, failure);
        }
    }
}
