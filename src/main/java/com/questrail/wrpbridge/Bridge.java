package com.questrail.wrpbridge;

import com.questrail.wrpbridge.codec.MessageCodec;
import com.questrail.wrpbridge.codec.impl.MsgpackMessageCodec;
import com.questrail.wrpbridge.config.BridgeConfig;
import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.filter.MessageFilters;
import com.questrail.wrpbridge.inbound.InboundListener;
import com.questrail.wrpbridge.internal.registry.SubscriberRegistry;
import com.questrail.wrpbridge.internal.time.Cancellable;
import com.questrail.wrpbridge.internal.time.MonotonicClock;
import com.questrail.wrpbridge.internal.time.MonotonicScheduler;
import com.questrail.wrpbridge.internal.time.ScheduledExecutorScheduler;
import com.questrail.wrpbridge.internal.time.SystemMonotonicClock;
import com.questrail.wrpbridge.internal.time.SystemWallClock;
import com.questrail.wrpbridge.internal.time.WallClock;
import com.questrail.wrpbridge.model.Message;
import com.questrail.wrpbridge.model.MessageType;
import com.questrail.wrpbridge.observability.BridgeErrorEvent;
import com.questrail.wrpbridge.observability.BridgeObservabilitySink;
import com.questrail.wrpbridge.observability.Slf4jBridgeObservabilitySink;
import com.questrail.wrpbridge.outbound.ConnectionFactory;
import com.questrail.wrpbridge.outbound.TransportConnection;
import com.questrail.wrpbridge.processor.MessageModifier;
import com.questrail.wrpbridge.processor.MessageObserver;
import com.questrail.wrpbridge.processor.MessageProcessor;
import com.questrail.wrpbridge.processor.ProcessResult;
import com.questrail.wrpbridge.processor.ProcessorChain;
import com.questrail.wrpbridge.processor.Processors;
import com.questrail.wrpbridge.router.Router;
import com.questrail.wrpbridge.runtime.LivenessEmitter;
import com.questrail.wrpbridge.transport.TransportRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Bridge
 * =============================================================================
 * Composition root joining the inbound listener, the router and the liveness
 * emitter into one WRP bridge.
 *
 * <h2>Inbound (network to application)</h2>
 * <pre>
 *   InboundListener
 *        -> inbound observers
 *            -> reject unsupported types
 *                -> service registration   (upserts the router; handled)
 *                    -> reject local types
 *                        -> egress modifiers
 * </pre>
 *
 * <h2>Outbound (application to network)</h2>
 * <pre>
 *   process(ctx, message)
 *        -> reject unsupported types
 *            -> reject local types
 *                -> outbound observers
 *                    -> Router
 * </pre>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} and {@link #stop()} are idempotent and may be repeated.
 * {@link #close()} stops the bridge for good and releases the liveness thread
 * if the bridge created it.
 */
public final class Bridge implements MessageProcessor, AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(Bridge.class);

    private final BridgeConfig config;
    private final BridgeObservabilitySink sink;
    private final WallClock wallClock;
    private final ScheduledExecutorService ownedExecutor;

    private final InboundListener listener;
    private final Router router;
    private final LivenessEmitter liveness;

    private final SubscriberRegistry<MessageObserver> inboundObservers = new SubscriberRegistry<>();
    private final SubscriberRegistry<MessageObserver> outboundObservers = new SubscriberRegistry<>();
    private final SubscriberRegistry<MessageModifier> egressModifiers = new SubscriberRegistry<>();

    private final ProcessorChain inboundChain;
    private final ProcessorChain outboundChain;

    private final Object lifecycleLock = new Object();
    private Context lifecycle; // guarded by lifecycleLock; non-null while running

    private Bridge(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.sink = b.sink;
        this.wallClock = b.wallClock;

        MonotonicScheduler scheduler = b.scheduler;
        if (scheduler == null) {
            this.ownedExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "wrp-liveness");
                t.setDaemon(true);
                return t;
            });
            scheduler = new ScheduledExecutorScheduler(ownedExecutor, b.clock);
        } else {
            this.ownedExecutor = null;
        }

        ConnectionFactory connections = b.connectionFactory != null
                ? b.connectionFactory
                : TransportConnection.factory(b.transports, b.codec);

        this.listener = new InboundListener(config.listenerConfig(), b.transports, b.codec, sink, wallClock);
        this.router = new Router(connections, sink, wallClock);
        this.liveness = new LivenessEmitter(scheduler, b.clock, config.livenessInterval(), this::announceAlive);

        config.inboundObservers().forEach(inboundObservers::add);
        config.outboundObservers().forEach(outboundObservers::add);
        config.egressModifiers().forEach(egressModifiers::add);

        this.inboundChain = ProcessorChain.of(
                Processors.observing(inboundObservers),
                MessageFilters.rejectUnsupportedTypes(),
                this::handleRegistration,
                MessageFilters.rejectLocalTypes(),
                this::egress);

        this.outboundChain = ProcessorChain.of(
                MessageFilters.rejectUnsupportedTypes(),
                MessageFilters.rejectLocalTypes(),
                Processors.observing(outboundObservers),
                router);

        listener.addMessageSubscriber(this::onInbound);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Start the liveness emitter and the listener. A no-op while running.
     *
     * @throws com.questrail.wrpbridge.transport.TransportException if the
     *         listener cannot bind; liveness keeps running until {@link #stop()}
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (lifecycle != null) {
                return;
            }
            lifecycle = Context.withCancel(Context.background());
            liveness.start(lifecycle);
            listener.listen();
        }
        log.info("Bridge listening on {}", listener.localAddress());
    }

    /**
     * Stop everything started by {@link #start()} and close every registered
     * connection. A no-op when not running.
     *
     * <p>Every component is shut down even if an earlier one fails; the first
     * failure is thrown with the rest attached as suppressed.</p>
     */
    public void stop() {
        synchronized (lifecycleLock) {
            if (lifecycle == null) {
                return;
            }
            lifecycle.cancel();
            lifecycle = null;

            RuntimeException failure = null;
            try {
                listener.close();
            } catch (RuntimeException e) {
                failure = e;
            }
            try {
                router.close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
            liveness.stop();

            if (failure != null) {
                throw failure;
            }
        }
        log.info("Bridge stopped");
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return lifecycle != null;
        }
    }

    /**
     * Stop and release the liveness thread the bridge created, if any.
     */
    @Override
    public void close() {
        try {
            stop();
        } finally {
            if (ownedExecutor != null) {
                ownedExecutor.shutdownNow();
            }
        }
    }

    /**
     * Send a message from the application towards a registered service.
     *
     * @return {@link ProcessResult#NOT_HANDLED} when no service matches the destination
     */
    @Override
    public ProcessResult process(Context ctx, Message message) {
        return outboundChain.process(ctx, message);
    }

    /**
     * Run a message through the inbound chain as if it had arrived on the listener.
     */
    public ProcessResult processInbound(Context ctx, Message message) {
        return inboundChain.process(ctx, message);
    }

    public Cancellable addEgressModifier(MessageModifier modifier) {
        return egressModifiers.add(modifier);
    }

    public Cancellable addInboundObserver(MessageObserver observer) {
        return inboundObservers.add(observer);
    }

    public Cancellable addOutboundObserver(MessageObserver observer) {
        return outboundObservers.add(observer);
    }

    /**
     * @return the listener's bound address while running, otherwise {@code null}
     */
    public SocketAddress localAddress() {
        return listener.localAddress();
    }

    /**
     * @return names of the currently registered services, sorted
     */
    public Set<String> registeredServices() {
        return router.names();
    }

    private void onInbound(Context ctx, Message message) {
        try {
            inboundChain.process(ctx, message);
        } catch (BridgeException e) {
            log.warn("Dropped inbound {}: {}", message, e.getMessage());
            sink.onError(new BridgeErrorEvent(wallClock.now(), "inbound message dropped", e));
        }
    }

    private ProcessResult handleRegistration(Context ctx, Message message) {
        if (!message.is(MessageType.SERVICE_REGISTRATION)) {
            return ProcessResult.NOT_HANDLED;
        }
        if (message.serviceName() == null || message.url() == null) {
            throw new InvalidMessageException("service registration requires service_name and url");
        }

        router.upsert(message.serviceName(), config.connectionConfig(message.url()));
        return ProcessResult.HANDLED;
    }

    private ProcessResult egress(Context ctx, Message message) {
        egressModifiers.visit(modifier -> {
            try {
                modifier.modify(ctx, message);
            } catch (RuntimeException e) {
                log.warn("Egress modifier failed on {}", message, e);
            }
        });
        return ProcessResult.HANDLED;
    }

    private void announceAlive(Context ctx) {
        Message alive = Message.builder(MessageType.SERVICE_ALIVE).build();
        outboundObservers.visit(observer -> observer.observe(ctx, alive));
        router.process(ctx, alive);
    }

    public static final class Builder {
        private BridgeConfig config;
        private TransportRegistry transports = TransportRegistry.defaults();
        private MessageCodec codec = new MsgpackMessageCodec();
        private ConnectionFactory connectionFactory;
        private MonotonicScheduler scheduler;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private BridgeObservabilitySink sink = new Slf4jBridgeObservabilitySink();

        public Builder withConfig(BridgeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withTransports(TransportRegistry transports) {
            this.transports = Objects.requireNonNull(transports, "transports");
            return this;
        }

        public Builder withCodec(MessageCodec codec) {
            this.codec = Objects.requireNonNull(codec, "codec");
            return this;
        }

        /**
         * Overrides how outbound connections are built; by default they use
         * the configured transports and codec.
         */
        public Builder withConnectionFactory(ConnectionFactory connectionFactory) {
            this.connectionFactory = connectionFactory;
            return this;
        }

        /**
         * Scheduler for liveness runs. When absent the bridge creates and owns
         * a single daemon thread.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public Builder withObservabilitySink(BridgeObservabilitySink sink) {
            this.sink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Bridge build() {
            return new Bridge(this);
        }
    }
}
