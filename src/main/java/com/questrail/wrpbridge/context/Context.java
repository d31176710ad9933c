package com.questrail.wrpbridge.context;

import com.questrail.wrpbridge.internal.registry.SubscriberRegistry;
import com.questrail.wrpbridge.internal.time.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Context
 * =============================================================================
 * Cancellation and deadline handle threaded through every processing call.
 *
 * <p>A context completes at most once, either because it was cancelled or
 * because its deadline passed. Completion propagates from a parent to all of
 * its children, never the other way round. A child that completes on its own
 * detaches from its parent.</p>
 *
 * <h2>Usage</h2>
 * <pre>
 *   Context ctx = Context.withTimeout(Context.background(), Duration.ofSeconds(2));
 *   bridge.process(ctx, message);
 * </pre>
 *
 * <p>Cancelling a context never aborts work already handed to a transport; it
 * only releases the caller that is waiting on that work.</p>
 */
public final class Context
{
    private static final Logger log = LoggerFactory.getLogger(Context.class);

    private static final Context BACKGROUND = new Context();

    private final Object lock = new Object();
    private final SubscriberRegistry<Runnable> callbacks = new SubscriberRegistry<>();

    // Guarded by lock; null while live.
    private Reason reason;

    private Context() {
    }

    /**
     * The root context. It is never cancelled and has no deadline.
     */
    public static Context background() {
        return BACKGROUND;
    }

    /**
     * A child of {@code parent} that can be cancelled independently.
     */
    public static Context withCancel(Context parent) {
        Objects.requireNonNull(parent, "parent");

        Context child = new Context();
        if (parent.isCancellable()) {
            Cancellable link = parent.onDone(() -> child.complete(parent.reason()));
            child.onDone(link::cancel);
        }
        return child;
    }

    /**
     * A child of {@code parent} that completes on its own once {@code timeout}
     * has elapsed.
     */
    public static Context withTimeout(Context parent, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");

        Context child = withCancel(parent);
        if (timeout.isNegative() || timeout.isZero()) {
            child.complete(Reason.DEADLINE_EXCEEDED);
            return child;
        }

        CompletableFuture.delayedExecutor(timeout.toNanos(), TimeUnit.NANOSECONDS)
                .execute(() -> child.complete(Reason.DEADLINE_EXCEEDED));
        return child;
    }

    /**
     * Cancel this context and all of its descendants. Idempotent; a no-op on
     * {@link #background()}.
     */
    public void cancel() {
        complete(Reason.CANCELED);
    }

    /**
     * Register a callback that runs once this context completes. If the
     * context is already complete the callback runs immediately on the
     * calling thread.
     *
     * @return handle that detaches the callback if it has not run yet
     */
    public Cancellable onDone(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        if (!isCancellable()) {
            return () -> false;
        }

        synchronized (lock) {
            if (reason == null) {
                return callbacks.add(callback);
            }
        }
        callback.run();
        return () -> false;
    }

    /**
     * @return {@code false} only for {@link #background()}, which can never complete
     */
    public boolean isCancellable() {
        return this != BACKGROUND;
    }

    public boolean isDone() {
        return reason() != null;
    }

    /**
     * @return the completion error, or {@code null} while the context is live
     */
    public ContextCancelledException error() {
        Reason r = reason();
        return r == null ? null : new ContextCancelledException(r == Reason.DEADLINE_EXCEEDED);
    }

    /**
     * Throw the completion error if this context is already complete.
     */
    public void throwIfDone() {
        ContextCancelledException error = error();
        if (error != null) {
            throw error;
        }
    }

    private Reason reason() {
        synchronized (lock) {
            return reason;
        }
    }

    private void complete(Reason r) {
        if (!isCancellable()) {
            return;
        }
        synchronized (lock) {
            if (reason != null) {
                return;
            }
            reason = r;
        }

        callbacks.visit(callback -> {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Context completion callback failed", e);
            }
        });
    }

    private enum Reason
    {
        CANCELED,
        DEADLINE_EXCEEDED
    }
}
