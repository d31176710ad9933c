package com.questrail.wrpbridge.runtime;

import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.internal.time.Cancellable;
import com.questrail.wrpbridge.internal.time.MonotonicClock;
import com.questrail.wrpbridge.internal.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * LivenessEmitter
 * =============================================================================
 * Runs an announcement once per interval until stopped.
 *
 * <p>Each run re-arms the next one only after it finishes, so a slow
 * announcement delays the schedule instead of overlapping it. Runs never
 * execute concurrently with each other or with {@link #stop()}: once
 * {@code stop()} returns, no announcement is in progress and none is pending.</p>
 *
 * <p>The announcement receives the context passed to {@link #start(Context)};
 * once that context is done, no further runs happen.</p>
 */
public final class LivenessEmitter
{
    private static final Logger log = LoggerFactory.getLogger(LivenessEmitter.class);

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration interval;
    private final Consumer<Context> announcement;

    private final Object tickLock = new Object();
    private Context ctx;          // guarded by tickLock
    private Cancellable pending;  // guarded by tickLock
    private long generation;      // guarded by tickLock; a stale run sees a different value

    public LivenessEmitter(MonotonicScheduler scheduler,
                           MonotonicClock clock,
                           Duration interval,
                           Consumer<Context> announcement) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.announcement = Objects.requireNonNull(announcement, "announcement");
        if (interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("interval must be > 0");
        }
    }

    /**
     * Arm the first run one interval from now. A no-op while running.
     */
    public void start(Context ctx) {
        Objects.requireNonNull(ctx, "ctx");
        synchronized (tickLock) {
            if (this.ctx != null) {
                return;
            }
            this.ctx = ctx;
            generation++;
            arm();
        }
    }

    /**
     * Cancel the pending run, waiting for one in progress to finish.
     */
    public void stop() {
        synchronized (tickLock) {
            if (pending != null) {
                pending.cancel();
                pending = null;
            }
            ctx = null;
            generation++;
        }
    }

    public boolean isRunning() {
        synchronized (tickLock) {
            return ctx != null;
        }
    }

    private void arm() {
        long armedFor = generation;
        pending = scheduler.scheduleAfter(interval, clock, () -> tick(armedFor));
    }

    private void tick(long armedFor) {
        synchronized (tickLock) {
            Context current = ctx;
            if (armedFor != generation || current == null || current.isDone()) {
                return;
            }

            try {
                announcement.accept(current);
            } catch (RuntimeException e) {
                log.warn("Liveness announcement failed", e);
            }

            if (armedFor == generation && !current.isDone()) {
                arm();
            }
        }
    }
}
