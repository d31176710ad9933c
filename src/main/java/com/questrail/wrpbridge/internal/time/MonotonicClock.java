package com.questrail.wrpbridge.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for the liveness cadence.
 *
 * <p>Intervals are measured on a monotonic clock so a wall-clock jump (NTP,
 * manual adjustment) never bunches up or suppresses liveness announcements.
 * Wall-clock time is used only for observability timestamps.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Only
     * differences between two values are meaningful.
     */
    long nowNanos();
}
