package com.questrail.wrpbridge.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle returned by every registration in the bridge: scheduled liveness
 * ticks, subscriber registrations, context callbacks.
 *
 * <p>Cancelling removes exactly the registration that produced the handle and
 * nothing else.</p>
 */
@FunctionalInterface
public interface Cancellable
{
    /**
     * Attempt to cancel the registration.
     *
     * @return {@code true} if this call removed it; {@code false} if it had
     *         already run, been removed, or been cancelled before.
     */
    boolean cancel();
}
