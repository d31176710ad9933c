package com.questrail.wrpbridge.inbound;

/**
 * Told once per listening session when the session ends.
 */
@FunctionalInterface
public interface ListenerCloseListener
{
    /**
     * @param cause the transport failure that ended the session, or
     *              {@code null} when it was closed on request
     */
    void onClose(Throwable cause);
}
