package com.questrail.wrpbridge.outbound;

/**
 * Told when an open {@link Connection} closes.
 */
@FunctionalInterface
public interface ConnectionCloseListener
{
    /**
     * @param source the connection that closed
     * @param cause  the failure that tore it down, or {@code null} for an explicit close
     */
    void onClose(Connection source, Throwable cause);
}
