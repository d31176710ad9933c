package com.questrail.wrpbridge.outbound;

import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.internal.time.Cancellable;
import com.questrail.wrpbridge.model.Message;

/**
 * Connection
 * =============================================================================
 * Outbound endpoint to a single peer.
 *
 * <h2>States</h2>
 * <pre>
 *   NEW --dial()--> OPEN --close() / send failure--> CLOSED
 *    \______________________close()________________/
 * </pre>
 *
 * <p>CLOSED is final. A failed dial leaves the connection NEW.</p>
 */
public interface Connection extends AutoCloseable
{
    /**
     * Connect to the peer. A no-op when already open.
     *
     * @throws ConnectionClosedException if the connection was closed
     * @throws com.questrail.wrpbridge.transport.TransportException if the peer cannot be reached
     */
    void dial();

    /**
     * Encode and send one message. Sends on one connection never interleave.
     *
     * @throws ConnectionClosedException if the connection is not open
     * @throws SendFailedException if the transport failed; the connection is now closed
     * @throws com.questrail.wrpbridge.transport.SendTimeoutException if the peer did not
     *         accept the frame in time; the connection stays open
     * @throws com.questrail.wrpbridge.context.ContextCancelledException if {@code ctx}
     *         completed first
     */
    void send(Context ctx, Message message);

    /**
     * Register a listener told once when an open connection closes.
     */
    Cancellable addCloseListener(ConnectionCloseListener listener);

    /**
     * @return the peer URL
     */
    String url();

    boolean isOpen();

    /**
     * Idempotent. Never throws.
     */
    @Override
    void close();
}
