package com.questrail.wrpbridge.transport;

import java.net.SocketAddress;

/**
 * Listening (PULL) side of a transport: frames from any number of connected
 * peers arrive on a single queue.
 */
public interface InboundSocket extends AutoCloseable
{
    /**
     * Block until the next frame arrives.
     *
     * @return the frame bytes, owned by the caller
     * @throws ReceiveTimeoutException if the receive deadline elapses first
     * @throws SocketClosedException   once the socket has been closed
     * @throws TransportException      on any other failure
     */
    byte[] receive();

    /**
     * @return the bound local address; for port 0 this reports the chosen port
     */
    SocketAddress localAddress();

    /**
     * Close the socket. A thread blocked in {@link #receive()} is released
     * with {@link SocketClosedException}. Idempotent.
     */
    @Override
    void close();
}
