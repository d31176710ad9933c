package com.questrail.wrpbridge.transport;

/**
 * Dialed (PUSH) side of a transport, connected to exactly one peer.
 */
public interface OutboundSocket extends AutoCloseable
{
    /**
     * Send one frame.
     *
     * @throws SendTimeoutException if the peer does not accept it within the send deadline
     * @throws SocketClosedException if the socket or the peer connection is gone
     * @throws TransportException    on any other failure
     */
    void send(byte[] frame);

    /**
     * Idempotent.
     */
    @Override
    void close();
}
