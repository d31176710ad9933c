package com.questrail.wrpbridge.transport;

/**
 * The socket was closed locally or the peer went away.
 */
public final class SocketClosedException extends TransportException
{
    public SocketClosedException(String message) {
        super(message);
    }

    public SocketClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
