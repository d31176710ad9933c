package com.questrail.wrpbridge.transport;

import com.questrail.wrpbridge.BridgeException;

/**
 * Failure reported by a {@link Transport} or one of its sockets.
 *
 * <p>Subclasses distinguish the outcomes callers act on differently:
 * {@link ReceiveTimeoutException}, {@link SendTimeoutException} and
 * {@link SocketClosedException}.</p>
 */
public class TransportException extends BridgeException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
