package com.questrail.wrpbridge.transport;

import java.time.Duration;

/**
 * A frame was not accepted by the peer within the socket's send deadline.
 * The socket is still usable.
 */
public final class SendTimeoutException extends TransportException
{
    public SendTimeoutException(Duration deadline) {
        super("send timed out after " + deadline.toMillis() + " ms");
    }
}
