package com.questrail.wrpbridge.transport;

import java.time.Duration;

/**
 * No frame arrived within the socket's receive deadline. The socket is still usable.
 */
public final class ReceiveTimeoutException extends TransportException
{
    public ReceiveTimeoutException(Duration deadline) {
        super("receive timed out after " + deadline.toMillis() + " ms");
    }
}
