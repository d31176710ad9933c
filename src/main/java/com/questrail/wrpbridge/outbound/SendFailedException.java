package com.questrail.wrpbridge.outbound;

import com.questrail.wrpbridge.BridgeException;
import com.questrail.wrpbridge.transport.TransportException;

/**
 * A send failed at the transport and the connection was torn down.
 * The transport failure is the cause.
 */
public final class SendFailedException extends BridgeException
{
    public SendFailedException(String url, TransportException cause) {
        super("send to " + url + " failed: " + cause.getMessage(), cause);
    }
}
