package com.questrail.wrpbridge.outbound;

import com.questrail.wrpbridge.BridgeException;

/**
 * The sending thread was interrupted while waiting for its turn. Nothing was
 * sent and the connection is unaffected.
 */
public final class SendInterruptedException extends BridgeException
{
    public SendInterruptedException(String url, InterruptedException cause) {
        super("interrupted waiting to send to " + url, cause);
    }
}
