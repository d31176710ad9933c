package com.questrail.wrpbridge.codec;

import com.questrail.wrpbridge.BridgeException;

/**
 * A message could not be encoded, or a frame could not be decoded.
 */
public final class MessageCodecException extends BridgeException
{
    public MessageCodecException(String message) {
        super(message);
    }

    public MessageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
