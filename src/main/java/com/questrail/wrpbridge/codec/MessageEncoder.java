package com.questrail.wrpbridge.codec;

import com.questrail.wrpbridge.model.Message;

/**
 * MessageEncoder
 * -----------------------------------------------------------------------------
 * Outbound boundary between a {@link Message} and the bytes of one transport
 * frame.
 *
 * <p>The encoder only serializes. It never decides whether a message may be
 * sent; that is the job of the processor chains.</p>
 */
@FunctionalInterface
public interface MessageEncoder
{
    /**
     * Encode one message into one complete frame.
     *
     * @throws MessageCodecException if the message cannot be serialized
     */
    byte[] encode(Message message);
}
