package com.questrail.wrpbridge.codec;

import com.questrail.wrpbridge.model.Message;

/**
 * MessageDecoder
 * -----------------------------------------------------------------------------
 * Inbound boundary between the bytes of one transport frame and a
 * {@link Message}.
 *
 * <p>The input is always exactly one frame; the decoder never buffers across
 * calls. A decode failure is a defect of that frame only and must not affect
 * the session it arrived on.</p>
 */
@FunctionalInterface
public interface MessageDecoder
{
    /**
     * @throws MessageCodecException if the frame is not a valid encoded message
     */
    Message decode(byte[] frame);
}
