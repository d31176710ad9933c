package com.questrail.wrpbridge.codec;

/**
 * Both directions of one wire format. Both ends of a link must agree on it.
 */
public interface MessageCodec extends MessageEncoder, MessageDecoder
{
}
