package com.questrail.wrpbridge.processor;

import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.model.Message;

/**
 * Hook that receives a message and may return a derived one.
 *
 * <p>Egress modifiers are the bridge's exit point for inbound traffic. Their
 * return values are currently discarded by the bridge.</p>
 */
@FunctionalInterface
public interface MessageModifier
{
    Message modify(Context ctx, Message message);
}
