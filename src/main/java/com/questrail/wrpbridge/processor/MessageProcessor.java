package com.questrail.wrpbridge.processor;

import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.model.Message;

/**
 * MessageProcessor
 * =============================================================================
 * A single step applied to a message travelling through the bridge.
 *
 * <p>Declining a message is a normal outcome ({@link ProcessResult#NOT_HANDLED}),
 * not an error. Failures are reported by throwing a
 * {@link com.questrail.wrpbridge.BridgeException} subclass.</p>
 *
 * <p>Processors must not mutate the message; a step that wants to pass on a
 * different message builds a new one.</p>
 */
@FunctionalInterface
public interface MessageProcessor
{
    ProcessResult process(Context ctx, Message message);
}
