package com.questrail.wrpbridge.processor;

import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.model.Message;

/**
 * Side-effect-only hook: sees a message, never affects its routing.
 */
@FunctionalInterface
public interface MessageObserver
{
    void observe(Context ctx, Message message);
}
