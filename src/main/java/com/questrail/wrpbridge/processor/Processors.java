package com.questrail.wrpbridge.processor;

import com.questrail.wrpbridge.internal.registry.SubscriberRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Adapters from hooks to {@link MessageProcessor}s.
 */
public final class Processors
{
    private Processors() {
    }

    /**
     * A processor that shows the message to each observer in turn and then
     * declines it, so the chain always continues. Observers registered later
     * are picked up on the next message.
     */
    public static MessageProcessor observing(SubscriberRegistry<MessageObserver> observers) {
        Objects.requireNonNull(observers, "observers");
        return (ctx, message) -> {
            observers.visit(observer -> observer.observe(ctx, message));
            return ProcessResult.NOT_HANDLED;
        };
    }

    /**
     * As {@link #observing(SubscriberRegistry)} over a fixed list.
     */
    public static MessageProcessor observing(List<? extends MessageObserver> observers) {
        List<? extends MessageObserver> fixed = List.copyOf(observers);
        return (ctx, message) -> {
            for (MessageObserver observer : fixed) {
                observer.observe(ctx, message);
            }
            return ProcessResult.NOT_HANDLED;
        };
    }
}
