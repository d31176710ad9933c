package com.questrail.wrpbridge.processor;

import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.model.Message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * ProcessorChain
 * =============================================================================
 * Ordered, immutable sequence of {@link MessageProcessor}s evaluated first
 * match wins.
 *
 * <h2>Evaluation</h2>
 * <ul>
 *   <li>the context is checked before every processor; once it is done the
 *       chain stops with {@link com.questrail.wrpbridge.context.ContextCancelledException}</li>
 *   <li>{@link ProcessResult#NOT_HANDLED} moves on to the next processor</li>
 *   <li>{@link ProcessResult#HANDLED} stops the chain</li>
 *   <li>an exception stops the chain and propagates unchanged</li>
 * </ul>
 *
 * <p>A chain in which every processor declines returns
 * {@link ProcessResult#NOT_HANDLED}; so does an empty chain. {@code null}
 * entries are skipped.</p>
 */
public final class ProcessorChain implements MessageProcessor
{
    private final List<MessageProcessor> processors;

    private ProcessorChain(List<MessageProcessor> processors) {
        this.processors = processors;
    }

    public static ProcessorChain of(MessageProcessor... processors) {
        return of(Arrays.asList(processors));
    }

    public static ProcessorChain of(List<? extends MessageProcessor> processors) {
        Objects.requireNonNull(processors, "processors");

        List<MessageProcessor> copy = new ArrayList<>(processors.size());
        for (MessageProcessor p : processors) {
            if (p != null) {
                copy.add(p);
            }
        }
        return new ProcessorChain(Collections.unmodifiableList(copy));
    }

    @Override
    public ProcessResult process(Context ctx, Message message) {
        Objects.requireNonNull(ctx, "ctx");
        Objects.requireNonNull(message, "message");

        for (MessageProcessor processor : processors) {
            ctx.throwIfDone();

            ProcessResult result = processor.process(ctx, message);
            if (result != ProcessResult.NOT_HANDLED) {
                return ProcessResult.HANDLED;
            }
        }
        return ProcessResult.NOT_HANDLED;
    }

    public int size() {
        return processors.size();
    }
}
