package com.questrail.wrpbridge.filter;

import com.questrail.wrpbridge.model.MessageType;
import com.questrail.wrpbridge.processor.MessageProcessor;
import com.questrail.wrpbridge.processor.ProcessResult;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Stateless gate processors. Each one either throws or returns
 * {@link ProcessResult#NOT_HANDLED}; none ever handles a message.
 */
public final class MessageFilters
{
    private static final Set<MessageType> LOCAL_TYPES = EnumSet.of(
            MessageType.AUTHORIZATION,
            MessageType.SERVICE_REGISTRATION,
            MessageType.SERVICE_ALIVE);

    private static final MessageProcessor REJECT_UNSUPPORTED = (ctx, message) -> {
        Optional<MessageType> type = message.type();
        if (type.isEmpty() || type.get().isReservedInvalid()) {
            throw new UnsupportedMessageTypeException(message.typeCode());
        }
        return ProcessResult.NOT_HANDLED;
    };

    private static final MessageProcessor REJECT_LOCAL = (ctx, message) -> {
        Optional<MessageType> type = message.type();
        if (type.isPresent() && LOCAL_TYPES.contains(type.get())) {
            throw new LocalMessageTypeException(type.get());
        }
        return ProcessResult.NOT_HANDLED;
    };

    private MessageFilters() {
    }

    /**
     * Rejects codes below zero, at or above {@link MessageType#LAST_CODE}, and
     * the two reserved-invalid codes.
     */
    public static MessageProcessor rejectUnsupportedTypes() {
        return REJECT_UNSUPPORTED;
    }

    /**
     * Rejects authorization, service registration and service alive messages.
     */
    public static MessageProcessor rejectLocalTypes() {
        return REJECT_LOCAL;
    }
}
