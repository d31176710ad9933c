package com.questrail.wrpbridge.filter;

import com.questrail.wrpbridge.context.Context;
import com.questrail.wrpbridge.model.Message;
import com.questrail.wrpbridge.model.MessageType;
import com.questrail.wrpbridge.processor.MessageProcessor;
import com.questrail.wrpbridge.processor.ProcessResult;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

final class MessageFiltersTest {

    private static Message ofCode(int code) {
        return Message.builder().typeCode(code).build();
    }

    @Test
    void unsupportedFilterRejectsInvalidAndOutOfRangeCodes() {
        MessageProcessor filter = MessageFilters.rejectUnsupportedTypes();

        for (int code : new int[] {-1, 0, 1, MessageType.LAST_CODE, 99}) {
            UnsupportedMessageTypeException e = assertThrows(UnsupportedMessageTypeException.class,
                    () -> filter.process(Context.background(), ofCode(code)));
            assertEquals(code, e.typeCode());
            assertEquals("invalid message type: " + code, e.getMessage());
        }
    }

    @Test
    void unsupportedFilterPassesEveryDefinedType() {
        MessageProcessor filter = MessageFilters.rejectUnsupportedTypes();

        for (MessageType type : MessageType.values()) {
            if (!type.isReservedInvalid()) {
                assertEquals(ProcessResult.NOT_HANDLED, filter.process(Context.background(), ofCode(type.code())));
            }
        }
    }

    @Test
    void localFilterRejectsExactlyTheLocalTypes() {
        MessageProcessor filter = MessageFilters.rejectLocalTypes();
        EnumSet<MessageType> local = EnumSet.of(
                MessageType.AUTHORIZATION, MessageType.SERVICE_REGISTRATION, MessageType.SERVICE_ALIVE);

        for (MessageType type : MessageType.values()) {
            Message m = ofCode(type.code());
            if (local.contains(type)) {
                LocalMessageTypeException e = assertThrows(LocalMessageTypeException.class,
                        () -> filter.process(Context.background(), m));
                assertEquals(type, e.type());
            } else {
                assertEquals(ProcessResult.NOT_HANDLED, filter.process(Context.background(), m));
            }
        }
    }

    @Test
    void localFilterIgnoresUnknownCodes() {
        assertEquals(ProcessResult.NOT_HANDLED,
                MessageFilters.rejectLocalTypes().process(Context.background(), ofCode(77)));
    }
}
