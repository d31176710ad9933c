package com.questrail.wrpbridge.model;

import java.util.Optional;

/**
 * WRP message types with their wire codes.
 *
 * <p>A {@link Message} stores the raw numeric code rather than this enum so
 * that codes outside the enumeration survive decoding and can be rejected
 * explicitly by the type filters.</p>
 */
public enum MessageType
{
    INVALID_0(0),
    INVALID_1(1),
    AUTHORIZATION(2),
    SIMPLE_REQUEST_RESPONSE(3),
    SIMPLE_EVENT(4),
    CREATE(5),
    RETRIEVE(6),
    UPDATE(7),
    DELETE(8),
    SERVICE_REGISTRATION(9),
    SERVICE_ALIVE(10),
    UNKNOWN(11);

    /**
     * One past the highest defined code.
     */
    public static final int LAST_CODE = 12;

    private static final MessageType[] BY_CODE = values();

    private final int code;

    MessageType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return {@code true} for the two reserved codes that are never valid on the wire
     */
    public boolean isReservedInvalid() {
        return this == INVALID_0 || this == INVALID_1;
    }

    public static Optional<MessageType> fromCode(int code) {
        if (code < 0 || code >= LAST_CODE) {
            return Optional.empty();
        }
        return Optional.of(BY_CODE[code]);
    }
}
