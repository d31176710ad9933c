package com.questrail.wrpbridge.filter;

import com.questrail.wrpbridge.BridgeException;

/**
 * The message type code is reserved-invalid or outside the WRP enumeration.
 */
public final class UnsupportedMessageTypeException extends BridgeException
{
    private final int typeCode;

    public UnsupportedMessageTypeException(int typeCode) {
        super("invalid message type: " + typeCode);
        this.typeCode = typeCode;
    }

    public int typeCode() {
        return typeCode;
    }
}
