package com.questrail.wrpbridge.context;

import com.questrail.wrpbridge.BridgeException;

/**
 * The caller's {@link Context} completed before the operation did.
 *
 * <p>Not a transport failure: it means "the operation was abandoned", not
 * "the link is broken".</p>
 */
public final class ContextCancelledException extends BridgeException
{
    private final boolean deadlineExceeded;

    public ContextCancelledException(boolean deadlineExceeded) {
        super(deadlineExceeded ? "context deadline exceeded" : "context canceled");
        this.deadlineExceeded = deadlineExceeded;
    }

    public boolean deadlineExceeded() {
        return deadlineExceeded;
    }
}
