package com.questrail.wrpbridge;

/**
 * Root of the bridge's unchecked exception hierarchy.
 *
 * <p>Every failure surfaced by a processing step, a transport or a
 * configuration check is a subclass of this type, so callers composing
 * processors can catch a single type while still telling protocol violations,
 * transport failures and cancellation apart by subclass.</p>
 */
public class BridgeException extends RuntimeException
{
    public BridgeException(String message) {
        super(message);
    }

    public BridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
