package com.questrail.wrpbridge.processor;

/**
 * Outcome of a {@link MessageProcessor} that did not fail.
 */
public enum ProcessResult
{
    /** The message was consumed; later processors in a chain are skipped. */
    HANDLED,

    /** The processor declined the message; a chain moves on to the next one. */
    NOT_HANDLED
}
