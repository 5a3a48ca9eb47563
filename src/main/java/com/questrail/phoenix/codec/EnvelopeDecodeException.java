package com.questrail.phoenix.codec;

/**
 * Thrown when an inbound text frame is not a valid envelope.
 *
 * <p>This is a per-message defect: it fails the single message being
 * processed and never the connection.</p>
 */
public final class EnvelopeDecodeException extends Exception
{
    public EnvelopeDecodeException(String message)
    {
        super(message);
    }

    public EnvelopeDecodeException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
