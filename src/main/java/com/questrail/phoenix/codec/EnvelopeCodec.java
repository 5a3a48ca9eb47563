package com.questrail.phoenix.codec;

import com.questrail.phoenix.model.Envelope;

/**
 * Text codec for the socket wire format.
 *
 * <p>Implementations must be stateless and thread-safe.</p>
 */
public interface EnvelopeCodec
{
    /**
     * Encode an envelope into one text frame.
     */
    String encode(Envelope envelope);

    /**
     * Decode one inbound text frame.
     *
     * @throws EnvelopeDecodeException if the text is not a well-formed envelope
     */
    Envelope decode(String text) throws EnvelopeDecodeException;
}
