/**
 * Envelope codec: JSON text to {@link com.questrail.phoenix.model.Envelope} and back.
 *
 * <pre>
 *   String (text frame)
 *        → EnvelopeCodec.decode   (shape and ref rules applied here)
 *            → Envelope
 *                → PhoenixSocket routing
 * </pre>
 *
 * <p>A decode failure is a per-message defect. It never closes the connection.</p>
 */
package com.questrail.phoenix.codec;
