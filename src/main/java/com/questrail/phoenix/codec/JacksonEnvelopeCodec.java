package com.questrail.phoenix.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.phoenix.model.Envelope;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * JacksonEnvelopeCodec
 * =============================================================================
 * {@link EnvelopeCodec} backed by a Jackson {@link ObjectMapper}.
 *
 * <h2>Outbound</h2>
 * Field order is fixed: {@code topic, event, payload, ref}. An absent ref is
 * written as JSON {@code null}.
 *
 * <h2>Inbound</h2>
 * <ul>
 *   <li>{@code topic} and {@code event} are required strings</li>
 *   <li>{@code payload} may be any JSON value; a missing payload decodes as {@code null}</li>
 *   <li>{@code ref} may be an integer, a decimal string (the Phoenix V1 JSON
 *       serializer sends refs as strings), {@code null}, or missing</li>
 * </ul>
 * Anything else is rejected with {@link EnvelopeDecodeException}.
 */
public final class JacksonEnvelopeCodec implements EnvelopeCodec
{
    private final ObjectMapper mapper;

    public JacksonEnvelopeCodec()
    {
        this(new ObjectMapper());
    }

    public JacksonEnvelopeCodec(ObjectMapper mapper)
    {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public String encode(Envelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");

        ObjectNode node = mapper.createObjectNode();
        node.put("topic", envelope.topic());
        node.put("event", envelope.event());
        node.set("payload", envelope.payload());
        if (envelope.ref().isPresent()) {
            node.put("ref", envelope.ref().getAsLong());
        } else {
            node.putNull("ref");
        }

        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            // A tree built from JsonNode values always serializes.
            throw new IllegalStateException("Failed to encode envelope for topic " + envelope.topic(), e);
        }
    }

    @Override
    public Envelope decode(String text) throws EnvelopeDecodeException
    {
        Objects.requireNonNull(text, "text");

        final JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new EnvelopeDecodeException("Malformed JSON envelope", e);
        }

        if (root == null || !root.isObject()) {
            throw new EnvelopeDecodeException("Envelope must be a JSON object");
        }

        String topic = requireText(root, "topic");
        String event = requireText(root, "event");

        JsonNode payload = root.get("payload");
        if (payload == null) {
            payload = NullNode.getInstance();
        }

        return new Envelope(topic, event, payload, decodeRef(root.get("ref")));
    }

    private static String requireText(JsonNode root, String field) throws EnvelopeDecodeException
    {
        JsonNode value = root.get(field);
        if (value == null || !value.isTextual()) {
            throw new EnvelopeDecodeException("Envelope field '" + field + "' must be a string");
        }
        return value.asText();
    }

    private static OptionalLong decodeRef(JsonNode ref) throws EnvelopeDecodeException
    {
        if (ref == null || ref.isNull()) {
            return OptionalLong.empty();
        }
        if (ref.isIntegralNumber() && ref.canConvertToLong()) {
            return OptionalLong.of(ref.asLong());
        }
        if (ref.isTextual()) {
            try {
                return OptionalLong.of(Long.parseLong(ref.asText()));
            } catch (NumberFormatException e) {
                throw new EnvelopeDecodeException("Envelope ref is not numeric: " + ref.asText(), e);
            }
        }
        throw new EnvelopeDecodeException("Envelope ref must be an integer or null");
    }
}
