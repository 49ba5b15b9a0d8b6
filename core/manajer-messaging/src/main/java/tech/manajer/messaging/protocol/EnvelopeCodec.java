package tech.manajer.messaging.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Reads and writes the {@code {"type": ..., "payload": ...}} frame envelope.
 *
 * <p>Decoding happens in two steps: the envelope is parsed and its type looked
 * up first, then the payload is bound to that operation's record. Unknown
 * payload fields are ignored; a missing or null payload decodes as an empty
 * object.
 */
@Singleton
public class EnvelopeCodec {

    static final String TYPE = "type";
    static final String PAYLOAD = "payload";

    private final ObjectMapper objectMapper;
    private final ObjectReader payloadReader;

    @Inject
    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.payloadReader = objectMapper.reader()
            .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Decode one inbound text frame.
     *
     * @throws UnknownOperationException if the type is not a known operation
     * @throws FrameDecodingException    if the envelope or payload is malformed
     */
    public DecodedOperation decode(String frame) {
        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            throw new FrameDecodingException("Invalid message format", e);
        }
        if (root == null || !root.isObject() || !root.path(TYPE).isTextual()) {
            throw new FrameDecodingException("Invalid message format");
        }

        String typeName = root.get(TYPE).asText();
        OperationType type = OperationType.fromWire(typeName)
            .orElseThrow(() -> new UnknownOperationException(typeName));

        JsonNode payload = root.get(PAYLOAD);
        if (payload == null || payload.isNull()) {
            payload = objectMapper.createObjectNode();
        }
        if (!payload.isObject()) {
            throw new FrameDecodingException("Invalid payload for " + type.wireName());
        }

        try {
            return new DecodedOperation(type, payloadReader.treeToValue(payload, type.payloadType()));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new FrameDecodingException("Invalid payload for " + type.wireName(), e);
        }
    }

    /**
     * Encode an outbound event. A String payload is written as a JSON string.
     */
    public String encode(String eventType, Object payload) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put(TYPE, eventType);
        root.set(PAYLOAD, objectMapper.valueToTree(payload));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + eventType + " event", e);
        }
    }

    public String encodeError(String message) {
        return encode(EventNames.ERROR, message);
    }
}
