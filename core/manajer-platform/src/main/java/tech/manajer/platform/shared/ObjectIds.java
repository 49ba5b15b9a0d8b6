package tech.manajer.platform.shared;

import jakarta.ws.rs.BadRequestException;
import org.bson.types.ObjectId;

/**
 * Parsing of the 24-character hex identifiers used for every stored entity.
 *
 * Identifiers arrive as strings from URLs, tokens and frame payloads; this is
 * the single place that turns them into {@link ObjectId}s.
 */
public final class ObjectIds {

    private ObjectIds() {
    }

    public static boolean isValid(String value) {
        return value != null && ObjectId.isValid(value);
    }

    /**
     * Parse an identifier, failing with a validation error carrying {@code message}.
     *
     * @throws BadRequestException if the value is null or not a valid id
     */
    public static ObjectId parse(String value, String message) {
        if (!isValid(value)) {
            throw new BadRequestException(message);
        }
        return new ObjectId(value);
    }

    /**
     * Parse an identifier that may be absent.
     *
     * @return null when the value is null or blank
     * @throws BadRequestException if a value is present but malformed
     */
    public static ObjectId parseOptional(String value, String message) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return parse(value, message);
    }
}
