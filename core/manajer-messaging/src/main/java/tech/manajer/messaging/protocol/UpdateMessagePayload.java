package tech.manajer.messaging.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import tech.manajer.messaging.model.MediaMetadata;

/**
 * Partial update of a message. Absent fields are left untouched.
 */
public record UpdateMessagePayload(
    String id,
    String content,
    String messageType,
    String mediaPath,
    MediaMetadata mediaMetadata,
    @JsonProperty("isPinned") Boolean isPinned
) implements OperationPayload {
}
