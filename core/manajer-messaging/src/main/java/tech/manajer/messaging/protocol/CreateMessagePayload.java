package tech.manajer.messaging.protocol;

import tech.manajer.messaging.model.MediaMetadata;

/**
 * Payload of a new message.
 *
 * @param userId        author; optional when the connection is authenticated
 * @param content       message text
 * @param messageType   wire value of the message type, defaults to text
 * @param mediaPath     attachment reference
 * @param mediaMetadata attachment metadata
 */
public record CreateMessagePayload(
    String userId,
    String content,
    String messageType,
    String mediaPath,
    MediaMetadata mediaMetadata
) implements OperationPayload {
}
