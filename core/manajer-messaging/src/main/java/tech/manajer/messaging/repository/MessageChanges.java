package tech.manajer.messaging.repository;

import tech.manajer.messaging.model.MediaMetadata;

/**
 * Partial update of a message. Null fields are left untouched.
 *
 * @param content       new text content
 * @param messageType   wire value of the new message type
 * @param mediaPath     new attachment reference
 * @param mediaMetadata new attachment metadata
 * @param isPinned      true pins, false unpins, null leaves the flag as is
 */
public record MessageChanges(
    String content,
    String messageType,
    String mediaPath,
    MediaMetadata mediaMetadata,
    Boolean isPinned
) {

    public boolean isEmpty() {
        return content == null
            && messageType == null
            && mediaPath == null
            && mediaMetadata == null
            && isPinned == null;
    }
}
