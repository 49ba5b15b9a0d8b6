package tech.manajer.messaging.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.bson.types.ObjectId;
import tech.manajer.messaging.model.MediaMetadata;
import tech.manajer.messaging.model.Message;
import tech.manajer.messaging.model.Reaction;

import java.time.Instant;
import java.util.List;

/**
 * Outbound shape of a message. Ids are hex strings, timestamps ISO-8601.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageResponse(
    String id,
    String channelId,
    String userId,
    String content,
    String messageType,
    String mediaPath,
    MediaMetadata mediaMetadata,
    String createdAt,
    String updatedAt,
    @JsonProperty("isPinned") boolean isPinned,
    List<ReactionResponse> reactions
) {

    public static MessageResponse from(Message message) {
        List<ReactionResponse> reactions = message.reactions == null
            ? List.of()
            : message.reactions.stream().map(ReactionResponse::from).toList();

        return new MessageResponse(
            hex(message.id),
            hex(message.channelId),
            hex(message.userId),
            message.content,
            message.messageType,
            message.mediaPath,
            message.mediaMetadata,
            iso(message.createdAt),
            iso(message.updatedAt),
            message.isPinned,
            reactions
        );
    }

    private static String hex(ObjectId id) {
        return id != null ? id.toHexString() : null;
    }

    private static String iso(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    public record ReactionResponse(
        String emoji,
        List<String> userIds
    ) {
        public static ReactionResponse from(Reaction reaction) {
            List<String> userIds = reaction.userIds == null
                ? List.of()
                : reaction.userIds.stream().map(ObjectId::toHexString).toList();
            return new ReactionResponse(reaction.emoji, userIds);
        }
    }
}
