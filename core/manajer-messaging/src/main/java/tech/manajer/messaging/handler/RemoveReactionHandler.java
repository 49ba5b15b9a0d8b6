package tech.manajer.messaging.handler;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import org.bson.types.ObjectId;
import tech.manajer.messaging.connection.ChannelConnection;
import tech.manajer.messaging.model.Message;
import tech.manajer.messaging.protocol.EventNames;
import tech.manajer.messaging.protocol.MessageResponse;
import tech.manajer.messaging.protocol.OperationType;
import tech.manajer.messaging.protocol.ReactionPayload;
import tech.manajer.messaging.repository.MessageRepository;
import tech.manajer.platform.shared.ObjectIds;

/**
 * Removes the acting user from an emoji's reaction bucket; an emptied bucket
 * disappears in the same write.
 */
@Singleton
public class RemoveReactionHandler implements OperationHandler<ReactionPayload> {

    private final MessageRepository repository;
    private final OperationSupport support;

    @Inject
    public RemoveReactionHandler(MessageRepository repository, OperationSupport support) {
        this.repository = repository;
        this.support = support;
    }

    @Override
    public void handle(ChannelConnection connection, ReactionPayload payload) {
        ObjectId messageId = ObjectIds.parse(payload.messageId(), "Invalid message ID");
        ObjectId userId = support.actingUser(connection, payload.userId());
        if (payload.emoji() == null || payload.emoji().isEmpty()) {
            throw new BadRequestException("Emoji is required");
        }

        Message message = support.persist(OperationType.REMOVE_REACTION,
                () -> repository.removeReaction(messageId, userId, payload.emoji()))
            .orElseThrow(() -> new NotFoundException("Message not found"));

        MessageResponse response = MessageResponse.from(message);
        support.reply(connection, EventNames.REACTION_REMOVED, response);
        support.broadcast(connection, EventNames.REACTION_REMOVED, response);
    }
}
