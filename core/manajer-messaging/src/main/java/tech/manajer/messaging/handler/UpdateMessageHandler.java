package tech.manajer.messaging.handler;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import org.bson.types.ObjectId;
import org.jboss.logging.Logger;
import tech.manajer.messaging.connection.ChannelConnection;
import tech.manajer.messaging.model.Message;
import tech.manajer.messaging.model.MessageType;
import tech.manajer.messaging.protocol.EventNames;
import tech.manajer.messaging.protocol.MessageResponse;
import tech.manajer.messaging.protocol.OperationType;
import tech.manajer.messaging.protocol.UpdateMessagePayload;
import tech.manajer.messaging.repository.MessageChanges;
import tech.manajer.messaging.repository.MessageRepository;
import tech.manajer.platform.activitylog.ActivityLogService;
import tech.manajer.platform.shared.ObjectIds;

/**
 * Applies a partial update to a message.
 *
 * Only fields present in the payload change; isPinned is tri-state. Pin and
 * unpin are recorded in the activity log.
 */
@Singleton
public class UpdateMessageHandler implements OperationHandler<UpdateMessagePayload> {

    private static final Logger LOG = Logger.getLogger(UpdateMessageHandler.class);

    private final MessageRepository repository;
    private final OperationSupport support;
    private final ActivityLogService activityLogService;

    @Inject
    public UpdateMessageHandler(MessageRepository repository, OperationSupport support,
                                ActivityLogService activityLogService) {
        this.repository = repository;
        this.support = support;
        this.activityLogService = activityLogService;
    }

    @Override
    public void handle(ChannelConnection connection, UpdateMessagePayload payload) {
        ObjectId messageId = ObjectIds.parse(payload.id(), "Invalid message ID");

        MessageType messageType = support.messageType(payload.messageType(), null);
        MessageChanges changes = new MessageChanges(
            payload.content(),
            messageType != null ? messageType.wireValue() : null,
            payload.mediaPath(),
            payload.mediaMetadata(),
            payload.isPinned());
        if (changes.isEmpty()) {
            throw new BadRequestException("No data to update");
        }

        Message updated = support.persist(OperationType.UPDATE_MESSAGE, () -> repository.update(messageId, changes))
            .orElseThrow(() -> new NotFoundException("Message not found for update"));
        LOG.debugf("Message [%s] updated", messageId);

        MessageResponse response = MessageResponse.from(updated);
        support.reply(connection, EventNames.MESSAGE_UPDATED, response);
        support.broadcast(connection, EventNames.MESSAGE_UPDATED, response);

        if (changes.isPinned() != null) {
            activityLogService.logActivity(
                support.authenticatedUserId(connection),
                changes.isPinned() ? "message.pinned" : "message.unpinned",
                "WS",
                connection.path(),
                200,
                connection.remoteAddress());
        }
    }
}
