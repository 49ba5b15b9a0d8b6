package tech.manajer.messaging.handler;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.NotFoundException;
import org.bson.types.ObjectId;
import org.jboss.logging.Logger;
import tech.manajer.messaging.connection.ChannelConnection;
import tech.manajer.messaging.protocol.DeleteMessagePayload;
import tech.manajer.messaging.protocol.EventNames;
import tech.manajer.messaging.protocol.MessageDeletedResponse;
import tech.manajer.messaging.protocol.OperationType;
import tech.manajer.messaging.repository.MessageRepository;
import tech.manajer.platform.activitylog.ActivityLogService;
import tech.manajer.platform.shared.ObjectIds;

/**
 * Deletes a message and tells the channel its id.
 */
@Singleton
public class DeleteMessageHandler implements OperationHandler<DeleteMessagePayload> {

    private static final Logger LOG = Logger.getLogger(DeleteMessageHandler.class);

    private final MessageRepository repository;
    private final OperationSupport support;
    private final ActivityLogService activityLogService;

    @Inject
    public DeleteMessageHandler(MessageRepository repository, OperationSupport support,
                                ActivityLogService activityLogService) {
        this.repository = repository;
        this.support = support;
        this.activityLogService = activityLogService;
    }

    @Override
    public void handle(ChannelConnection connection, DeleteMessagePayload payload) {
        ObjectId messageId = ObjectIds.parse(payload.id(), "Invalid message ID");

        boolean deleted = support.persist(OperationType.DELETE_MESSAGE, () -> repository.deleteById(messageId));
        if (!deleted) {
            throw new NotFoundException("Message not found");
        }
        LOG.debugf("Message [%s] deleted from channel [%s]", messageId, connection.channelId());

        MessageDeletedResponse response = new MessageDeletedResponse(messageId.toHexString());
        support.reply(connection, EventNames.MESSAGE_DELETED, response);
        support.broadcast(connection, EventNames.MESSAGE_DELETED, response);

        activityLogService.logActivity(
            support.authenticatedUserId(connection),
            "message.deleted",
            "WS",
            connection.path(),
            200,
            connection.remoteAddress());
    }
}
