package tech.manajer.messaging.handler;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.manajer.messaging.connection.ChannelConnection;
import tech.manajer.messaging.model.Message;
import tech.manajer.messaging.model.MessageType;
import tech.manajer.messaging.protocol.CreateMessagePayload;
import tech.manajer.messaging.protocol.EventNames;
import tech.manajer.messaging.protocol.MessageResponse;
import tech.manajer.messaging.protocol.OperationType;
import tech.manajer.messaging.repository.MessageRepository;
import tech.manajer.platform.shared.ObjectIds;

/**
 * Posts a new message to the connection's channel.
 * Replies {@code message_created} and broadcasts {@code new_message}.
 */
@Singleton
public class CreateMessageHandler implements OperationHandler<CreateMessagePayload> {

    private static final Logger LOG = Logger.getLogger(CreateMessageHandler.class);

    private final MessageRepository repository;
    private final OperationSupport support;

    @Inject
    public CreateMessageHandler(MessageRepository repository, OperationSupport support) {
        this.repository = repository;
        this.support = support;
    }

    @Override
    public void handle(ChannelConnection connection, CreateMessagePayload payload) {
        Message message = new Message();
        message.channelId = ObjectIds.parse(connection.channelId(), "Invalid channel ID");
        message.userId = support.actingUser(connection, payload.userId());
        message.messageType = support.messageType(payload.messageType(), MessageType.TEXT).wireValue();
        message.content = payload.content();
        message.mediaPath = payload.mediaPath();
        message.mediaMetadata = payload.mediaMetadata();

        Message saved = support.persist(OperationType.CREATE_MESSAGE, () -> repository.create(message));
        LOG.debugf("Message [%s] created in channel [%s] by user [%s]", saved.id, saved.channelId, saved.userId);

        MessageResponse response = MessageResponse.from(saved);
        support.reply(connection, EventNames.MESSAGE_CREATED, response);
        support.broadcast(connection, EventNames.NEW_MESSAGE, response);
    }
}
