package tech.manajer.messaging.handler;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.BadRequestException;
import org.bson.types.ObjectId;
import tech.manajer.messaging.config.MessagingConfig;
import tech.manajer.messaging.connection.ChannelConnection;
import tech.manajer.messaging.model.Message;
import tech.manajer.messaging.protocol.EventNames;
import tech.manajer.messaging.protocol.MessageHistoryPayload;
import tech.manajer.messaging.protocol.MessageResponse;
import tech.manajer.messaging.protocol.OperationType;
import tech.manajer.messaging.repository.MessageRepository;
import tech.manajer.platform.shared.ObjectIds;

import java.util.List;

/**
 * Returns a page of the channel's messages, newest first, to the sender only.
 */
@Singleton
public class MessageHistoryHandler implements OperationHandler<MessageHistoryPayload> {

    private final MessageRepository repository;
    private final OperationSupport support;
    private final MessagingConfig config;

    @Inject
    public MessageHistoryHandler(MessageRepository repository, OperationSupport support, MessagingConfig config) {
        this.repository = repository;
        this.support = support;
        this.config = config;
    }

    @Override
    public void handle(ChannelConnection connection, MessageHistoryPayload payload) {
        ObjectId channelId = ObjectIds.parse(connection.channelId(), "Invalid channel ID");

        int limit = payload.limit() != null ? payload.limit() : 0;
        int skip = payload.skip() != null ? payload.skip() : 0;
        if (limit < 0 || skip < 0) {
            throw new BadRequestException("limit and skip must not be negative");
        }
        int pageSize = limit == 0 ? config.historyDefaultLimit() : limit;

        List<Message> messages = support.persist(OperationType.GET_MESSAGE_HISTORY,
            () -> repository.findByChannel(channelId, pageSize, skip));

        List<MessageResponse> response = messages.stream().map(MessageResponse::from).toList();
        support.reply(connection, EventNames.MESSAGE_HISTORY, response);
    }
}
