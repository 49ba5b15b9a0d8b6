package tech.manajer.messaging.handler;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import tech.manajer.messaging.connection.ChannelConnection;
import tech.manajer.messaging.protocol.CreateMessagePayload;
import tech.manajer.messaging.protocol.DecodedOperation;
import tech.manajer.messaging.protocol.DeleteMessagePayload;
import tech.manajer.messaging.protocol.MessageHistoryPayload;
import tech.manajer.messaging.protocol.ReactionPayload;
import tech.manajer.messaging.protocol.UpdateMessagePayload;

/**
 * Routes a decoded operation to the handler for its type.
 */
@Singleton
public class OperationHandlerFactory {

    private final CreateMessageHandler createHandler;
    private final MessageHistoryHandler historyHandler;
    private final UpdateMessageHandler updateHandler;
    private final DeleteMessageHandler deleteHandler;
    private final AddReactionHandler addReactionHandler;
    private final RemoveReactionHandler removeReactionHandler;

    @Inject
    public OperationHandlerFactory(CreateMessageHandler createHandler,
                                   MessageHistoryHandler historyHandler,
                                   UpdateMessageHandler updateHandler,
                                   DeleteMessageHandler deleteHandler,
                                   AddReactionHandler addReactionHandler,
                                   RemoveReactionHandler removeReactionHandler) {
        this.createHandler = createHandler;
        this.historyHandler = historyHandler;
        this.updateHandler = updateHandler;
        this.deleteHandler = deleteHandler;
        this.addReactionHandler = addReactionHandler;
        this.removeReactionHandler = removeReactionHandler;
    }

    /**
     * Invoke the matching handler on the caller's thread.
     */
    public void dispatch(ChannelConnection connection, DecodedOperation operation) {
        switch (operation.type()) {
            case CREATE_MESSAGE -> createHandler.handle(connection, (CreateMessagePayload) operation.payload());
            case GET_MESSAGE_HISTORY -> historyHandler.handle(connection, (MessageHistoryPayload) operation.payload());
            case UPDATE_MESSAGE -> updateHandler.handle(connection, (UpdateMessagePayload) operation.payload());
            case DELETE_MESSAGE -> deleteHandler.handle(connection, (DeleteMessagePayload) operation.payload());
            case ADD_REACTION -> addReactionHandler.handle(connection, (ReactionPayload) operation.payload());
            case REMOVE_REACTION -> removeReactionHandler.handle(connection, (ReactionPayload) operation.payload());
        }
    }
}
