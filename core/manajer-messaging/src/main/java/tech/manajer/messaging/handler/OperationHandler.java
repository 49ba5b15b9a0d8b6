package tech.manajer.messaging.handler;

import tech.manajer.messaging.connection.ChannelConnection;
import tech.manajer.messaging.protocol.OperationPayload;

/**
 * Handler abstraction for one inbound operation type.
 *
 * <p>Handlers run on the calling connection's frame thread and must be safe
 * against concurrent calls from other connections. Failures are signalled by
 * throwing; they never close the connection:
 * <ul>
 *   <li>{@link jakarta.ws.rs.BadRequestException} for invalid input</li>
 *   <li>{@link jakarta.ws.rs.NotFoundException} for a missing message</li>
 *   <li>{@link tech.manajer.messaging.repository.OperationTimeoutException} when storage is too slow</li>
 * </ul>
 *
 * @param <P> the payload record this handler accepts
 */
public interface OperationHandler<P extends OperationPayload> {

    /**
     * Process an operation, reply to the sender and broadcast any change.
     */
    void handle(ChannelConnection connection, P payload);
}
