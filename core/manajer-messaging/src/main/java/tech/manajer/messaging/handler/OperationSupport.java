package tech.manajer.messaging.handler;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.BadRequestException;
import org.bson.types.ObjectId;
import org.jboss.logging.Logger;
import tech.manajer.messaging.broadcast.BroadcastEngine;
import tech.manajer.messaging.connection.ChannelConnection;
import tech.manajer.messaging.model.MessageType;
import tech.manajer.messaging.protocol.EnvelopeCodec;
import tech.manajer.messaging.protocol.OperationType;
import tech.manajer.messaging.repository.PersistenceExecutor;
import tech.manajer.platform.authentication.AuthenticatedUser;
import tech.manajer.platform.shared.ObjectIds;

import java.io.IOException;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Steps shared by all operation handlers: bounded persistence calls, replies
 * to the sender, broadcasts and resolution of the acting user.
 */
@Singleton
public class OperationSupport {

    private static final Logger LOG = Logger.getLogger(OperationSupport.class);

    private final PersistenceExecutor persistence;
    private final BroadcastEngine broadcastEngine;
    private final EnvelopeCodec codec;

    @Inject
    public OperationSupport(PersistenceExecutor persistence, BroadcastEngine broadcastEngine, EnvelopeCodec codec) {
        this.persistence = persistence;
        this.broadcastEngine = broadcastEngine;
        this.codec = codec;
    }

    /**
     * Run a persistence call under the configured timeout.
     */
    public <T> T persist(OperationType type, Supplier<T> work) {
        return persistence.call(type.label(), work);
    }

    /**
     * Write an event to one connection. A write to a gone connection is dropped.
     */
    public void reply(ChannelConnection connection, String eventType, Object payload) {
        send(connection, codec.encode(eventType, payload));
    }

    public void replyError(ChannelConnection connection, String message) {
        send(connection, codec.encodeError(message));
    }

    /**
     * Broadcast an event to the connection's channel, skipping the connection itself.
     */
    public int broadcast(ChannelConnection origin, String eventType, Object payload) {
        return broadcastEngine.broadcast(origin.channelId(), eventType, payload, origin);
    }

    /**
     * The user an operation acts as.
     *
     * <p>An authenticated connection always acts as its own user; a payload
     * user id is optional there but must match. An anonymous connection must
     * name a valid user id in the payload.
     *
     * @throws BadRequestException if the id is missing, malformed or mismatched
     */
    public ObjectId actingUser(ChannelConnection connection, String payloadUserId) {
        Optional<AuthenticatedUser> user = connection.user();
        if (user.isEmpty()) {
            return ObjectIds.parse(payloadUserId, "Invalid user ID");
        }

        ObjectId authenticated = new ObjectId(user.get().userId());
        ObjectId claimed = ObjectIds.parseOptional(payloadUserId, "Invalid user ID");
        if (claimed != null && !claimed.equals(authenticated)) {
            throw new BadRequestException("User ID does not match the authenticated user");
        }
        return authenticated;
    }

    /**
     * The authenticated user's id, or null on an anonymous connection.
     */
    public ObjectId authenticatedUserId(ChannelConnection connection) {
        return connection.user().map(user -> new ObjectId(user.userId())).orElse(null);
    }

    /**
     * Resolve a wire message type.
     *
     * @param fallback returned when the value is null or blank
     * @throws BadRequestException for an unknown value
     */
    public MessageType messageType(String value, MessageType fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return MessageType.fromWire(value)
            .orElseThrow(() -> new BadRequestException("Invalid message type: " + value));
    }

    private void send(ChannelConnection connection, String frame) {
        try {
            connection.send(frame);
        } catch (IOException | RuntimeException e) {
            LOG.debugf("Dropped reply to connection [%s]: %s", connection.id(), e.getMessage());
        }
    }
}
