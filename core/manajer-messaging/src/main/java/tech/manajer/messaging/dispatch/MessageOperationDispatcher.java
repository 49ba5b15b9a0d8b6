package tech.manajer.messaging.dispatch;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.NotFoundException;
import org.jboss.logging.Logger;
import tech.manajer.messaging.connection.ChannelConnection;
import tech.manajer.messaging.connection.ConnectionRegistry;
import tech.manajer.messaging.connection.ConnectionState;
import tech.manajer.messaging.handler.OperationHandlerFactory;
import tech.manajer.messaging.handler.OperationSupport;
import tech.manajer.messaging.metrics.MessagingMetrics;
import tech.manajer.messaging.protocol.ChannelJoinedResponse;
import tech.manajer.messaging.protocol.DecodedOperation;
import tech.manajer.messaging.protocol.EnvelopeCodec;
import tech.manajer.messaging.protocol.EventNames;
import tech.manajer.messaging.protocol.FrameDecodingException;
import tech.manajer.messaging.repository.OperationTimeoutException;

import java.util.List;

/**
 * Drives a connection through its lifecycle and turns its inbound frames into
 * operations.
 *
 * <p>The transport calls {@link #admit} once, then {@link #onTextFrame} for
 * each frame in arrival order (never concurrently for one connection), then
 * {@link #release}. Nothing that happens while processing a frame closes the
 * connection: decoding, validation, lookup and storage failures all become an
 * {@code error} event to the sender.
 */
@Singleton
public class MessageOperationDispatcher {

    private static final Logger LOG = Logger.getLogger(MessageOperationDispatcher.class);

    private final ConnectionRegistry registry;
    private final EnvelopeCodec codec;
    private final OperationHandlerFactory handlers;
    private final OperationSupport support;
    private final MessagingMetrics metrics;

    @Inject
    public MessageOperationDispatcher(ConnectionRegistry registry, EnvelopeCodec codec,
                                      OperationHandlerFactory handlers, OperationSupport support,
                                      MessagingMetrics metrics) {
        this.registry = registry;
        this.codec = codec;
        this.handlers = handlers;
        this.support = support;
        this.metrics = metrics;
    }

    /**
     * Register a freshly opened connection and greet it.
     *
     * @return false if the connection was not in the CONNECTING state
     */
    public boolean admit(ChannelConnection connection) {
        if (!connection.activate()) {
            LOG.warnf("Refusing to admit connection [%s] in state %s", connection.id(), connection.state());
            return false;
        }
        registry.register(connection.channelId(), connection);
        LOG.infof("Connection [%s] joined channel [%s] as user [%s]",
            connection.id(), connection.channelId(),
            connection.user().map(user -> user.userId()).orElse("anonymous"));

        support.reply(connection, EventNames.CHANNEL_JOINED, new ChannelJoinedResponse(connection.channelId()));
        return true;
    }

    /**
     * Process one inbound text frame.
     */
    public void onTextFrame(ChannelConnection connection, String frame) {
        if (connection.state() != ConnectionState.ACTIVE) {
            LOG.debugf("Ignoring frame on connection [%s] in state %s", connection.id(), connection.state());
            return;
        }
        metrics.recordFrameReceived();

        DecodedOperation operation;
        try {
            operation = codec.decode(frame);
        } catch (FrameDecodingException e) {
            LOG.debugf("Undecodable frame on connection [%s]: %s", connection.id(), e.getMessage());
            metrics.recordOperation("unknown", MessagingMetrics.OUTCOME_REJECTED);
            support.replyError(connection, e.getMessage());
            return;
        }

        String type = operation.type().wireName();
        LOG.debugf("Connection [%s] -> %s", connection.id(), type);
        try {
            handlers.dispatch(connection, operation);
            metrics.recordOperation(type, MessagingMetrics.OUTCOME_SUCCESS);
        } catch (BadRequestException e) {
            LOG.debugf("Rejected %s on connection [%s]: %s", type, connection.id(), e.getMessage());
            metrics.recordOperation(type, MessagingMetrics.OUTCOME_REJECTED);
            support.replyError(connection, e.getMessage());
        } catch (NotFoundException e) {
            LOG.debugf("%s on connection [%s]: %s", type, connection.id(), e.getMessage());
            metrics.recordOperation(type, MessagingMetrics.OUTCOME_NOT_FOUND);
            support.replyError(connection, e.getMessage());
        } catch (OperationTimeoutException e) {
            LOG.errorf("%s timed out on connection [%s] after %dms",
                type, connection.id(), e.getTimeout().toMillis());
            metrics.recordOperation(type, MessagingMetrics.OUTCOME_TIMEOUT);
            support.replyError(connection, capitalize(operation.type().label()) + " timed out");
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to %s on connection [%s]", operation.type().label(), connection.id());
            metrics.recordOperation(type, MessagingMetrics.OUTCOME_ERROR);
            support.replyError(connection, "Failed to " + operation.type().label());
        }
    }

    /**
     * Binary frames carry no operations and are skipped.
     */
    public void onBinaryFrame(ChannelConnection connection) {
        LOG.debugf("Skipping binary frame on connection [%s]", connection.id());
    }

    /**
     * Unregister and close a connection. Safe to call more than once.
     */
    public void release(ChannelConnection connection) {
        boolean wasRegistered = registry.unregister(connection.channelId(), connection);
        connection.close();
        if (wasRegistered) {
            LOG.infof("Connection [%s] left channel [%s]", connection.id(), connection.channelId());
        }
    }

    /**
     * Release every registered connection.
     */
    public void releaseAll() {
        List<ChannelConnection> connections = registry.snapshot();
        LOG.infof("Releasing %d open connection(s)", connections.size());
        for (ChannelConnection connection : connections) {
            release(connection);
        }
    }

    private static String capitalize(String value) {
        return Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
