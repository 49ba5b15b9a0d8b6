package tech.manajer.messaging.websocket;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.websocket.CloseReason;
import jakarta.websocket.OnClose;
import jakarta.websocket.OnError;
import jakarta.websocket.OnMessage;
import jakarta.websocket.OnOpen;
import jakarta.websocket.Session;
import jakarta.websocket.server.PathParam;
import jakarta.websocket.server.ServerEndpoint;
import org.jboss.logging.Logger;
import tech.manajer.messaging.config.MessagingConfig;
import tech.manajer.messaging.connection.ChannelConnection;
import tech.manajer.messaging.dispatch.MessageOperationDispatcher;
import tech.manajer.platform.authentication.AuthenticatedUser;
import tech.manajer.platform.authentication.TokenVerifier;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * WebSocket entry point for channel messaging.
 *
 * <p>The caller authenticates with a {@code token} query parameter. The
 * container delivers one session's messages sequentially, so frames of a
 * connection are processed in arrival order.
 */
@ServerEndpoint("/api/v1/ws/messages/{channelId}")
@ApplicationScoped
public class MessageSocketEndpoint {

    private static final Logger LOG = Logger.getLogger(MessageSocketEndpoint.class);

    static final String CONNECTION_PROPERTY = "manajer.connection";
    static final String TOKEN_PARAM = "token";

    @Inject
    MessageOperationDispatcher dispatcher;

    @Inject
    TokenVerifier tokenVerifier;

    @Inject
    MessagingConfig config;

    @OnOpen
    public void onOpen(Session session, @PathParam("channelId") String channelId) {
        if (channelId == null || channelId.isBlank()) {
            LOG.warn("Rejected WebSocket connection without channel ID");
            closeQuietly(session, CloseReason.CloseCodes.CANNOT_ACCEPT, "Channel ID is required");
            return;
        }

        Optional<AuthenticatedUser> user = tokenVerifier.verify(firstParameter(session, TOKEN_PARAM));
        if (user.isEmpty() && config.requireAuthentication()) {
            LOG.warnf("Rejected unauthenticated WebSocket connection to channel [%s]", channelId);
            closeQuietly(session, CloseReason.CloseCodes.VIOLATED_POLICY, "Authentication required");
            return;
        }

        WebSocketChannelConnection connection = new WebSocketChannelConnection(
            session, channelId, user.orElse(null), config.sendTimeout());
        session.getUserProperties().put(CONNECTION_PROPERTY, connection);
        dispatcher.admit(connection);
    }

    @OnMessage
    public void onText(Session session, String frame) {
        connection(session).ifPresent(connection -> dispatcher.onTextFrame(connection, frame));
    }

    @OnMessage
    public void onBinary(Session session, ByteBuffer frame) {
        connection(session).ifPresent(dispatcher::onBinaryFrame);
    }

    @OnClose
    public void onClose(Session session, CloseReason reason) {
        connection(session).ifPresent(connection -> {
            LOG.debugf("Connection [%s] closed by peer: %s", connection.id(), reason.getCloseCode());
            dispatcher.release(connection);
        });
    }

    @OnError
    public void onError(Session session, Throwable error) {
        connection(session).ifPresent(connection -> {
            LOG.debugf("Transport error on connection [%s]: %s", connection.id(), error.getMessage());
            dispatcher.release(connection);
        });
    }

    private static Optional<ChannelConnection> connection(Session session) {
        return Optional.ofNullable((ChannelConnection) session.getUserProperties().get(CONNECTION_PROPERTY));
    }

    private static String firstParameter(Session session, String name) {
        Map<String, List<String>> parameters = session.getRequestParameterMap();
        if (parameters == null) {
            return null;
        }
        List<String> values = parameters.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static void closeQuietly(Session session, CloseReason.CloseCode code, String reason) {
        try {
            session.close(new CloseReason(code, reason));
        } catch (IOException e) {
            LOG.debugf("Failed to close rejected session [%s]: %s", session.getId(), e.getMessage());
        }
    }
}
