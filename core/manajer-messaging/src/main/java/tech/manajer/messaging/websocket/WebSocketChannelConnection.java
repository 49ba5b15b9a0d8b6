package tech.manajer.messaging.websocket;

import jakarta.websocket.CloseReason;
import jakarta.websocket.Session;
import tech.manajer.messaging.connection.AbstractChannelConnection;
import tech.manajer.platform.authentication.AuthenticatedUser;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Channel connection over a Jakarta WebSocket session.
 *
 * Frames go out through the async remote. A write that the peer does not
 * accept within the send timeout fails, so a stalled peer costs its writer at
 * most that long.
 */
class WebSocketChannelConnection extends AbstractChannelConnection {

    private final Session session;
    private final Duration sendTimeout;

    WebSocketChannelConnection(Session session, String channelId, AuthenticatedUser user, Duration sendTimeout) {
        super(channelId, user);
        this.session = session;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public String path() {
        return session.getRequestURI() != null ? session.getRequestURI().getPath() : null;
    }

    // Jakarta WebSocket sessions do not expose the peer address
    @Override
    public String remoteAddress() {
        return null;
    }

    @Override
    protected void doSend(String frame) throws IOException {
        if (!session.isOpen()) {
            throw new IOException("WebSocket session " + session.getId() + " is closed");
        }
        Future<Void> pending = session.getAsyncRemote().sendText(frame);
        try {
            pending.get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new IOException("Send to WebSocket session " + session.getId()
                + " timed out after " + sendTimeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            throw new IOException("Send to WebSocket session " + session.getId() + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while sending to WebSocket session " + session.getId(), e);
        }
    }

    @Override
    protected void doClose() throws IOException {
        if (session.isOpen()) {
            session.close(new CloseReason(CloseReason.CloseCodes.NORMAL_CLOSURE, "Connection released"));
        }
    }
}
