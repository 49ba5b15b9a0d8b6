package tech.manajer.messaging.connection;

import tech.manajer.platform.authentication.AuthenticatedUser;

import java.io.IOException;
import java.util.Optional;

/**
 * A duplex, text-framed connection bound to one channel for its whole life.
 *
 * Implementations must accept {@link #send} from several threads at once
 * (a connection's own replies race with broadcasts from other connections).
 */
public interface ChannelConnection {

    /**
     * Unique id of this connection, for logs.
     */
    String id();

    /**
     * The channel this connection was admitted to.
     */
    String channelId();

    /**
     * Identity established at admission, if any.
     */
    Optional<AuthenticatedUser> user();

    /**
     * Request path the connection was opened on.
     */
    String path();

    /**
     * Peer address, or null when the transport does not expose it.
     */
    String remoteAddress();

    ConnectionState state();

    /**
     * Move from CONNECTING to ACTIVE.
     *
     * @return false if the connection was not CONNECTING
     */
    boolean activate();

    /**
     * Write one text frame.
     *
     * @throws IOException if the transport rejects the write or is closed
     */
    void send(String frame) throws IOException;

    /**
     * Release the transport. Idempotent; leaves the connection CLOSED.
     */
    void close();
}
