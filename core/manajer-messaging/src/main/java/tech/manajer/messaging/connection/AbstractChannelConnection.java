package tech.manajer.messaging.connection;

import org.jboss.logging.Logger;
import tech.manajer.platform.authentication.AuthenticatedUser;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class holding the state machine and write serialization shared by all
 * transports. Subclasses only perform the raw write and close.
 */
public abstract class AbstractChannelConnection implements ChannelConnection {

    private static final Logger LOG = Logger.getLogger(AbstractChannelConnection.class);

    private final String id = UUID.randomUUID().toString();
    private final String channelId;
    private final AuthenticatedUser user;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final Object writeLock = new Object();

    protected AbstractChannelConnection(String channelId, AuthenticatedUser user) {
        this.channelId = channelId;
        this.user = user;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String channelId() {
        return channelId;
    }

    @Override
    public Optional<AuthenticatedUser> user() {
        return Optional.ofNullable(user);
    }

    @Override
    public ConnectionState state() {
        return state.get();
    }

    @Override
    public boolean activate() {
        return state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.ACTIVE);
    }

    @Override
    public void send(String frame) throws IOException {
        synchronized (writeLock) {
            if (state.get() == ConnectionState.CLOSED) {
                throw new IOException("Connection " + id + " is closed");
            }
            doSend(frame);
        }
    }

    @Override
    public void close() {
        ConnectionState previous = state.getAndUpdate(
            current -> current == ConnectionState.CLOSED ? current : ConnectionState.CLOSING);
        if (previous == ConnectionState.CLOSING || previous == ConnectionState.CLOSED) {
            return;
        }

        synchronized (writeLock) {
            try {
                doClose();
            } catch (IOException | RuntimeException e) {
                LOG.debugf("Error closing connection [%s]: %s", id, e.getMessage());
            } finally {
                state.set(ConnectionState.CLOSED);
            }
        }
    }

    protected abstract void doSend(String frame) throws IOException;

    protected abstract void doClose() throws IOException;

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + ", channel=" + channelId + ", " + state.get() + "]";
    }
}
