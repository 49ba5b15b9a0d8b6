package tech.manajer.messaging.broadcast;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.manajer.messaging.connection.ChannelConnection;
import tech.manajer.messaging.connection.ConnectionRegistry;
import tech.manajer.messaging.connection.ConnectionState;
import tech.manajer.messaging.metrics.MessagingMetrics;
import tech.manajer.messaging.protocol.EnvelopeCodec;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Fans an event out to every connection registered on a channel.
 *
 * <p>The event is serialized once and written to a snapshot of the channel's
 * members, outside the registry lock. Each peer gets at most one write attempt
 * per call; a peer whose write fails or times out is unregistered and closed
 * after the pass, and never stops delivery to the others. Successful writes
 * only mean the transport accepted the frame.
 */
@Singleton
public class BroadcastEngine {

    private static final Logger LOG = Logger.getLogger(BroadcastEngine.class);

    private final ConnectionRegistry registry;
    private final EnvelopeCodec codec;
    private final MessagingMetrics metrics;

    @Inject
    public BroadcastEngine(ConnectionRegistry registry, EnvelopeCodec codec, MessagingMetrics metrics) {
        this.registry = registry;
        this.codec = codec;
        this.metrics = metrics;
    }

    /**
     * Broadcast to every connection of the channel.
     *
     * @return number of connections the frame was written to
     */
    public int broadcast(String channelId, String eventType, Object payload) {
        return broadcast(channelId, eventType, payload, null);
    }

    /**
     * Broadcast to every connection of the channel except {@code origin}.
     *
     * @param origin connection to skip, may be null
     * @return number of connections the frame was written to
     */
    public int broadcast(String channelId, String eventType, Object payload, ChannelConnection origin) {
        String frame = codec.encode(eventType, payload);
        int delivered = 0;
        List<ChannelConnection> failed = new ArrayList<>();

        for (ChannelConnection connection : registry.members(channelId)) {
            // Released after the snapshot was taken
            if (connection == origin || isReleased(connection)) {
                continue;
            }
            try {
                connection.send(frame);
                delivered++;
            } catch (IOException | RuntimeException e) {
                LOG.debugf("Broadcast of [%s] to connection [%s] failed: %s",
                    eventType, connection.id(), e.getMessage());
                failed.add(connection);
            }
        }

        for (ChannelConnection connection : failed) {
            registry.unregister(channelId, connection);
            connection.close();
        }
        if (!failed.isEmpty()) {
            LOG.infof("Pruned %d unreachable connection(s) from channel [%s]", failed.size(), channelId);
        }

        metrics.recordBroadcast(delivered, failed.size());
        LOG.debugf("Broadcast [%s] to channel [%s]: %d delivered, %d failed",
            eventType, channelId, delivered, failed.size());
        return delivered;
    }

    private static boolean isReleased(ChannelConnection connection) {
        ConnectionState state = connection.state();
        return state == ConnectionState.CLOSING || state == ConnectionState.CLOSED;
    }
}
