package tech.manajer.messaging.connection;

import jakarta.inject.Singleton;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide index of open connections by channel.
 *
 * <p>Register and unregister take the write lock; reads take the read lock.
 * No lock is held while anything is written to a connection. A channel whose
 * last connection leaves is removed from the index.
 *
 * <p>The registry does no I/O of its own.
 */
@Singleton
public class ConnectionRegistry {

    private static final Logger LOG = Logger.getLogger(ConnectionRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Set<ChannelConnection>> channels = new HashMap<>();

    public void register(String channelId, ChannelConnection connection) {
        lock.writeLock().lock();
        try {
            channels.computeIfAbsent(channelId, key -> new LinkedHashSet<>()).add(connection);
        } finally {
            lock.writeLock().unlock();
        }
        LOG.debugf("Registered connection [%s] on channel [%s]", connection.id(), channelId);
    }

    /**
     * Remove a connection. Unregistering an absent connection is a no-op.
     *
     * @return true if the connection was registered
     */
    public boolean unregister(String channelId, ChannelConnection connection) {
        boolean removed;
        lock.writeLock().lock();
        try {
            Set<ChannelConnection> members = channels.get(channelId);
            if (members == null) {
                return false;
            }
            removed = members.remove(connection);
            if (members.isEmpty()) {
                channels.remove(channelId);
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed) {
            LOG.debugf("Unregistered connection [%s] from channel [%s]", connection.id(), channelId);
        }
        return removed;
    }

    /**
     * Copy of the channel's connections, in registration order.
     *
     * <p>The copy is taken under the read lock and writes to the members
     * happen after it is released, so a peer that stops reading never holds
     * up registration or broadcasts on other channels.
     */
    public List<ChannelConnection> members(String channelId) {
        lock.readLock().lock();
        try {
            Set<ChannelConnection> members = channels.get(channelId);
            return members != null ? new ArrayList<>(members) : new ArrayList<>();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isRegistered(String channelId, ChannelConnection connection) {
        lock.readLock().lock();
        try {
            Set<ChannelConnection> members = channels.get(channelId);
            return members != null && members.contains(connection);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean hasChannel(String channelId) {
        lock.readLock().lock();
        try {
            return channels.containsKey(channelId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int connectionCount(String channelId) {
        lock.readLock().lock();
        try {
            Set<ChannelConnection> members = channels.get(channelId);
            return members != null ? members.size() : 0;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int channelCount() {
        lock.readLock().lock();
        try {
            return channels.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int totalConnections() {
        lock.readLock().lock();
        try {
            return channels.values().stream().mapToInt(Set::size).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Copy of every registered connection across all channels.
     */
    public List<ChannelConnection> snapshot() {
        lock.readLock().lock();
        try {
            List<ChannelConnection> all = new ArrayList<>();
            channels.values().forEach(all::addAll);
            return all;
        } finally {
            lock.readLock().unlock();
        }
    }
}
