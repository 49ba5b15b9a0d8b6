package tech.manajer.messaging.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Configuration for real-time channel messaging.
 */
@ConfigMapping(prefix = "messaging")
public interface MessagingConfig {

    /**
     * Upper bound for a single persistence call made while handling a frame.
     * Supports duration format: 5s, 500ms, etc.
     */
    @WithDefault("5s")
    Duration operationTimeout();

    /**
     * Longest wait for a peer to accept one outbound frame. A peer that
     * overruns it during a broadcast is dropped from its channel.
     */
    @WithDefault("2s")
    Duration sendTimeout();

    /**
     * Threads available for persistence calls.
     */
    @WithDefault("16")
    int persistenceThreads();

    /**
     * Persistence calls allowed to wait for a free thread. A call beyond this
     * is refused and reported as a timeout.
     */
    @WithDefault("256")
    int persistenceQueueCapacity();

    /**
     * Number of messages returned by a history request that does not set a limit.
     */
    @WithDefault("50")
    int historyDefaultLimit();

    /**
     * Attempts at a reaction read-modify-write before giving up on contention.
     */
    @WithDefault("5")
    int reactionMaxAttempts();

    /**
     * Whether connections without a valid token are refused.
     */
    @WithDefault("true")
    boolean requireAuthentication();
}
