package tech.manajer.messaging.connection;

/**
 * Lifecycle of a channel connection. Transitions only move forward.
 */
public enum ConnectionState {
    /** Handshake done, not yet registered. */
    CONNECTING,
    /** Registered and processing frames. */
    ACTIVE,
    /** Shutdown observed, transport being released. */
    CLOSING,
    /** Unregistered and transport closed. */
    CLOSED
}
