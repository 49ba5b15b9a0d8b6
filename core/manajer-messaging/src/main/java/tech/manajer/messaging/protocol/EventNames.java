package tech.manajer.messaging.protocol;

/**
 * Outbound event discriminators.
 */
public final class EventNames {

    public static final String CHANNEL_JOINED = "channel_joined";
    public static final String MESSAGE_CREATED = "message_created";
    public static final String NEW_MESSAGE = "new_message";
    public static final String MESSAGE_HISTORY = "message_history";
    public static final String MESSAGE_UPDATED = "message_updated";
    public static final String MESSAGE_DELETED = "message_deleted";
    public static final String REACTION_ADDED = "reaction_added";
    public static final String REACTION_REMOVED = "reaction_removed";
    public static final String ERROR = "error";

    private EventNames() {
    }
}
