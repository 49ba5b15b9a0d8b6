package tech.manajer.messaging.protocol;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Inbound operations and their wire discriminators.
 */
public enum OperationType {
    CREATE_MESSAGE("client_message", List.of("create_message"), "create message", CreateMessagePayload.class),
    GET_MESSAGE_HISTORY("get_message_history", List.of(), "fetch message history", MessageHistoryPayload.class),
    UPDATE_MESSAGE("update_message", List.of(), "update message", UpdateMessagePayload.class),
    DELETE_MESSAGE("delete_message", List.of(), "delete message", DeleteMessagePayload.class),
    ADD_REACTION("add_reaction", List.of(), "add reaction", ReactionPayload.class),
    REMOVE_REACTION("remove_reaction", List.of(), "remove reaction", ReactionPayload.class);

    private final String wireName;
    private final List<String> aliases;
    private final String label;
    private final Class<? extends OperationPayload> payloadType;

    OperationType(String wireName, List<String> aliases, String label,
                  Class<? extends OperationPayload> payloadType) {
        this.wireName = wireName;
        this.aliases = aliases;
        this.label = label;
        this.payloadType = payloadType;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Lower-case verb phrase used in log and error messages.
     */
    public String label() {
        return label;
    }

    public Class<? extends OperationPayload> payloadType() {
        return payloadType;
    }

    public static Optional<OperationType> fromWire(String value) {
        return Arrays.stream(values())
            .filter(type -> type.wireName.equals(value) || type.aliases.contains(value))
            .findFirst();
    }
}
