package tech.manajer.messaging.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kind of content a message carries.
 */
public enum MessageType {
    TEXT("text"),
    IMAGE("image"),
    FILE("file"),
    VOICE("voice");

    private final String wireValue;

    MessageType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<MessageType> fromWire(String value) {
        return Arrays.stream(values())
            .filter(type -> type.wireValue.equals(value))
            .findFirst();
    }
}
