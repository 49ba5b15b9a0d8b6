package tech.manajer.messaging.protocol;

public record DeleteMessagePayload(
    String id
) implements OperationPayload {
}
