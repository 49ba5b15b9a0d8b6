package tech.manajer.messaging.protocol;

public record MessageDeletedResponse(
    String id
) {
}
