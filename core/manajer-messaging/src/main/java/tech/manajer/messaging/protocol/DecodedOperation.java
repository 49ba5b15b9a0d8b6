package tech.manajer.messaging.protocol;

/**
 * An inbound frame after decoding: the operation and its typed payload.
 * The payload is always an instance of {@code type.payloadType()}.
 */
public record DecodedOperation(
    OperationType type,
    OperationPayload payload
) {
}
