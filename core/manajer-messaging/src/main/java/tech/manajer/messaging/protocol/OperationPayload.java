package tech.manajer.messaging.protocol;

/**
 * Sealed interface for the payloads of all inbound operations.
 *
 * Each {@link OperationType} decodes to exactly one of the permitted records.
 */
public sealed interface OperationPayload
    permits CreateMessagePayload, MessageHistoryPayload, UpdateMessagePayload,
            DeleteMessagePayload, ReactionPayload {
}
