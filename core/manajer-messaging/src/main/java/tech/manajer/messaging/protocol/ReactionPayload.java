package tech.manajer.messaging.protocol;

/**
 * Payload shared by add_reaction and remove_reaction.
 *
 * @param messageId target message
 * @param userId    reacting user; optional when the connection is authenticated
 * @param emoji     the reaction, matched exactly
 */
public record ReactionPayload(
    String messageId,
    String userId,
    String emoji
) implements OperationPayload {
}
