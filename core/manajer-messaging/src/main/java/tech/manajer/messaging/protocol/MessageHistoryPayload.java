package tech.manajer.messaging.protocol;

/**
 * Paging of a history request. Absent or zero limit means the default page size.
 */
public record MessageHistoryPayload(
    Integer limit,
    Integer skip
) implements OperationPayload {
}
