package com.astradesk.helpdesk.domain;

import java.time.Instant;

/**
 * One immutable audit row. {@code id} is {@code null} until persisted; the
 * queue/owner/priority/state columns snapshot the ticket after the change.
 * {@code typeName} is kept as stored so that types written by other tools still
 * read back.
 */
public record HistoryEntry(
    Long id,
    long ticketId,
    String typeName,
    String message,
    Long queueId,
    Long ownerId,
    Long priorityId,
    Long stateId,
    Long articleId,
    long createdBy,
    Instant createdAt
) {
}
