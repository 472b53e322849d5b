package com.astradesk.helpdesk.web.dto;

import java.time.Instant;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record HistoryEntryResponse(
    Long id,
    String historyType,
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
