package com.astradesk.helpdesk.ticket;

import java.time.Instant;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * One row of a ticket list, already joined with state, priority and queue names.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TicketSummary(
    long id,
    String tn,
    String title,
    long queueId,
    String queueName,
    long stateId,
    String stateName,
    int stateTypeId,
    Long priorityId,
    String priorityName,
    Long ownerId,
    long untilTime,
    Instant changedAt
) {
}
