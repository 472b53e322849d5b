package com.astradesk.helpdesk.web.dto;

import com.astradesk.helpdesk.pending.AutoCloseMeta;
import com.astradesk.helpdesk.pending.ReminderMeta;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Ticket with resolved names and pending-deadline hints.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TicketDetailResponse(
    TicketResponse ticket,
    String stateName,
    String stateType,
    String priorityName,
    String queueName,
    AutoCloseMeta autoClose,
    ReminderMeta pendingReminder
) {
}
