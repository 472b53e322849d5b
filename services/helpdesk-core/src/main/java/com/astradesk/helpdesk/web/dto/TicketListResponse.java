package com.astradesk.helpdesk.web.dto;

import java.util.List;

import com.astradesk.helpdesk.ticket.TicketSummary;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TicketListResponse(List<TicketSummary> tickets, long total, int limit, int offset) {
}
