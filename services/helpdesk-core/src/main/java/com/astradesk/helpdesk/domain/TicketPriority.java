package com.astradesk.helpdesk.domain;

public record TicketPriority(long id, String name) {
}
