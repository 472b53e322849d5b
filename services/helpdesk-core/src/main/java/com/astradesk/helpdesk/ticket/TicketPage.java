package com.astradesk.helpdesk.ticket;

import java.util.List;

public record TicketPage(List<TicketSummary> items, long total, int limit, int offset) {

    public TicketPage {
        items = List.copyOf(items);
    }
}
