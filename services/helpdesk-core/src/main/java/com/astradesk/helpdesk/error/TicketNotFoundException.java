package com.astradesk.helpdesk.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Exception thrown when a ticket id does not exist. Mapped to a 404 response.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class TicketNotFoundException extends HelpdeskException {

    public static final String REASON = "Ticket not found";

    private final long ticketId;

    public TicketNotFoundException(long ticketId) {
        super(HttpStatus.NOT_FOUND, REASON);
        this.ticketId = ticketId;
    }

    public long getTicketId() {
        return ticketId;
    }
}
