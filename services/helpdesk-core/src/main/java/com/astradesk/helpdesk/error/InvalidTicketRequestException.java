package com.astradesk.helpdesk.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Input validation failure. Raised before any write is attempted.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidTicketRequestException extends HelpdeskException {

    public InvalidTicketRequestException(String reason) {
        super(HttpStatus.BAD_REQUEST, reason);
    }
}
