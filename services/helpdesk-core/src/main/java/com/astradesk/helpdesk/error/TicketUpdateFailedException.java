package com.astradesk.helpdesk.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The primary ticket write failed after authorization and validation passed.
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class TicketUpdateFailedException extends HelpdeskException {

    public TicketUpdateFailedException(String reason, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, reason, cause);
    }
}
