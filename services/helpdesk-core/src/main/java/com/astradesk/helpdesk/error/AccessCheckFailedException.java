package com.astradesk.helpdesk.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Permission lookup could not be completed. Never to be read as "denied" or
 * "granted".
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class AccessCheckFailedException extends HelpdeskException {

    public static final String REASON = "Failed to check queue permissions";

    public AccessCheckFailedException(Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, REASON, cause);
    }
}
