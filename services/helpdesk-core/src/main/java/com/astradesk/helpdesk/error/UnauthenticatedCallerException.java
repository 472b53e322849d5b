package com.astradesk.helpdesk.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The token was valid but did not identify an agent.
 */
@ResponseStatus(HttpStatus.UNAUTHORIZED)
public class UnauthenticatedCallerException extends HelpdeskException {

    public UnauthenticatedCallerException() {
        super(HttpStatus.UNAUTHORIZED, "Authentication required");
    }
}
