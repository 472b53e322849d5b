package com.astradesk.helpdesk.error;

import org.springframework.http.HttpStatus;

/**
 * Base type for failures that carry their own HTTP status and a
 * machine-checkable reason string.
 */
public abstract class HelpdeskException extends RuntimeException {

    private final HttpStatus status;

    protected HelpdeskException(HttpStatus status, String reason) {
        super(reason);
        this.status = status;
    }

    protected HelpdeskException(HttpStatus status, String reason, Throwable cause) {
        super(reason, cause);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
