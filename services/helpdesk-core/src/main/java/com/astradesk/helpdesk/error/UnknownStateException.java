package com.astradesk.helpdesk.error;

/**
 * The requested state matched nothing and no fallback was supplied.
 */
public class UnknownStateException extends InvalidTicketRequestException {

    public static final String REASON = "unknown status";

    private final String requested;

    public UnknownStateException(String requested) {
        super(REASON);
        this.requested = requested;
    }

    public String getRequested() {
        return requested;
    }
}
