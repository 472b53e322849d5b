package com.astradesk.helpdesk.ticket;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Per-ticket result of a bulk state change.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BulkOutcome(long ticketId, boolean success, Integer status, String error) {

    public static BulkOutcome succeeded(long ticketId) {
        return new BulkOutcome(ticketId, true, null, null);
    }

    public static BulkOutcome failed(long ticketId, int status, String error) {
        return new BulkOutcome(ticketId, false, status, error);
    }
}
