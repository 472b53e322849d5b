package com.astradesk.helpdesk.web.dto;

import java.util.List;

import com.astradesk.helpdesk.ticket.BulkOutcome;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BulkStatusResponse(List<BulkOutcome> results, long succeeded, long failed) {

    public static BulkStatusResponse of(List<BulkOutcome> results) {
        long succeeded = results.stream().filter(BulkOutcome::success).count();
        return new BulkStatusResponse(List.copyOf(results), succeeded, results.size() - succeeded);
    }
}
