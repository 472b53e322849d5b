package com.astradesk.helpdesk.stats;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Ticket counts for one queue. {@code open} counts new and open tickets;
 * {@code backlog} is the part of {@code open} created more than a day ago.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueStats(
    long queueId,
    String queueName,
    long total,
    long open,
    long closed,
    long pending,
    long backlog
) {

    public static QueueStats empty(long queueId, String queueName) {
        return new QueueStats(queueId, queueName, 0, 0, 0, 0, 0);
    }
}
