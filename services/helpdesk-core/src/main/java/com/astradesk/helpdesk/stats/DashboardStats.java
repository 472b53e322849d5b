package com.astradesk.helpdesk.stats;

import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Dashboard aggregates, limited to the caller's queues.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DashboardStats(
    Overview overview,
    List<QueueCount> byQueue,
    List<PriorityCount> byPriority,
    List<Activity> recentActivity
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Overview(long totalTickets, long openTickets, long closedTickets, long pendingTickets) {

        public static final Overview EMPTY = new Overview(0, 0, 0, 0);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record QueueCount(long queueId, String queueName, long count) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PriorityCount(long priorityId, String priorityName, long count) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Activity(String type, long ticketId, String ticketTn, Instant timestamp) {
    }
}
