package com.astradesk.helpdesk.stats;

import java.util.List;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Per-queue load, busiest queue first, plus totals over the listed queues.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record QueueMetrics(List<QueueStats> queues, Totals totals) {

    public static QueueMetrics of(List<QueueStats> queues) {
        long total = 0;
        long open = 0;
        long backlog = 0;
        for (QueueStats queue : queues) {
            total += queue.total();
            open += queue.open();
            backlog += queue.backlog();
        }
        return new QueueMetrics(List.copyOf(queues), new Totals(queues.size(), total, open, backlog));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Totals(int queues, long total, long open, long backlog) {
    }
}
