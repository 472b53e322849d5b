package com.astradesk.helpdesk.ticket;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Set;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.stereotype.Repository;

import com.astradesk.helpdesk.access.QueueFilter;
import com.astradesk.helpdesk.access.QueueScope;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Ticket list queries. The queue scope predicate is part of every statement, so
 * tickets outside the caller's queues never leave the database.
 */
@Repository
public class TicketSearchRepository {

    private static final String FROM = """
        FROM ticket t
        JOIN ticket_state ts ON ts.id = t.ticket_state_id
        JOIN queue q ON q.id = t.queue_id
        LEFT JOIN ticket_priority tp ON tp.id = t.ticket_priority_id
        """;

    private final DatabaseClient databaseClient;

    public TicketSearchRepository(DatabaseClient databaseClient) {
        this.databaseClient = databaseClient;
    }

    /**
     * @param stateTypeIds restrict to these state types; empty means any
     */
    public Flux<TicketSummary> find(QueueScope scope, Set<Integer> stateTypeIds, int limit, int offset) {
        String sql = """
            SELECT t.id, t.tn, t.title, t.queue_id, q.name AS queue_name, t.ticket_state_id,
                   ts.name AS state_name, ts.type_id, t.ticket_priority_id, tp.name AS priority_name,
                   t.user_id, t.until_time, t.change_time
            """ + FROM + where(scope, stateTypeIds) + """
             ORDER BY t.change_time DESC, t.id DESC
            LIMIT :limit OFFSET :offset
            """;
        return bind(databaseClient.sql(sql), scope, stateTypeIds)
            .bind("limit", limit)
            .bind("offset", offset)
            .map((row, metadata) -> toSummary(row))
            .all();
    }

    public Mono<Long> count(QueueScope scope, Set<Integer> stateTypeIds) {
        String sql = "SELECT COUNT(*) AS total " + FROM + where(scope, stateTypeIds);
        return bind(databaseClient.sql(sql), scope, stateTypeIds)
            .map((row, metadata) -> row.get("total", Long.class))
            .one()
            .defaultIfEmpty(0L);
    }

    private static String where(QueueScope scope, Set<Integer> stateTypeIds) {
        StringBuilder where = new StringBuilder("WHERE ").append(QueueFilter.clause(scope, "t.queue_id"));
        if (!stateTypeIds.isEmpty()) {
            where.append(" AND ts.type_id IN (:stateTypeIds)");
        }
        return where.append('\n').toString();
    }

    private static GenericExecuteSpec bind(GenericExecuteSpec spec, QueueScope scope, Set<Integer> stateTypeIds) {
        GenericExecuteSpec bound = QueueFilter.bind(spec, scope);
        if (!stateTypeIds.isEmpty()) {
            bound = bound.bind("stateTypeIds", new ArrayList<>(stateTypeIds));
        }
        return bound;
    }

    private static TicketSummary toSummary(Row row) {
        Integer typeId = row.get("type_id", Integer.class);
        Long untilTime = row.get("until_time", Long.class);
        return new TicketSummary(
            row.get("id", Long.class),
            row.get("tn", String.class),
            row.get("title", String.class),
            row.get("queue_id", Long.class),
            row.get("queue_name", String.class),
            row.get("ticket_state_id", Long.class),
            row.get("state_name", String.class),
            typeId == null ? 0 : typeId,
            row.get("ticket_priority_id", Long.class),
            row.get("priority_name", String.class),
            row.get("user_id", Long.class),
            untilTime == null ? 0L : untilTime,
            row.get("change_time", Instant.class)
        );
    }
}
