package com.astradesk.helpdesk.stats;

import java.time.Instant;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.astradesk.helpdesk.access.QueueFilter;
import com.astradesk.helpdesk.access.QueueScope;
import com.astradesk.helpdesk.domain.StateType;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Aggregate queries for the dashboard and queue statistics. Every statement
 * carries the queue scope predicate.
 */
@Repository
public class StatisticsRepository {

    private static final String ACTIVE_TYPES = StateType.NEW.id() + ", " + StateType.OPEN.id();
    private static final String PENDING_TYPES = StateType.PENDING_REMINDER.id() + ", " + StateType.PENDING_AUTO.id();

    private final DatabaseClient databaseClient;

    public StatisticsRepository(DatabaseClient databaseClient) {
        this.databaseClient = databaseClient;
    }

    public Mono<DashboardStats.Overview> overview(QueueScope scope) {
        String sql = """
            SELECT COUNT(t.id) AS total,
                   COALESCE(SUM(CASE WHEN ts.type_id IN (%1$s) THEN 1 ELSE 0 END), 0) AS open,
                   COALESCE(SUM(CASE WHEN ts.type_id = %2$d THEN 1 ELSE 0 END), 0) AS closed,
                   COALESCE(SUM(CASE WHEN ts.type_id IN (%3$s) THEN 1 ELSE 0 END), 0) AS pending
            FROM ticket t
            JOIN ticket_state ts ON ts.id = t.ticket_state_id
            WHERE %4$s
            """.formatted(ACTIVE_TYPES, StateType.CLOSED.id(), PENDING_TYPES, QueueFilter.clause(scope, "t.queue_id"));
        return QueueFilter.bind(databaseClient.sql(sql), scope)
            .map((row, metadata) -> new DashboardStats.Overview(
                number(row, "total"), number(row, "open"), number(row, "closed"), number(row, "pending")))
            .one()
            .defaultIfEmpty(DashboardStats.Overview.EMPTY);
    }

    public Flux<DashboardStats.QueueCount> countsByQueue(QueueScope scope) {
        String sql = """
            SELECT q.id, q.name, COUNT(t.id) AS cnt
            FROM queue q
            LEFT JOIN ticket t ON t.queue_id = q.id
            WHERE q.valid_id = 1 AND %s
            GROUP BY q.id, q.name
            ORDER BY cnt DESC, q.name
            """.formatted(QueueFilter.clause(scope, "q.id"));
        return QueueFilter.bind(databaseClient.sql(sql), scope)
            .map((row, metadata) -> new DashboardStats.QueueCount(
                row.get("id", Long.class), row.get("name", String.class), number(row, "cnt")))
            .all();
    }

    /**
     * Every valid priority is listed; only tickets inside the scope are counted.
     */
    public Flux<DashboardStats.PriorityCount> countsByPriority(QueueScope scope) {
        String sql = """
            SELECT p.id, p.name, COUNT(t.id) AS cnt
            FROM ticket_priority p
            LEFT JOIN ticket t ON t.ticket_priority_id = p.id AND %s
            WHERE p.valid_id = 1
            GROUP BY p.id, p.name
            ORDER BY p.id
            """.formatted(QueueFilter.clause(scope, "t.queue_id"));
        return QueueFilter.bind(databaseClient.sql(sql), scope)
            .map((row, metadata) -> new DashboardStats.PriorityCount(
                row.get("id", Long.class), row.get("name", String.class), number(row, "cnt")))
            .all();
    }

    public Flux<DashboardStats.Activity> recentActivity(QueueScope scope, int limit) {
        String sql = """
            SELECT t.id, t.tn, t.create_time
            FROM ticket t
            WHERE %s
            ORDER BY t.create_time DESC, t.id DESC
            LIMIT :limit
            """.formatted(QueueFilter.clause(scope, "t.queue_id"));
        return QueueFilter.bind(databaseClient.sql(sql), scope)
            .bind("limit", limit)
            .map((row, metadata) -> new DashboardStats.Activity(
                "created", row.get("id", Long.class), row.get("tn", String.class), row.get("create_time", Instant.class)))
            .all();
    }

    /**
     * Per-queue breakdown for every valid queue in scope, including queues
     * without tickets.
     *
     * @param backlogThreshold open tickets created before this instant count as backlog
     */
    public Flux<QueueStats> queueBreakdown(QueueScope scope, Instant backlogThreshold) {
        String sql = """
            SELECT q.id, q.name,
                   COUNT(t.id) AS total,
                   COALESCE(SUM(CASE WHEN ts.type_id IN (%1$s) THEN 1 ELSE 0 END), 0) AS open,
                   COALESCE(SUM(CASE WHEN ts.type_id = %2$d THEN 1 ELSE 0 END), 0) AS closed,
                   COALESCE(SUM(CASE WHEN ts.type_id IN (%3$s) THEN 1 ELSE 0 END), 0) AS pending,
                   COALESCE(SUM(CASE WHEN ts.type_id IN (%1$s) AND t.create_time < :threshold THEN 1 ELSE 0 END), 0)
                       AS backlog
            FROM queue q
            LEFT JOIN ticket t ON t.queue_id = q.id
            LEFT JOIN ticket_state ts ON ts.id = t.ticket_state_id
            WHERE q.valid_id = 1 AND %4$s
            GROUP BY q.id, q.name
            """.formatted(ACTIVE_TYPES, StateType.CLOSED.id(), PENDING_TYPES, QueueFilter.clause(scope, "q.id"));
        return QueueFilter.bind(databaseClient.sql(sql), scope)
            .bind("threshold", backlogThreshold)
            .map((row, metadata) -> new QueueStats(
                row.get("id", Long.class),
                row.get("name", String.class),
                number(row, "total"),
                number(row, "open"),
                number(row, "closed"),
                number(row, "pending"),
                number(row, "backlog")))
            .all();
    }

    private static long number(Row row, String column) {
        Number value = row.get(column, Number.class);
        return value == null ? 0L : value.longValue();
    }
}
