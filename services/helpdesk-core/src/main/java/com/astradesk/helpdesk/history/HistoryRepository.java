package com.astradesk.helpdesk.history;

import java.time.Instant;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.stereotype.Repository;

import com.astradesk.helpdesk.domain.HistoryEntry;
import com.astradesk.helpdesk.domain.HistoryType;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Append-only access to {@code ticket_history}. There is deliberately no update or
 * delete method.
 */
@Repository
public class HistoryRepository {

    private final DatabaseClient databaseClient;

    public HistoryRepository(DatabaseClient databaseClient) {
        this.databaseClient = databaseClient;
    }

    /**
     * Id of the named history type, inserting the row on first use.
     */
    public Mono<Long> resolveTypeId(HistoryType type, long actorId) {
        Mono<Long> existing = databaseClient.sql("SELECT id FROM ticket_history_type WHERE name = :name")
            .bind("name", type.typeName())
            .map((row, metadata) -> row.get("id", Long.class))
            .first();
        Mono<Long> created = databaseClient.sql("""
                INSERT INTO ticket_history_type (name, valid_id, create_time, create_by, change_time, change_by)
                VALUES (:name, 1, CURRENT_TIMESTAMP, :actor, CURRENT_TIMESTAMP, :actor)
                RETURNING id
                """)
            .bind("name", type.typeName())
            .bind("actor", actorId)
            .map((row, metadata) -> row.get("id", Long.class))
            .one();
        return existing.switchIfEmpty(Mono.defer(() -> created));
    }

    public Mono<Long> insert(HistoryEntry entry, long historyTypeId) {
        GenericExecuteSpec spec = databaseClient.sql("""
                INSERT INTO ticket_history (
                    name, history_type_id, ticket_id, article_id, type_id,
                    queue_id, owner_id, priority_id, state_id,
                    create_time, create_by, change_time, change_by)
                VALUES (
                    :name, :historyTypeId, :ticketId, :articleId, 1,
                    :queueId, :ownerId, :priorityId, :stateId,
                    :createdAt, :createdBy, :createdAt, :createdBy)
                RETURNING id
                """)
            .bind("name", entry.message())
            .bind("historyTypeId", historyTypeId)
            .bind("ticketId", entry.ticketId())
            .bind("createdAt", entry.createdAt())
            .bind("createdBy", entry.createdBy());
        spec = bindNullable(spec, "articleId", entry.articleId());
        spec = bindNullable(spec, "queueId", entry.queueId());
        spec = bindNullable(spec, "ownerId", entry.ownerId());
        spec = bindNullable(spec, "priorityId", entry.priorityId());
        spec = bindNullable(spec, "stateId", entry.stateId());
        return spec.map((row, metadata) -> row.get("id", Long.class)).one();
    }

    /**
     * Newest entries first.
     */
    public Flux<HistoryEntry> findByTicket(long ticketId, int limit) {
        return databaseClient.sql("""
                SELECT th.id, th.ticket_id, tht.name AS type_name, th.name, th.queue_id, th.owner_id,
                       th.priority_id, th.state_id, th.article_id, th.create_by, th.create_time
                FROM ticket_history th
                JOIN ticket_history_type tht ON tht.id = th.history_type_id
                WHERE th.ticket_id = :ticketId
                ORDER BY th.create_time DESC, th.id DESC
                LIMIT :limit
                """)
            .bind("ticketId", ticketId)
            .bind("limit", limit)
            .map((row, metadata) -> toEntry(row))
            .all();
    }

    private static GenericExecuteSpec bindNullable(GenericExecuteSpec spec, String name, Long value) {
        return value == null ? spec.bindNull(name, Long.class) : spec.bind(name, value);
    }

    private static HistoryEntry toEntry(Row row) {
        Long createdBy = row.get("create_by", Long.class);
        return new HistoryEntry(
            row.get("id", Long.class),
            row.get("ticket_id", Long.class),
            row.get("type_name", String.class),
            row.get("name", String.class),
            row.get("queue_id", Long.class),
            row.get("owner_id", Long.class),
            row.get("priority_id", Long.class),
            row.get("state_id", Long.class),
            row.get("article_id", Long.class),
            createdBy == null ? 0L : createdBy,
            row.get("create_time", Instant.class)
        );
    }
}
