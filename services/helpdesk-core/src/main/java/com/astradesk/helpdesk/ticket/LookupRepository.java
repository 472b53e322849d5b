package com.astradesk.helpdesk.ticket;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.astradesk.helpdesk.access.QueueFilter;
import com.astradesk.helpdesk.access.QueueScope;
import com.astradesk.helpdesk.domain.Queue;
import com.astradesk.helpdesk.domain.TicketPriority;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read access to the small reference tables (priorities, queues, agents).
 * Only valid rows are returned.
 */
@Repository
public class LookupRepository {

    private final DatabaseClient databaseClient;

    public LookupRepository(DatabaseClient databaseClient) {
        this.databaseClient = databaseClient;
    }

    public Mono<TicketPriority> findPriority(long id) {
        return databaseClient.sql("SELECT id, name FROM ticket_priority WHERE id = :id AND valid_id = 1")
            .bind("id", id)
            .map((row, metadata) -> new TicketPriority(row.get("id", Long.class), row.get("name", String.class)))
            .one();
    }

    public Mono<Queue> findQueue(long id) {
        return databaseClient.sql("SELECT id, name, group_id FROM queue WHERE id = :id AND valid_id = 1")
            .bind("id", id)
            .map((row, metadata) -> toQueue(row))
            .one();
    }

    public Flux<Queue> listQueues(QueueScope scope) {
        String sql = "SELECT id, name, group_id FROM queue WHERE valid_id = 1 AND "
            + QueueFilter.clause(scope, "id") + " ORDER BY name, id";
        return QueueFilter.bind(databaseClient.sql(sql), scope)
            .map((row, metadata) -> toQueue(row))
            .all();
    }

    /**
     * Login of a valid agent, empty when the id is unknown or invalidated.
     */
    public Mono<String> findUserLogin(long userId) {
        return databaseClient.sql("SELECT login FROM users WHERE id = :id AND valid_id = 1")
            .bind("id", userId)
            .map((row, metadata) -> row.get("login", String.class))
            .one();
    }

    private static Queue toQueue(Row row) {
        Long groupId = row.get("group_id", Long.class);
        return new Queue(row.get("id", Long.class), row.get("name", String.class), groupId == null ? 0L : groupId);
    }
}
