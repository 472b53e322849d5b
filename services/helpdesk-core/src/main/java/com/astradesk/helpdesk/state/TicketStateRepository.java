package com.astradesk.helpdesk.state;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.astradesk.helpdesk.domain.TicketState;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public class TicketStateRepository {

    private final DatabaseClient databaseClient;

    public TicketStateRepository(DatabaseClient databaseClient) {
        this.databaseClient = databaseClient;
    }

    public Flux<TicketState> findAllValid() {
        return databaseClient.sql("""
                SELECT id, name, type_id
                FROM ticket_state
                WHERE valid_id = 1
                ORDER BY id
                """)
            .map((row, metadata) -> toState(row))
            .all();
    }

    public Mono<TicketState> findById(long id) {
        return databaseClient.sql("SELECT id, name, type_id FROM ticket_state WHERE id = :id")
            .bind("id", id)
            .map((row, metadata) -> toState(row))
            .one();
    }

    private static TicketState toState(Row row) {
        Long id = row.get("id", Long.class);
        Integer typeId = row.get("type_id", Integer.class);
        return new TicketState(
            id == null ? 0L : id,
            row.get("name", String.class),
            typeId == null ? 0 : typeId
        );
    }
}
