package com.astradesk.helpdesk.ticket;

import java.time.Instant;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Mono;

/**
 * Writes internal agent notes as articles.
 */
@Repository
public class ArticleRepository {

    static final int AGENT_SENDER_TYPE = 1;

    private final DatabaseClient databaseClient;

    public ArticleRepository(DatabaseClient databaseClient) {
        this.databaseClient = databaseClient;
    }

    /**
     * @return id of the new article
     */
    public Mono<Long> insertNote(long ticketId, String subject, String body, long authorId, Instant createdAt) {
        return databaseClient.sql("""
                INSERT INTO article (
                    ticket_id, article_sender_type_id, is_visible_for_customer, a_subject, a_body,
                    create_time, create_by, change_time, change_by)
                VALUES (:ticketId, :senderType, 0, :subject, :body, :createdAt, :authorId, :createdAt, :authorId)
                RETURNING id
                """)
            .bind("ticketId", ticketId)
            .bind("senderType", AGENT_SENDER_TYPE)
            .bind("subject", subject)
            .bind("body", body)
            .bind("createdAt", createdAt)
            .bind("authorId", authorId)
            .map((row, metadata) -> row.get("id", Long.class))
            .one();
    }
}
