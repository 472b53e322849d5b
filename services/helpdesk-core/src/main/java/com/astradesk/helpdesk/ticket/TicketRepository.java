package com.astradesk.helpdesk.ticket;

import java.time.Instant;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.astradesk.helpdesk.domain.Ticket;

import reactor.core.publisher.Mono;

/**
 * Reactive persistence gateway for tickets.
 *
 * <p>Each mutation is a single targeted UPDATE returning the affected row count, so
 * concurrent writers to different columns never overwrite each other's changes.</p>
 */
@Repository
public interface TicketRepository extends ReactiveCrudRepository<Ticket, Long> {

    @Modifying
    @Query("""
        UPDATE ticket
        SET ticket_state_id = :stateId, until_time = :untilTime, change_time = :changedAt, change_by = :changedBy
        WHERE id = :id
        """)
    Mono<Integer> updateState(@Param("id") long id, @Param("stateId") long stateId,
                              @Param("untilTime") long untilTime, @Param("changedAt") Instant changedAt,
                              @Param("changedBy") long changedBy);

    @Modifying
    @Query("""
        UPDATE ticket
        SET ticket_priority_id = :priorityId, change_time = :changedAt, change_by = :changedBy
        WHERE id = :id
        """)
    Mono<Integer> updatePriority(@Param("id") long id, @Param("priorityId") long priorityId,
                                 @Param("changedAt") Instant changedAt, @Param("changedBy") long changedBy);

    @Modifying
    @Query("""
        UPDATE ticket
        SET queue_id = :queueId, change_time = :changedAt, change_by = :changedBy
        WHERE id = :id
        """)
    Mono<Integer> updateQueue(@Param("id") long id, @Param("queueId") long queueId,
                              @Param("changedAt") Instant changedAt, @Param("changedBy") long changedBy);

    @Modifying
    @Query("""
        UPDATE ticket
        SET user_id = :ownerId, change_time = :changedAt, change_by = :changedBy
        WHERE id = :id
        """)
    Mono<Integer> updateOwner(@Param("id") long id, @Param("ownerId") long ownerId,
                              @Param("changedAt") Instant changedAt, @Param("changedBy") long changedBy);

    @Modifying
    @Query("""
        UPDATE ticket
        SET responsible_user_id = :responsibleId, change_time = :changedAt, change_by = :changedBy
        WHERE id = :id
        """)
    Mono<Integer> updateResponsible(@Param("id") long id, @Param("responsibleId") long responsibleId,
                                    @Param("changedAt") Instant changedAt, @Param("changedBy") long changedBy);
}
