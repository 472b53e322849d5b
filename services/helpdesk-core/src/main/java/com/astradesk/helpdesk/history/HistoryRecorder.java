package com.astradesk.helpdesk.history;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.astradesk.helpdesk.domain.HistoryEntry;
import com.astradesk.helpdesk.domain.HistoryType;
import com.astradesk.helpdesk.domain.Ticket;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Appends attributable entries to a ticket's audit trail.
 *
 * <p>Failures are propagated; deciding whether an audit failure is fatal is up to
 * the caller.</p>
 */
@Service
public class HistoryRecorder {

    private static final Logger log = LoggerFactory.getLogger(HistoryRecorder.class);

    static final int MAX_MESSAGE_LENGTH = 200;

    private final HistoryRepository repository;
    private final Clock clock;

    public HistoryRecorder(HistoryRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Records one entry. The snapshot columns come from {@code updated}, or from
     * {@code prior} when the post-write state is unknown. A blank message records
     * nothing.
     */
    public Mono<Void> record(Ticket prior, Ticket updated, Long articleId, HistoryType type,
                             String message, long actorId) {
        if (message == null || message.isBlank()) {
            log.debug("Skipping {} history entry with empty message", type.typeName());
            return Mono.empty();
        }
        Ticket snapshot = updated != null ? updated : prior;
        if (snapshot == null || snapshot.getId() == null) {
            return Mono.error(new IllegalArgumentException("History entry needs a ticket"));
        }
        HistoryEntry entry = new HistoryEntry(
            null,
            snapshot.getId(),
            type.typeName(),
            truncate(message.trim()),
            snapshot.getQueueId(),
            snapshot.getOwnerId(),
            snapshot.getPriorityId(),
            snapshot.getStateId(),
            articleId,
            actorId,
            clock.instant()
        );
        return repository.resolveTypeId(type, actorId)
            .flatMap(typeId -> repository.insert(entry, typeId))
            .doOnNext(id -> log.debug("Recorded {} #{} for ticket {}", type.typeName(), id, entry.ticketId()))
            .then();
    }

    public Flux<HistoryEntry> history(long ticketId, int limit) {
        return repository.findByTicket(ticketId, limit);
    }

    private static String truncate(String message) {
        return message.length() <= MAX_MESSAGE_LENGTH ? message : message.substring(0, MAX_MESSAGE_LENGTH);
    }
}
