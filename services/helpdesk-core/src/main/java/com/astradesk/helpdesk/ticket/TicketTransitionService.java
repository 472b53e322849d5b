package com.astradesk.helpdesk.ticket;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.astradesk.helpdesk.access.QueueAccessResolver;
import com.astradesk.helpdesk.config.HelpdeskProperties;
import com.astradesk.helpdesk.domain.CallerIdentity;
import com.astradesk.helpdesk.domain.HistoryType;
import com.astradesk.helpdesk.domain.PermissionKey;
import com.astradesk.helpdesk.domain.Queue;
import com.astradesk.helpdesk.domain.Ticket;
import com.astradesk.helpdesk.domain.TicketPriority;
import com.astradesk.helpdesk.domain.TicketState;
import com.astradesk.helpdesk.error.HelpdeskException;
import com.astradesk.helpdesk.error.InvalidTicketRequestException;
import com.astradesk.helpdesk.error.TicketNotFoundException;
import com.astradesk.helpdesk.error.TicketUpdateFailedException;
import com.astradesk.helpdesk.history.ChangeMessages;
import com.astradesk.helpdesk.history.HistoryRecorder;
import com.astradesk.helpdesk.pending.PendingTimeParser;
import com.astradesk.helpdesk.state.StateCatalog;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The only component that mutates tickets.
 *
 * <p>Every operation follows the same sequence:
 * <ol>
 *   <li>validate the request and load the ticket (the pre-change snapshot),</li>
 *   <li>authorize the caller on the ticket's queue,</li>
 *   <li>apply one targeted UPDATE,</li>
 *   <li>re-read the ticket and append the history entries.</li>
 * </ol>
 * Nothing is written before steps 1 and 2 succeed. A failed UPDATE surfaces as
 * {@link TicketUpdateFailedException}. History is best effort: once the UPDATE went
 * through, a failing audit insert is logged at WARN and the change stands.</p>
 */
@Service
public class TicketTransitionService {

    private static final Logger log = LoggerFactory.getLogger(TicketTransitionService.class);

    static final String STATUS_REQUIRED = "status is required";
    static final String INVALID_PENDING_TIME = "Invalid pending time format";
    static final String PENDING_TIME_REQUIRED = "pending_until is required for pending states";
    static final String INVALID_PRIORITY = "invalid priority";
    static final String INVALID_QUEUE = "invalid queue";
    static final String INVALID_AGENT = "invalid agent";
    static final String AGENT_NOT_PERMITTED = "agent cannot own tickets in this queue";
    static final String NOTE_REQUIRED = "note body is required";
    static final String TICKET_IDS_REQUIRED = "ticket_ids is required";

    static final String NOTE_SUBJECT = "Note";
    static final String PENDING_CLEARED = "Pending time cleared";

    private final TicketRepository ticketRepository;
    private final LookupRepository lookups;
    private final ArticleRepository articles;
    private final QueueAccessResolver accessResolver;
    private final StateCatalog stateCatalog;
    private final PendingTimeParser pendingTimeParser;
    private final HistoryRecorder historyRecorder;
    private final Clock clock;
    private final DateTimeFormatter pendingFormat;

    public TicketTransitionService(
        TicketRepository ticketRepository,
        LookupRepository lookups,
        ArticleRepository articles,
        QueueAccessResolver accessResolver,
        StateCatalog stateCatalog,
        PendingTimeParser pendingTimeParser,
        HistoryRecorder historyRecorder,
        Clock clock,
        HelpdeskProperties properties
    ) {
        this.ticketRepository = ticketRepository;
        this.lookups = lookups;
        this.articles = articles;
        this.accessResolver = accessResolver;
        this.stateCatalog = stateCatalog;
        this.pendingTimeParser = pendingTimeParser;
        this.historyRecorder = historyRecorder;
        this.clock = clock;
        this.pendingFormat = DateTimeFormatter.ofPattern("dd MMM yyyy HH:mm", Locale.ENGLISH)
            .withZone(properties.getPending().zoneId());
    }

    /**
     * Moves a ticket to another state. Pending targets need a parseable
     * {@code pendingUntil}; any other target clears the stored deadline.
     */
    public Mono<Ticket> updateState(CallerIdentity caller, long ticketId, String status, String pendingUntil) {
        if (isBlank(status)) {
            return invalid(STATUS_REQUIRED);
        }
        return loadTicket(ticketId)
            .flatMap(ticket -> accessResolver.requireTicketQueue(caller, ticket, PermissionKey.RW))
            .flatMap(prior -> planStateChange(status, pendingUntil)
                .flatMap(change -> applyStateChange(caller, prior, change)));
    }

    public Mono<Ticket> updatePriority(CallerIdentity caller, long ticketId, Long priorityId) {
        if (priorityId == null || priorityId <= 0) {
            return invalid(INVALID_PRIORITY);
        }
        return loadTicket(ticketId)
            .flatMap(ticket -> accessResolver.requireTicketQueue(caller, ticket, PermissionKey.PRIORITY))
            .flatMap(prior -> lookups.findPriority(priorityId)
                .switchIfEmpty(invalid(INVALID_PRIORITY))
                .flatMap(priority -> applyPriority(caller, prior, priority)));
    }

    /**
     * Needs {@code rw} on the current queue and {@code move_into} on the target. The
     * target permission is checked before the target is looked up, so callers
     * cannot probe for queue ids they have no access to.
     */
    public Mono<Ticket> moveQueue(CallerIdentity caller, long ticketId, Long queueId) {
        if (queueId == null || queueId <= 0) {
            return invalid(INVALID_QUEUE);
        }
        return loadTicket(ticketId)
            .flatMap(ticket -> accessResolver.requireTicketQueue(caller, ticket, PermissionKey.RW))
            .flatMap(prior -> accessResolver.requireQueue(caller, queueId, PermissionKey.MOVE_INTO)
                .then(Mono.defer(() -> lookups.findQueue(queueId)))
                .switchIfEmpty(invalid(INVALID_QUEUE))
                .flatMap(target -> applyMove(caller, prior, target)));
    }

    public Mono<Ticket> assignOwner(CallerIdentity caller, long ticketId, Long agentId) {
        return assign(caller, ticketId, agentId, Assignment.OWNER);
    }

    public Mono<Ticket> assignResponsible(CallerIdentity caller, long ticketId, Long agentId) {
        return assign(caller, ticketId, agentId, Assignment.RESPONSIBLE);
    }

    /**
     * Stores an internal note. When {@code nextStatus} is given the caller also
     * needs {@code rw}, and the state change is validated before the note is
     * written.
     */
    public Mono<NoteResult> addNote(CallerIdentity caller, long ticketId, String body,
                                    String nextStatus, String pendingUntil) {
        if (isBlank(body)) {
            return invalid(NOTE_REQUIRED);
        }
        boolean changesState = !isBlank(nextStatus);
        return loadTicket(ticketId)
            .flatMap(ticket -> accessResolver.requireTicketQueue(caller, ticket, PermissionKey.NOTE))
            .flatMap(ticket -> changesState
                ? accessResolver.requireTicketQueue(caller, ticket, PermissionKey.RW)
                : Mono.just(ticket))
            .flatMap(prior -> optionalStateChange(changesState, nextStatus, pendingUntil)
                .flatMap(change -> writeNote(caller, prior, body.trim(), change)));
    }

    /**
     * Applies {@link #updateState} to each ticket in turn. One ticket failing does
     * not stop the others; the outcome list reports each result in request order.
     */
    public Mono<List<BulkOutcome>> bulkUpdateState(CallerIdentity caller, List<Long> ticketIds,
                                                   String status, String pendingUntil) {
        if (isBlank(status)) {
            return invalid(STATUS_REQUIRED);
        }
        if (ticketIds == null || ticketIds.isEmpty()) {
            return invalid(TICKET_IDS_REQUIRED);
        }
        return Flux.fromIterable(new LinkedHashSet<>(ticketIds))
            .filter(Objects::nonNull)
            .concatMap(id -> updateState(caller, id, status, pendingUntil)
                .map(updated -> BulkOutcome.succeeded(id))
                .onErrorResume(error -> Mono.just(outcomeOf(id, error))))
            .collectList();
    }

    Mono<StateChange> planStateChange(String status, String pendingUntil) {
        return stateCatalog.resolveState(status, 0)
            .flatMap(resolution -> toStateChange(resolution.state(), pendingUntil));
    }

    /**
     * Only pending targets read {@code pendingUntil}; any other target clears the
     * deadline whatever the request carried.
     */
    private Mono<StateChange> toStateChange(TicketState target, String pendingUntil) {
        if (!target.isPending()) {
            return Mono.just(new StateChange(target, 0L));
        }
        if (isBlank(pendingUntil)) {
            return invalid(PENDING_TIME_REQUIRED);
        }
        Optional<Instant> deadline = pendingTimeParser.parse(pendingUntil);
        if (deadline.isEmpty()) {
            return invalid(INVALID_PENDING_TIME);
        }
        return Mono.just(new StateChange(target, deadline.get().getEpochSecond()));
    }

    private Mono<Optional<StateChange>> optionalStateChange(boolean changesState, String status, String pendingUntil) {
        if (!changesState) {
            return Mono.just(Optional.empty());
        }
        return planStateChange(status, pendingUntil).map(Optional::of);
    }

    private Mono<Ticket> applyStateChange(CallerIdentity caller, Ticket prior, StateChange change) {
        Instant now = clock.instant();
        TicketState target = change.target();
        return ticketRepository.updateState(prior.getId(), target.id(), change.untilTime(), now, caller.userId())
            .onErrorMap(this::isUnexpected, error -> writeFailed("status", prior.getId(), error))
            .flatMap(rows -> reload(prior, rows, updated -> {
                updated.setStateId(target.id());
                updated.setUntilTime(change.untilTime());
                touch(updated, now, caller);
            }))
            .flatMap(updated -> afterWrite(updated, "State change", stateName(prior.getStateId())
                .flatMap(previousName -> {
                    String message = ChangeMessages.changeMessage("State", previousName, target.name());
                    if (message.isEmpty()) {
                        message = "State set to " + target.name();
                    }
                    return audit(prior, updated, null, HistoryType.STATE_UPDATE, message, caller)
                        .then(audit(prior, updated, null, HistoryType.SET_PENDING_TIME,
                            pendingMessage(prior, change), caller));
                })));
    }

    private Mono<Ticket> applyPriority(CallerIdentity caller, Ticket prior, TicketPriority priority) {
        if (Objects.equals(prior.getPriorityId(), priority.id())) {
            log.debug("Ticket {} already has priority {}, nothing to do", prior.getId(), priority.id());
            return Mono.just(prior);
        }
        Instant now = clock.instant();
        String newLabel = ChangeMessages.labelled(priority.id(), priority.name());
        return ticketRepository.updatePriority(prior.getId(), priority.id(), now, caller.userId())
            .onErrorMap(this::isUnexpected, error -> writeFailed("priority", prior.getId(), error))
            .flatMap(rows -> reload(prior, rows, updated -> {
                updated.setPriorityId(priority.id());
                touch(updated, now, caller);
            }))
            .flatMap(updated -> afterWrite(updated, "Priority change", priorityLabel(prior.getPriorityId())
                .flatMap(previous -> audit(prior, updated, null, HistoryType.PRIORITY_UPDATE,
                    ChangeMessages.changeMessage("Priority", previous, newLabel), caller))));
    }

    private Mono<Ticket> applyMove(CallerIdentity caller, Ticket prior, Queue target) {
        if (Objects.equals(prior.getQueueId(), target.id())) {
            log.debug("Ticket {} is already in queue {}, nothing to do", prior.getId(), target.id());
            return Mono.just(prior);
        }
        Instant now = clock.instant();
        return ticketRepository.updateQueue(prior.getId(), target.id(), now, caller.userId())
            .onErrorMap(this::isUnexpected, error -> writeFailed("queue", prior.getId(), error))
            .flatMap(rows -> reload(prior, rows, updated -> {
                updated.setQueueId(target.id());
                touch(updated, now, caller);
            }))
            .flatMap(updated -> afterWrite(updated, "Queue move", queueName(prior.getQueueId())
                .flatMap(previous -> audit(prior, updated, null, HistoryType.QUEUE_MOVE,
                    ChangeMessages.changeMessage("Queue", previous, target.name()), caller))));
    }

    private Mono<Ticket> assign(CallerIdentity caller, long ticketId, Long agentId, Assignment role) {
        if (agentId == null || agentId <= 0) {
            return invalid(INVALID_AGENT);
        }
        return loadTicket(ticketId)
            .flatMap(ticket -> accessResolver.requireTicketQueue(caller, ticket, PermissionKey.OWNER))
            .flatMap(prior -> lookups.findUserLogin(agentId)
                .switchIfEmpty(invalid(INVALID_AGENT))
                .flatMap(login -> requireAgentCanOwn(agentId, prior).thenReturn(login))
                .flatMap(login -> applyAssignment(caller, prior, agentId, login, role)));
    }

    private Mono<Void> requireAgentCanOwn(long agentId, Ticket ticket) {
        return accessResolver.accessibleQueues(CallerIdentity.of(agentId), PermissionKey.OWNER)
            .filter(scope -> scope.permits(ticket.getQueueId()))
            .switchIfEmpty(invalid(AGENT_NOT_PERMITTED))
            .then();
    }

    private Mono<Ticket> applyAssignment(CallerIdentity caller, Ticket prior, long agentId, String login,
                                         Assignment role) {
        Long current = role.current(prior);
        if (Objects.equals(current, agentId)) {
            log.debug("Ticket {} already has {} {}, nothing to do", prior.getId(), role.field, agentId);
            return Mono.just(prior);
        }
        Instant now = clock.instant();
        Mono<Integer> write = role == Assignment.OWNER
            ? ticketRepository.updateOwner(prior.getId(), agentId, now, caller.userId())
            : ticketRepository.updateResponsible(prior.getId(), agentId, now, caller.userId());
        return write
            .onErrorMap(this::isUnexpected, error -> writeFailed(role.field.toLowerCase(Locale.ROOT), prior.getId(), error))
            .flatMap(rows -> reload(prior, rows, updated -> {
                role.apply(updated, agentId);
                touch(updated, now, caller);
            }))
            .flatMap(updated -> afterWrite(updated, role.field + " change", userLabel(current)
                .flatMap(previous -> audit(prior, updated, null, role.historyType,
                    ChangeMessages.changeMessage(role.field, previous, login), caller))));
    }

    private Mono<NoteResult> writeNote(CallerIdentity caller, Ticket prior, String body, Optional<StateChange> change) {
        Instant now = clock.instant();
        return articles.insertNote(prior.getId(), NOTE_SUBJECT, body, caller.userId(), now)
            .onErrorMap(this::isUnexpected, error -> writeFailed("notes", prior.getId(), error))
            .flatMap(articleId -> afterWrite(prior, "Note", audit(prior, prior, articleId, HistoryType.ADD_NOTE,
                    "Added note (" + NOTE_SUBJECT + ")", caller))
                .then(Mono.defer(() -> change.isPresent()
                    ? applyStateChange(caller, prior, change.get())
                    : Mono.just(prior)))
                .map(ticket -> new NoteResult(articleId, ticket)));
    }

    private Mono<Ticket> loadTicket(long ticketId) {
        return ticketRepository.findById(ticketId)
            .switchIfEmpty(Mono.error(() -> new TicketNotFoundException(ticketId)));
    }

    /**
     * Post-write view of the ticket. A failed re-read falls back to the prior
     * snapshot with the change applied locally, so history still gets recorded.
     */
    private Mono<Ticket> reload(Ticket prior, int rows, Consumer<Ticket> change) {
        if (rows == 0) {
            return Mono.error(new TicketNotFoundException(prior.getId()));
        }
        return ticketRepository.findById(prior.getId())
            .onErrorResume(error -> {
                log.warn("Re-reading ticket {} after update failed: {}", prior.getId(), error.getMessage());
                return Mono.empty();
            })
            .switchIfEmpty(Mono.fromSupplier(() -> {
                Ticket local = Ticket.copyOf(prior);
                change.accept(local);
                return local;
            }));
    }

    private Mono<Ticket> afterWrite(Ticket updated, String operation, Mono<Void> history) {
        log.info("{} applied to ticket {}", operation, updated.getId());
        return history
            .doOnCancel(() -> log.warn("{} on ticket {} was cancelled before its history was recorded",
                operation, updated.getId()))
            .thenReturn(updated);
    }

    private Mono<Void> audit(Ticket prior, Ticket updated, Long articleId, HistoryType type, String message,
                             CallerIdentity caller) {
        return Mono.defer(() -> historyRecorder.record(prior, updated, articleId, type, message, caller.userId()))
            .onErrorResume(error -> {
                log.warn("History entry {} for ticket {} was not recorded, the change itself is kept: {}",
                    type.typeName(), prior.getId(), error.getMessage());
                return Mono.empty();
            });
    }

    private String pendingMessage(Ticket prior, StateChange change) {
        if (change.untilTime() == prior.getUntilTime()) {
            return "";
        }
        if (change.untilTime() > 0) {
            return "Pending until " + pendingFormat.format(Instant.ofEpochSecond(change.untilTime()));
        }
        if (prior.hasPendingTime()) {
            return PENDING_CLEARED;
        }
        return "";
    }

    private Mono<String> stateName(Long stateId) {
        if (stateId == null) {
            return Mono.just("");
        }
        return stateCatalog.loadState(stateId)
            .map(TicketState::name)
            .defaultIfEmpty("state " + stateId)
            .onErrorResume(error -> {
                log.warn("Previous state lookup for history failed: {}", error.getMessage());
                return Mono.just("state " + stateId);
            });
    }

    private Mono<String> priorityLabel(Long priorityId) {
        if (priorityId == null) {
            return Mono.just("");
        }
        return lookups.findPriority(priorityId)
            .map(priority -> ChangeMessages.labelled(priority.id(), priority.name()))
            .defaultIfEmpty(String.valueOf(priorityId))
            .onErrorResume(error -> {
                log.warn("Previous priority lookup for history failed: {}", error.getMessage());
                return Mono.just(String.valueOf(priorityId));
            });
    }

    private Mono<String> queueName(Long queueId) {
        if (queueId == null) {
            return Mono.just("");
        }
        return lookups.findQueue(queueId)
            .map(Queue::name)
            .defaultIfEmpty("queue " + queueId)
            .onErrorResume(error -> {
                log.warn("Previous queue lookup for history failed: {}", error.getMessage());
                return Mono.just("queue " + queueId);
            });
    }

    private Mono<String> userLabel(Long userId) {
        if (userId == null || userId <= 0) {
            return Mono.just("");
        }
        return lookups.findUserLogin(userId)
            .defaultIfEmpty("user " + userId)
            .onErrorResume(error -> {
                log.warn("Previous agent lookup for history failed: {}", error.getMessage());
                return Mono.just("user " + userId);
            });
    }

    private BulkOutcome outcomeOf(long ticketId, Throwable error) {
        if (error instanceof HelpdeskException failure) {
            return BulkOutcome.failed(ticketId, failure.getStatus().value(), failure.getMessage());
        }
        log.error("Bulk status update failed for ticket {}", ticketId, error);
        return BulkOutcome.failed(ticketId, 500, "Failed to update ticket");
    }

    private static void touch(Ticket ticket, Instant now, CallerIdentity caller) {
        ticket.setChangedAt(now);
        ticket.setChangedBy(caller.userId());
    }

    private boolean isUnexpected(Throwable error) {
        return !(error instanceof HelpdeskException);
    }

    private TicketUpdateFailedException writeFailed(String what, long ticketId, Throwable error) {
        log.error("Failed to update {} of ticket {}", what, ticketId, error);
        return new TicketUpdateFailedException("Failed to update ticket " + what, error);
    }

    private static <T> Mono<T> invalid(String reason) {
        return Mono.error(new InvalidTicketRequestException(reason));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private enum Assignment {
        OWNER("Owner", HistoryType.OWNER_UPDATE),
        RESPONSIBLE("Responsible", HistoryType.RESPONSIBLE_UPDATE);

        private final String field;
        private final HistoryType historyType;

        Assignment(String field, HistoryType historyType) {
            this.field = field;
            this.historyType = historyType;
        }

        Long current(Ticket ticket) {
            return this == OWNER ? ticket.getOwnerId() : ticket.getResponsibleId();
        }

        void apply(Ticket ticket, long agentId) {
            if (this == OWNER) {
                ticket.setOwnerId(agentId);
            } else {
                ticket.setResponsibleId(agentId);
            }
        }
    }
}
