package com.astradesk.helpdesk.ticket;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.astradesk.helpdesk.access.QueueAccessResolver;
import com.astradesk.helpdesk.access.QueueScope;
import com.astradesk.helpdesk.config.HelpdeskProperties;
import com.astradesk.helpdesk.domain.CallerIdentity;
import com.astradesk.helpdesk.domain.HistoryEntry;
import com.astradesk.helpdesk.domain.PermissionKey;
import com.astradesk.helpdesk.domain.Queue;
import com.astradesk.helpdesk.domain.StateType;
import com.astradesk.helpdesk.domain.Ticket;
import com.astradesk.helpdesk.domain.TicketPriority;
import com.astradesk.helpdesk.domain.TicketState;
import com.astradesk.helpdesk.error.InvalidTicketRequestException;
import com.astradesk.helpdesk.error.QueueAccessDeniedException;
import com.astradesk.helpdesk.error.TicketNotFoundException;
import com.astradesk.helpdesk.history.HistoryRecorder;
import com.astradesk.helpdesk.pending.PendingTimeCalculator;
import com.astradesk.helpdesk.state.StateCatalog;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read side for tickets. Lists are filtered by the caller's {@code ro} scope; a
 * single ticket outside that scope is a 403.
 */
@Service
public class TicketQueryService {

    private static final Logger log = LoggerFactory.getLogger(TicketQueryService.class);

    static final int DEFAULT_PAGE_SIZE = 25;
    static final int MAX_PAGE_SIZE = 200;
    static final String INVALID_STATE_TYPE = "invalid state_type";

    private final TicketRepository ticketRepository;
    private final TicketSearchRepository searchRepository;
    private final LookupRepository lookups;
    private final QueueAccessResolver accessResolver;
    private final StateCatalog stateCatalog;
    private final PendingTimeCalculator pendingTimeCalculator;
    private final HistoryRecorder historyRecorder;
    private final HelpdeskProperties.HistoryProperties historyProperties;

    public TicketQueryService(
        TicketRepository ticketRepository,
        TicketSearchRepository searchRepository,
        LookupRepository lookups,
        QueueAccessResolver accessResolver,
        StateCatalog stateCatalog,
        PendingTimeCalculator pendingTimeCalculator,
        HistoryRecorder historyRecorder,
        HelpdeskProperties properties
    ) {
        this.ticketRepository = ticketRepository;
        this.searchRepository = searchRepository;
        this.lookups = lookups;
        this.accessResolver = accessResolver;
        this.stateCatalog = stateCatalog;
        this.pendingTimeCalculator = pendingTimeCalculator;
        this.historyRecorder = historyRecorder;
        this.historyProperties = properties.getHistory();
    }

    /**
     * @param queueId   optional explicit queue; outside the caller's scope it is a 403
     * @param stateType optional state type filter ({@code open}, {@code pending}, a
     *                  type name or a numeric type id)
     */
    public Mono<TicketPage> listTickets(CallerIdentity caller, Long queueId, String stateType,
                                        Integer limit, Integer offset) {
        Set<Integer> stateTypeIds;
        try {
            stateTypeIds = stateTypeIds(stateType);
        } catch (IllegalArgumentException e) {
            return Mono.error(new InvalidTicketRequestException(INVALID_STATE_TYPE));
        }
        int pageSize = limit == null || limit <= 0 ? DEFAULT_PAGE_SIZE : Math.min(limit, MAX_PAGE_SIZE);
        int skip = offset == null || offset < 0 ? 0 : offset;

        return accessResolver.accessibleQueues(caller, PermissionKey.RO)
            .flatMap(scope -> narrow(scope, queueId))
            .flatMap(scope -> searchRepository.find(scope, stateTypeIds, pageSize, skip)
                .collectList()
                .zipWith(searchRepository.count(scope, stateTypeIds))
                .map(page -> new TicketPage(page.getT1(), page.getT2(), pageSize, skip)));
    }

    /**
     * Valid queues the caller may read, by name.
     */
    public Flux<Queue> listQueues(CallerIdentity caller) {
        return accessResolver.accessibleQueues(caller, PermissionKey.RO)
            .flatMapMany(lookups::listQueues);
    }

    public Mono<TicketDetail> getTicket(CallerIdentity caller, long ticketId) {
        return loadReadable(caller, ticketId).flatMap(this::describe);
    }

    /**
     * Audit trail, newest first. The limit is clamped to the configured maximum.
     */
    public Mono<List<HistoryEntry>> history(CallerIdentity caller, long ticketId, Integer limit) {
        int pageSize = historyProperties.clamp(limit);
        return loadReadable(caller, ticketId)
            .flatMap(ticket -> historyRecorder.history(ticketId, pageSize).collectList());
    }

    private Mono<Ticket> loadReadable(CallerIdentity caller, long ticketId) {
        return ticketRepository.findById(ticketId)
            .switchIfEmpty(Mono.error(() -> new TicketNotFoundException(ticketId)))
            .flatMap(ticket -> accessResolver.requireTicketQueue(caller, ticket, PermissionKey.RO));
    }

    private Mono<TicketDetail> describe(Ticket ticket) {
        Mono<Optional<TicketState>> state = ticket.getStateId() == null
            ? Mono.just(Optional.empty()) : optional(stateCatalog.loadState(ticket.getStateId()));
        Mono<Optional<TicketPriority>> priority = ticket.getPriorityId() == null
            ? Mono.just(Optional.empty()) : optional(lookups.findPriority(ticket.getPriorityId()));
        Mono<Optional<Queue>> queue = ticket.getQueueId() == null
            ? Mono.just(Optional.empty()) : optional(lookups.findQueue(ticket.getQueueId()));

        return Mono.zip(state, priority, queue).map(refs -> {
            TicketState current = refs.getT1().orElse(null);
            String stateName = current == null ? "" : current.name();
            int typeId = current == null ? 0 : current.typeId();
            Instant now = pendingTimeCalculator.now();
            return new TicketDetail(
                ticket,
                current,
                refs.getT2().orElse(null),
                refs.getT3().orElse(null),
                pendingTimeCalculator.computeAutoCloseMeta(ticket, stateName, typeId, now),
                pendingTimeCalculator.computeReminderMeta(ticket, stateName, typeId, now)
            );
        });
    }

    private static Set<Integer> typeIds(Predicate<StateType> filter) {
        return Arrays.stream(StateType.values())
            .filter(filter)
            .map(StateType::id)
            .collect(Collectors.toUnmodifiableSet());
    }

    private static <T> Mono<Optional<T>> optional(Mono<T> lookup) {
        return lookup.map(Optional::of).defaultIfEmpty(Optional.empty());
    }

    private Mono<QueueScope> narrow(QueueScope scope, Long queueId) {
        if (queueId == null) {
            return Mono.just(scope);
        }
        if (!scope.permits(queueId)) {
            log.info("Ticket list for queue {} rejected, queue not in scope {}", queueId, scope);
            return Mono.error(new QueueAccessDeniedException());
        }
        return Mono.just(scope.narrowTo(queueId));
    }

    /**
     * Maps a state type filter to type ids. {@code open} covers new and open
     * tickets, {@code pending} both pending types.
     *
     * @throws IllegalArgumentException for unknown names
     */
    static Set<Integer> stateTypeIds(String stateType) {
        if (stateType == null || stateType.isBlank()) {
            return Collections.emptySet();
        }
        String value = stateType.trim().toLowerCase(Locale.ROOT).replace(' ', '_');
        switch (value) {
            case "open":
                return typeIds(StateType::isActive);
            case "pending":
                return typeIds(StateType::isPending);
            default:
                break;
        }
        if (value.chars().allMatch(Character::isDigit)) {
            StateType type = StateType.fromId(Integer.parseInt(value));
            if (type == StateType.UNKNOWN) {
                throw new IllegalArgumentException("Unknown state type id: " + value);
            }
            return Set.of(type.id());
        }
        StateType type = StateType.valueOf(value.toUpperCase(Locale.ROOT));
        if (type == StateType.UNKNOWN) {
            throw new IllegalArgumentException("Unknown state type: " + value);
        }
        return Set.of(type.id());
    }
}
