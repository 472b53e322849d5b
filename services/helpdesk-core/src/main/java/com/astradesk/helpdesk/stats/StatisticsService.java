package com.astradesk.helpdesk.stats;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.astradesk.helpdesk.access.QueueAccessResolver;
import com.astradesk.helpdesk.access.QueueScope;
import com.astradesk.helpdesk.domain.CallerIdentity;
import com.astradesk.helpdesk.domain.PermissionKey;
import com.astradesk.helpdesk.error.QueueAccessDeniedException;
import com.astradesk.helpdesk.error.QueueNotFoundException;
import com.astradesk.helpdesk.ticket.LookupRepository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Aggregates over tickets the caller may read.
 *
 * <p>Scope resolution fails closed like everywhere else. The aggregate queries
 * themselves are best effort: a failing query yields zeros or an empty list and a
 * WARN, so one broken panel does not take the dashboard down.</p>
 */
@Service
public class StatisticsService {

    private static final Logger log = LoggerFactory.getLogger(StatisticsService.class);

    static final int RECENT_ACTIVITY_LIMIT = 10;
    static final Duration BACKLOG_AGE = Duration.ofHours(24);

    private static final Comparator<QueueStats> BUSIEST_FIRST = Comparator
        .comparingLong(QueueStats::total).reversed()
        .thenComparing(QueueStats::queueName, Comparator.nullsLast(Comparator.naturalOrder()));

    private final StatisticsRepository repository;
    private final LookupRepository lookups;
    private final QueueAccessResolver accessResolver;
    private final Clock clock;

    public StatisticsService(StatisticsRepository repository, LookupRepository lookups,
                             QueueAccessResolver accessResolver, Clock clock) {
        this.repository = repository;
        this.lookups = lookups;
        this.accessResolver = accessResolver;
        this.clock = clock;
    }

    /**
     * @param queueId optional; a queue outside the caller's scope is a 403
     */
    public Mono<DashboardStats> dashboard(CallerIdentity caller, Long queueId) {
        return accessResolver.accessibleQueues(caller, PermissionKey.RO)
            .flatMap(scope -> narrow(scope, queueId))
            .flatMap(scope -> Mono.zip(
                degrade(repository.overview(scope), DashboardStats.Overview.EMPTY, "overview"),
                degradeList(repository.countsByQueue(scope), "tickets by queue"),
                degradeList(repository.countsByPriority(scope), "tickets by priority"),
                degradeList(repository.recentActivity(scope, RECENT_ACTIVITY_LIMIT), "recent activity")
            ))
            .map(parts -> new DashboardStats(parts.getT1(), parts.getT2(), parts.getT3(), parts.getT4()));
    }

    public Mono<QueueMetrics> queueMetrics(CallerIdentity caller) {
        return accessResolver.accessibleQueues(caller, PermissionKey.RO)
            .flatMap(scope -> degradeList(repository.queueBreakdown(scope, backlogThreshold()), "queue metrics"))
            .map(queues -> queues.stream().sorted(BUSIEST_FIRST).toList())
            .map(QueueMetrics::of);
    }

    /**
     * Access is checked before existence: an unknown queue the caller has no
     * access to is a 403, not a 404.
     */
    public Mono<QueueStats> queueStats(CallerIdentity caller, long queueId) {
        return accessResolver.requireQueue(caller, queueId, PermissionKey.RO)
            .flatMap(scope -> lookups.findQueue(queueId)
                .switchIfEmpty(Mono.error(QueueNotFoundException::new))
                .flatMap(queue -> repository.queueBreakdown(scope.narrowTo(queueId), backlogThreshold())
                    .next()
                    .defaultIfEmpty(QueueStats.empty(queue.id(), queue.name()))
                    .onErrorResume(error -> {
                        log.warn("Queue statistics for queue {} unavailable: {}", queueId, error.getMessage());
                        return Mono.just(QueueStats.empty(queue.id(), queue.name()));
                    })));
    }

    private Instant backlogThreshold() {
        return clock.instant().minus(BACKLOG_AGE);
    }

    private Mono<QueueScope> narrow(QueueScope scope, Long queueId) {
        if (queueId == null) {
            return Mono.just(scope);
        }
        if (!scope.permits(queueId)) {
            return Mono.error(new QueueAccessDeniedException());
        }
        return Mono.just(scope.narrowTo(queueId));
    }

    private static <T> Mono<T> degrade(Mono<T> query, T fallback, String what) {
        return query.onErrorResume(error -> {
            log.warn("Dashboard {} query failed, reporting defaults: {}", what, error.getMessage());
            return Mono.just(fallback);
        });
    }

    private static <T> Mono<List<T>> degradeList(Flux<T> query, String what) {
        return query.collectList().onErrorResume(error -> {
            log.warn("Statistics {} query failed, reporting an empty list: {}", what, error.getMessage());
            return Mono.just(List.of());
        });
    }
}
