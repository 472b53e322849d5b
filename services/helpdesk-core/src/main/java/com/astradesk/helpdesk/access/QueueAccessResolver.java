package com.astradesk.helpdesk.access;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.astradesk.helpdesk.config.HelpdeskProperties;
import com.astradesk.helpdesk.domain.CallerIdentity;
import com.astradesk.helpdesk.domain.PermissionKey;
import com.astradesk.helpdesk.domain.PrecomputedAccess;
import com.astradesk.helpdesk.domain.Ticket;
import com.astradesk.helpdesk.error.AccessCheckFailedException;
import com.astradesk.helpdesk.error.HelpdeskException;
import com.astradesk.helpdesk.error.QueueAccessDeniedException;

import reactor.core.publisher.Mono;

/**
 * Computes which queues a caller may use for a capability and enforces explicit
 * queue checks.
 *
 * <p>Every ticket, queue and statistics read goes through
 * {@link #accessibleQueues(CallerIdentity, PermissionKey)}; every write goes
 * through {@link #requireQueue(CallerIdentity, long, PermissionKey)} or
 * {@link #requireTicketQueue(CallerIdentity, Ticket, PermissionKey)} before any
 * mutation. Store failures surface as {@link AccessCheckFailedException}; they are
 * never turned into an empty or unrestricted scope.</p>
 */
@Service
public class QueueAccessResolver {

    private static final Logger log = LoggerFactory.getLogger(QueueAccessResolver.class);

    private final PermissionStore permissionStore;
    private final HelpdeskProperties.AccessProperties properties;

    public QueueAccessResolver(PermissionStore permissionStore, HelpdeskProperties properties) {
        this.permissionStore = permissionStore;
        this.properties = properties.getAccess();
    }

    public Mono<Boolean> isAdmin(CallerIdentity caller) {
        PrecomputedAccess precomputed = caller.precomputedAccess();
        if (precomputed != null && precomputed.admin()) {
            return Mono.just(true);
        }
        if (properties.getAdminUserIds().contains(caller.userId())) {
            return Mono.just(true);
        }
        return permissionStore.isMemberOfGroup(caller.userId(), properties.getAdminGroup())
            .onErrorMap(this::isUnexpected, this::checkFailed);
    }

    public Mono<QueueScope> accessibleQueues(CallerIdentity caller, PermissionKey capability) {
        PrecomputedAccess precomputed = caller.precomputedAccess();
        if (precomputed != null && precomputed.appliesTo(capability)) {
            return Mono.just(precomputed.admin() ? QueueScope.all() : QueueScope.of(precomputed.queueIds()));
        }
        return isAdmin(caller)
            .flatMap(admin -> admin
                ? Mono.just(QueueScope.all())
                : permissionStore.findQueueIds(caller.userId(), capability)
                    .collectList()
                    .map(QueueScope::of))
            .onErrorMap(this::isUnexpected, this::checkFailed);
    }

    /**
     * Explicit single-queue check. Fails with 403 when the queue is outside the
     * caller's scope, whether or not the queue exists.
     */
    public Mono<QueueScope> requireQueue(CallerIdentity caller, long queueId, PermissionKey capability) {
        return accessibleQueues(caller, capability)
            .flatMap(scope -> {
                if (scope.permits(queueId)) {
                    return Mono.just(scope);
                }
                log.info("Denied {} on queue {} for user {}", capability.key(), queueId, caller.userId());
                return Mono.error(new QueueAccessDeniedException());
            });
    }

    public Mono<Ticket> requireTicketQueue(CallerIdentity caller, Ticket ticket, PermissionKey capability) {
        if (ticket.getQueueId() == null) {
            return Mono.error(new QueueAccessDeniedException());
        }
        return requireQueue(caller, ticket.getQueueId(), capability).thenReturn(ticket);
    }

    private boolean isUnexpected(Throwable error) {
        return !(error instanceof HelpdeskException);
    }

    private Throwable checkFailed(Throwable error) {
        log.error("Queue permission lookup failed", error);
        return new AccessCheckFailedException(error);
    }
}
