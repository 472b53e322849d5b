/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/helpdesk-core/src/main/java/com/astradesk/helpdesk/access/PermissionStore.java
 * Project: AstraDesk Framework — Helpdesk Core
 * Description: Reactive read access to group/queue permission grants (group_user,
 *              group_customer, group_customer_user).
 * Since: 2026-10-16
 *
 * Notes (PL):
 *  - Brak cache: każde sprawdzenie uprawnień czyta aktualny stan bazy.
 *  - Błędy bazy propagujemy dalej; interpretację (fail closed) robi QueueAccessResolver.
 */

package com.astradesk.helpdesk.access;

import java.util.Collection;
import java.util.List;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.astradesk.helpdesk.domain.PermissionKey;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Maps (user, group) to permission keys. Queues are reachable through the group
 * they belong to.
 */
@Repository
public class PermissionStore {

    private final DatabaseClient databaseClient;

    public PermissionStore(DatabaseClient databaseClient) {
        this.databaseClient = databaseClient;
    }

    /**
     * Ids of valid queues whose group grants {@code permission} (or {@code rw}) to the user.
     */
    public Flux<Long> findQueueIds(long userId, PermissionKey permission) {
        return databaseClient.sql("""
                SELECT DISTINCT q.id
                FROM queue q
                JOIN group_user gu ON gu.group_id = q.group_id
                WHERE gu.user_id = :userId
                  AND gu.permission_value = 1
                  AND q.valid_id = 1
                  AND (gu.permission_key = :permissionKey OR gu.permission_key = :rwKey)
                ORDER BY q.id
                """)
            .bind("userId", userId)
            .bind("permissionKey", permission.key())
            .bind("rwKey", PermissionKey.RW.key())
            .map((row, metadata) -> row.get("id", Long.class))
            .all();
    }

    public Mono<Boolean> isMemberOfGroup(long userId, String groupName) {
        return databaseClient.sql("""
                SELECT COUNT(*) AS memberships
                FROM group_user gu
                JOIN groups g ON g.id = gu.group_id
                WHERE gu.user_id = :userId
                  AND gu.permission_value = 1
                  AND LOWER(g.name) = LOWER(:groupName)
                """)
            .bind("userId", userId)
            .bind("groupName", groupName)
            .map((row, metadata) -> row.get("memberships", Long.class))
            .one()
            .map(count -> count != null && count > 0)
            .defaultIfEmpty(false);
    }

    /**
     * Customer company grants from {@code group_customer}.
     */
    public Flux<QueueGrant> findCustomerGrants(Collection<String> customerIds) {
        return findGrants("group_customer", "customer_id", customerIds);
    }

    /**
     * Customer user grants from {@code group_customer_user}, keyed by login.
     */
    public Flux<QueueGrant> findCustomerUserGrants(Collection<String> logins) {
        return findGrants("group_customer_user", "user_id", logins);
    }

    private Flux<QueueGrant> findGrants(String table, String identifierColumn, Collection<String> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) {
            return Flux.empty();
        }
        // table and column names are fixed by the two callers above
        String sql = """
            SELECT g.%1$s AS identifier, q.id AS queue_id, q.name AS queue_name, g.permission_key
            FROM %2$s g
            JOIN queue q ON q.group_id = g.group_id
            WHERE g.permission_value = 1
              AND q.valid_id = 1
              AND g.%1$s IN (:identifiers)
            """.formatted(identifierColumn, table);
        return databaseClient.sql(sql)
            .bind("identifiers", List.copyOf(identifiers))
            .map((row, metadata) -> new QueueGrant(
                row.get("identifier", String.class),
                row.get("queue_id", Long.class),
                row.get("queue_name", String.class),
                row.get("permission_key", String.class)
            ))
            .all();
    }
}
