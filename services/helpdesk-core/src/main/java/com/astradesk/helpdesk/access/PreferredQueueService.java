package com.astradesk.helpdesk.access;

import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Service;

import reactor.core.publisher.Mono;

/**
 * Suggests the queue a new ticket for a known customer should land in.
 *
 * <p>A match on the customer user's login wins over a match on the customer
 * company id.</p>
 */
@Service
public class PreferredQueueService {

    private final PermissionStore permissionStore;

    public PreferredQueueService(PermissionStore permissionStore) {
        this.permissionStore = permissionStore;
    }

    public Mono<PreferredQueue> preferredQueue(String customerId, String customerLogin) {
        Optional<String> login = trimmed(customerLogin);
        Optional<String> company = trimmed(customerId);

        Mono<PreferredQueue> byLogin = login
            .map(value -> permissionStore.findCustomerUserGrants(identifiers(value))
                .collectList()
                .flatMap(grants -> Mono.justOrEmpty(PreferredQueueRanker.rank(grants).get(value))))
            .orElse(Mono.empty());
        Mono<PreferredQueue> byCompany = company
            .map(value -> permissionStore.findCustomerGrants(identifiers(value))
                .collectList()
                .flatMap(grants -> Mono.justOrEmpty(PreferredQueueRanker.rank(grants).get(value))))
            .orElse(Mono.empty());

        return byLogin.switchIfEmpty(byCompany);
    }

    private static Set<String> identifiers(String value) {
        return Set.of(value);
    }

    private static Optional<String> trimmed(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }
}
