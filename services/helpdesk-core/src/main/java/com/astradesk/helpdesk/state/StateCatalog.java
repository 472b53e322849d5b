package com.astradesk.helpdesk.state;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.astradesk.helpdesk.domain.TicketState;
import com.astradesk.helpdesk.error.UnknownStateException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Lookup of ticket states by name, slug or id.
 *
 * <p>Reads {@code ticket_state} on every call, so renamed or newly added states
 * are picked up without a restart.</p>
 */
@Service
public class StateCatalog {

    private static final Logger log = LoggerFactory.getLogger(StateCatalog.class);

    private final TicketStateRepository repository;

    public StateCatalog(TicketStateRepository repository) {
        this.repository = repository;
    }

    /**
     * Resolves {@code requested} against the valid states. Accepts the canonical
     * name (any case), its slug ({@code pending_reminder}) or a numeric id.
     *
     * @param fallbackId state id to use when nothing matches; {@code 0} means
     *                   "no fallback" and yields {@link UnknownStateException}
     */
    public Mono<StateResolution> resolveState(String requested, long fallbackId) {
        String trimmed = requested == null ? "" : requested.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        String slug = TicketState.slugify(trimmed);
        Long numericId = parseId(trimmed);

        return repository.findAllValid()
            .filter(state -> matches(state, lower, slug, numericId))
            .next()
            .map(state -> new StateResolution(state.id(), state, null))
            .switchIfEmpty(Mono.defer(() -> fallback(trimmed, fallbackId)));
    }

    public Mono<TicketState> loadState(long id) {
        if (id <= 0) {
            return Mono.empty();
        }
        return repository.findById(id);
    }

    public Flux<TicketState> listStates() {
        return repository.findAllValid();
    }

    private Mono<StateResolution> fallback(String requested, long fallbackId) {
        if (fallbackId > 0) {
            String advisory = "State '" + requested + "' not found, using state " + fallbackId;
            log.debug(advisory);
            return Mono.just(new StateResolution(fallbackId, null, advisory));
        }
        return Mono.error(new UnknownStateException(requested));
    }

    private static boolean matches(TicketState state, String lower, String slug, Long numericId) {
        if (lower.isEmpty()) {
            return false;
        }
        if (numericId != null && state.id() == numericId) {
            return true;
        }
        String name = state.name() == null ? "" : state.name().trim().toLowerCase(Locale.ROOT);
        return name.equals(lower) || state.slug().equals(slug);
    }

    private static Long parseId(String value) {
        if (value.isEmpty() || !value.chars().allMatch(Character::isDigit)) {
            return null;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
