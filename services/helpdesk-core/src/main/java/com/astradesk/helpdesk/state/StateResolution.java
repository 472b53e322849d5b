package com.astradesk.helpdesk.state;

import com.astradesk.helpdesk.domain.TicketState;

/**
 * Outcome of {@link StateCatalog#resolveState(String, long)}.
 *
 * @param stateId  the resolved (or fallback) state id
 * @param state    the matched state, {@code null} when the fallback was used
 * @param advisory set only when the fallback was used
 */
public record StateResolution(long stateId, TicketState state, String advisory) {

    public boolean usedFallback() {
        return advisory != null;
    }
}
