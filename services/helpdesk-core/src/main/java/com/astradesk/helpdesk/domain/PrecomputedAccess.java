package com.astradesk.helpdesk.domain;

import java.util.Set;

/**
 * Queue access computed upstream (for example carried in token claims).
 *
 * <p>An admin flag applies to every capability; a queue id set only applies to
 * the capability it was computed for.</p>
 */
public record PrecomputedAccess(boolean admin, PermissionKey capability, Set<Long> queueIds) {

    public PrecomputedAccess {
        queueIds = queueIds == null ? Set.of() : Set.copyOf(queueIds);
    }

    public static PrecomputedAccess adminBypass() {
        return new PrecomputedAccess(true, null, Set.of());
    }

    public static PrecomputedAccess forQueues(PermissionKey capability, Set<Long> queueIds) {
        return new PrecomputedAccess(false, capability, queueIds);
    }

    public boolean appliesTo(PermissionKey required) {
        return admin || capability == required;
    }
}
