package com.astradesk.helpdesk.domain;

/**
 * Classification of a ticket state, stored as {@code ticket_state.type_id}.
 *
 * <p>Pending semantics are driven by the type, not by the state's display name.
 * Type ids outside the known set map to {@link #UNKNOWN}.</p>
 */
public enum StateType {
    UNKNOWN(0),
    NEW(1),
    OPEN(2),
    CLOSED(3),
    PENDING_REMINDER(4),
    PENDING_AUTO(5),
    REMOVED(6),
    MERGED(7);

    private final int id;

    StateType(int id) {
        this.id = id;
    }

    public int id() {
        return id;
    }

    public boolean isPending() {
        return this == PENDING_AUTO || this == PENDING_REMINDER;
    }

    public boolean isActive() {
        return this == NEW || this == OPEN;
    }

    public static StateType fromId(int typeId) {
        for (StateType type : values()) {
            if (type.id == typeId) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
