package com.astradesk.helpdesk.domain;

/**
 * History types written to {@code ticket_history}. Names match the
 * {@code ticket_history_type.name} column.
 */
public enum HistoryType {
    STATE_UPDATE("StateUpdate"),
    PRIORITY_UPDATE("PriorityUpdate"),
    QUEUE_MOVE("Move"),
    OWNER_UPDATE("OwnerUpdate"),
    RESPONSIBLE_UPDATE("ResponsibleUpdate"),
    SET_PENDING_TIME("SetPendingTime"),
    ADD_NOTE("AddNote");

    private final String typeName;

    HistoryType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }
}
