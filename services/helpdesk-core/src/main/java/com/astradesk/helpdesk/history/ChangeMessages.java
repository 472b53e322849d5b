package com.astradesk.helpdesk.history;

import java.util.Objects;

/**
 * Builders for the one-line history messages shown in the ticket audit trail.
 */
public final class ChangeMessages {

    private ChangeMessages() {
    }

    /**
     * {@code "<Field> changed from <old> to <new>"}, or an empty string when the
     * trimmed values are equal. A blank old value renders as {@code -}.
     */
    public static String changeMessage(String field, String oldValue, String newValue) {
        String before = Objects.requireNonNullElse(oldValue, "").trim();
        String after = Objects.requireNonNullElse(newValue, "").trim();
        if (before.equals(after)) {
            return "";
        }
        return String.format("%s changed from %s to %s", field, before.isEmpty() ? "-" : before, after);
    }

    /**
     * {@code "<id> <name>"}, the label used for priorities in history lines.
     */
    public static String labelled(Long id, String name) {
        if (id == null) {
            return Objects.requireNonNullElse(name, "");
        }
        if (name == null || name.isBlank()) {
            return String.valueOf(id);
        }
        return id + " " + name.trim();
    }
}
