package com.astradesk.helpdesk.domain;

import java.util.Locale;

/**
 * A row of {@code ticket_state}.
 */
public record TicketState(long id, String name, int typeId) {

    public StateType type() {
        return StateType.fromId(typeId);
    }

    /**
     * Type id first, then the hyphen-insensitive name for rows migrated without a
     * correct type id. Either signal is sufficient.
     */
    public boolean isPendingAuto() {
        return type() == StateType.PENDING_AUTO || normalizedName().contains("pending auto");
    }

    public boolean isPendingReminder() {
        return type() == StateType.PENDING_REMINDER || normalizedName().contains("pending reminder");
    }

    public boolean isPending() {
        return isPendingAuto() || isPendingReminder();
    }

    /**
     * Lowercase, spaces replaced by underscores: {@code "Pending Reminder"} becomes
     * {@code "pending_reminder"}.
     */
    public String slug() {
        return slugify(name);
    }

    private String normalizedName() {
        return normalize(name);
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.toLowerCase(Locale.ROOT).replace('-', ' ');
    }

    public static String slugify(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
    }
}
