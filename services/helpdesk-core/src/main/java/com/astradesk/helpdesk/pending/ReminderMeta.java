package com.astradesk.helpdesk.pending;

import java.time.Duration;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Deadline hints for pending-reminder tickets. {@code hasTime} is false when the
 * deadline shown is the default offset rather than a stored value.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ReminderMeta(
    boolean pending,
    String at,
    String atIso,
    boolean overdue,
    String relative,
    boolean hasTime,
    String message
) {

    /**
     * Message shown when the deadline is {@code offset} from now rather than stored.
     */
    public static String defaultTimeMessage(Duration offset) {
        return "Default reminder time (" + Durations.humanize(offset) + " from now)";
    }

    static ReminderMeta notPending() {
        return new ReminderMeta(false, null, null, false, null, false, null);
    }
}
