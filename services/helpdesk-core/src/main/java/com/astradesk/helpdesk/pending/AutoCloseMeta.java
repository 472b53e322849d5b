package com.astradesk.helpdesk.pending;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Deadline hints for tickets in (or carrying a deadline from) a pending-auto state.
 * {@code at}, {@code atIso} and {@code relative} are {@code null} when no
 * deadline applies.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AutoCloseMeta(boolean pending, String at, String atIso, boolean overdue, String relative) {
}
