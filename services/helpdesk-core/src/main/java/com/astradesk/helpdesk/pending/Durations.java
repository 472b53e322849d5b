package com.astradesk.helpdesk.pending;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Compact human-readable durations for deadline hints.
 */
public final class Durations {

    private Durations() {
    }

    /**
     * Renders the absolute value of {@code duration}, rounded to whole seconds.
     * Hours and minutes are shown from one hour upwards, minutes and seconds
     * below: {@code "2h 5m"}, {@code "1h"}, {@code "5m 3s"}, {@code "0s"}.
     */
    public static String humanize(Duration duration) {
        long millis = Math.abs(duration.toMillis());
        long totalSeconds = (millis + 500) / 1000;
        if (totalSeconds == 0) {
            return "0s";
        }
        long hours = totalSeconds / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        long seconds = totalSeconds % 60;

        List<String> parts = new ArrayList<>(3);
        if (hours > 0) {
            parts.add(hours + "h");
        }
        if (minutes > 0) {
            parts.add(minutes + "m");
        }
        if (seconds > 0 && hours == 0) {
            parts.add(seconds + "s");
        }
        return String.join(" ", parts);
    }
}
