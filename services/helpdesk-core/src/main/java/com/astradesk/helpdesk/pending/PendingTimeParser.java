package com.astradesk.helpdesk.pending;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

import com.astradesk.helpdesk.config.HelpdeskProperties;

/**
 * Parses pending deadlines as submitted by forms and API clients.
 *
 * <p>Accepted: ISO-8601 instants and offset date-times, {@code yyyy-MM-dd'T'HH:mm[:ss]},
 * {@code yyyy-MM-dd HH:mm[:ss]} and {@code yyyy-MM-dd}. Forms without an offset are
 * read in the configured zone.</p>
 */
@Component
public class PendingTimeParser {

    private static final List<DateTimeFormatter> LOCAL_DATE_TIMES = List.of(
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm[:ss]"),
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]")
    );

    private final ZoneId zone;

    public PendingTimeParser(HelpdeskProperties properties) {
        this.zone = properties.getPending().zoneId();
    }

    /**
     * @return the parsed instant, or empty for blank, malformed or non-positive input
     */
    public Optional<Instant> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        return parseInstant(value).filter(instant -> instant.getEpochSecond() > 0);
    }

    private Optional<Instant> parseInstant(String value) {
        Optional<Instant> parsed = attempt(() -> OffsetDateTime.parse(value).toInstant());
        for (DateTimeFormatter formatter : LOCAL_DATE_TIMES) {
            if (parsed.isPresent()) {
                return parsed;
            }
            parsed = attempt(() -> LocalDateTime.parse(value, formatter).atZone(zone).toInstant());
        }
        return parsed.or(() -> attempt(() -> LocalDate.parse(value).atStartOfDay(zone).toInstant()));
    }

    private static Optional<Instant> attempt(Supplier<Instant> parser) {
        try {
            return Optional.of(parser.get());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
