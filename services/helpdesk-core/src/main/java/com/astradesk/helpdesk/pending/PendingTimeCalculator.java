package com.astradesk.helpdesk.pending;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import org.springframework.stereotype.Component;

import com.astradesk.helpdesk.config.HelpdeskProperties;
import com.astradesk.helpdesk.domain.Ticket;
import com.astradesk.helpdesk.domain.TicketState;

/**
 * Effective pending deadlines and the metadata shown next to them.
 *
 * <p>Nothing here is scheduled: overdue is evaluated at read time against the
 * injected {@link Clock}.</p>
 */
@Component
public class PendingTimeCalculator {

    private static final DateTimeFormatter DISPLAY =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_OFFSET_DATE_TIME.withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final Duration defaultOffset;
    private final String defaultTimeMessage;

    public PendingTimeCalculator(Clock clock, HelpdeskProperties properties) {
        this.clock = clock;
        this.defaultOffset = properties.getPending().getDefaultOffset();
        this.defaultTimeMessage = ReminderMeta.defaultTimeMessage(defaultOffset);
    }

    public Instant effectivePendingTime(long storedEpochSeconds) {
        return effectivePendingTime(storedEpochSeconds, clock.instant());
    }

    /**
     * Stored deadline when set, otherwise {@code now} plus the default offset.
     */
    public Instant effectivePendingTime(long storedEpochSeconds, Instant now) {
        if (storedEpochSeconds > 0) {
            return Instant.ofEpochSecond(storedEpochSeconds);
        }
        return now.plus(defaultOffset);
    }

    public Instant now() {
        return clock.instant();
    }

    public AutoCloseMeta computeAutoCloseMeta(Ticket ticket, String stateName, int stateTypeId, Instant now) {
        boolean pending = new TicketState(0L, stateName, stateTypeId).isPendingAuto();
        if (ticket == null || (!pending && !ticket.hasPendingTime())) {
            return new AutoCloseMeta(pending, null, null, false, null);
        }
        Instant at = effectivePendingTime(ticket.getUntilTime(), now);
        Duration diff = Duration.between(now, at);
        return new AutoCloseMeta(pending, DISPLAY.format(at), ISO.format(at), diff.isNegative(), Durations.humanize(diff));
    }

    public ReminderMeta computeReminderMeta(Ticket ticket, String stateName, int stateTypeId, Instant now) {
        if (ticket == null) {
            return ReminderMeta.notPending();
        }
        boolean pending = new TicketState(0L, stateName, stateTypeId).isPendingReminder();
        if (!pending && !ticket.hasPendingTime()) {
            return new ReminderMeta(pending, null, null, false, null, false, null);
        }
        Instant at = effectivePendingTime(ticket.getUntilTime(), now);
        Duration diff = Duration.between(now, at);
        boolean hasTime = ticket.hasPendingTime();
        return new ReminderMeta(
            pending,
            DISPLAY.format(at),
            ISO.format(at),
            diff.isNegative(),
            Durations.humanize(diff),
            hasTime,
            hasTime ? null : defaultTimeMessage
        );
    }
}
