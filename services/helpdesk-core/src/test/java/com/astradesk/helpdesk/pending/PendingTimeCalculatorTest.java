package com.astradesk.helpdesk.pending;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.astradesk.helpdesk.config.HelpdeskProperties;
import com.astradesk.helpdesk.domain.Ticket;

@DisplayName("PendingTimeCalculator")
class PendingTimeCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private PendingTimeCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new PendingTimeCalculator(Clock.fixed(NOW, ZoneOffset.UTC), new HelpdeskProperties());
    }

    private static Ticket ticketUntil(Instant until) {
        Ticket ticket = new Ticket(42L, "2026031010000042", "VPN", 10L, 7L, 3L);
        ticket.setUntilTime(until == null ? 0 : until.getEpochSecond());
        return ticket;
    }

    @Test
    @DisplayName("Brak zapisanego terminu oznacza teraz + 24h")
    void defaultsToNowPlusOffset() {
        assertThat(calculator.effectivePendingTime(0)).isEqualTo(NOW.plus(Duration.ofHours(24)));
        assertThat(calculator.effectivePendingTime(-5, NOW)).isEqualTo(NOW.plus(Duration.ofHours(24)));
    }

    @Test
    @DisplayName("Zapisany termin jest zwracany bez zmian")
    void storedDeadlineWins() {
        long stored = Instant.parse("2026-03-01T08:30:00Z").getEpochSecond();

        assertThat(calculator.effectivePendingTime(stored)).isEqualTo(Instant.ofEpochSecond(stored));
    }

    @Test
    @DisplayName("Skonfigurowany offset zastępuje domyślne 24h")
    void honoursConfiguredOffset() {
        HelpdeskProperties properties = new HelpdeskProperties();
        properties.getPending().setDefaultOffset(Duration.ofHours(2));
        PendingTimeCalculator custom = new PendingTimeCalculator(Clock.fixed(NOW, ZoneOffset.UTC), properties);

        assertThat(custom.effectivePendingTime(0)).isEqualTo(NOW.plus(Duration.ofHours(2)));
    }

    @Test
    @DisplayName("Domyślny termin jest liczony od chwili wywołania")
    void defaultMovesWithTheClock() {
        MutableClock clock = new MutableClock(NOW);
        PendingTimeCalculator moving = new PendingTimeCalculator(clock, new HelpdeskProperties());

        Instant first = moving.effectivePendingTime(0);
        clock.advance(Duration.ofMinutes(90));
        Instant second = moving.effectivePendingTime(0);

        assertThat(second).isNotEqualTo(first);
        assertThat(first).isEqualTo(NOW.plus(Duration.ofHours(24)));
        assertThat(second).isEqualTo(NOW.plus(Duration.ofMinutes(90)).plus(Duration.ofHours(24)));
    }

    @Test
    @DisplayName("Komunikat domyślnego przypomnienia podaje skonfigurowany offset")
    void defaultReminderMessageFollowsOffset() {
        HelpdeskProperties properties = new HelpdeskProperties();
        properties.getPending().setDefaultOffset(Duration.ofHours(2));
        PendingTimeCalculator custom = new PendingTimeCalculator(Clock.fixed(NOW, ZoneOffset.UTC), properties);

        ReminderMeta meta = custom.computeReminderMeta(ticketUntil(null), "pending reminder", 4, NOW);

        assertThat(meta.message()).isEqualTo("Default reminder time (2h from now)");
        assertThat(meta.at()).isEqualTo("2026-03-10 14:00:00 UTC");
    }

    @Nested
    @DisplayName("Auto-zamknięcie")
    class AutoClose {

        @Test
        @DisplayName("Termin godzinę temu: oczekujące, przeterminowane, '1h'")
        void overdueByOneHour() {
            Ticket ticket = ticketUntil(NOW.minus(Duration.ofHours(1)));

            AutoCloseMeta meta = calculator.computeAutoCloseMeta(ticket, "pending auto close+", 5, NOW);

            assertThat(meta.pending()).isTrue();
            assertThat(meta.overdue()).isTrue();
            assertThat(meta.relative()).isEqualTo("1h");
            assertThat(meta.at()).isEqualTo("2026-03-10 11:00:00 UTC");
            assertThat(meta.atIso()).isEqualTo("2026-03-10T11:00:00Z");
        }

        @Test
        @DisplayName("Nazwa stanu wystarcza, gdy typ jest inny")
        void detectsPendingByName() {
            AutoCloseMeta meta = calculator.computeAutoCloseMeta(ticketUntil(null), "Pending-Auto Close-", 2, NOW);

            assertThat(meta.pending()).isTrue();
            assertThat(meta.overdue()).isFalse();
            assertThat(meta.at()).isEqualTo("2026-03-11 12:00:00 UTC");
            assertThat(meta.relative()).isEqualTo("24h");
        }

        @Test
        @DisplayName("Stan nieoczekujący bez terminu nie ma żadnych pól czasu")
        void notPendingWithoutDeadline() {
            AutoCloseMeta meta = calculator.computeAutoCloseMeta(ticketUntil(null), "open", 2, NOW);

            assertThat(meta).isEqualTo(new AutoCloseMeta(false, null, null, false, null));
        }

        @Test
        @DisplayName("Stan nieoczekujący z terminem nadal pokazuje termin")
        void notPendingButDeadlineKept() {
            AutoCloseMeta meta = calculator.computeAutoCloseMeta(
                ticketUntil(NOW.plus(Duration.ofMinutes(5))), "open", 2, NOW);

            assertThat(meta.pending()).isFalse();
            assertThat(meta.relative()).isEqualTo("5m");
        }
    }

    @Nested
    @DisplayName("Przypomnienie")
    class Reminder {

        @Test
        @DisplayName("Bez zapisanego terminu: domyślny termin i komunikat")
        void defaultReminderTime() {
            ReminderMeta meta = calculator.computeReminderMeta(ticketUntil(null), "pending reminder", 4, NOW);

            assertThat(meta.pending()).isTrue();
            assertThat(meta.hasTime()).isFalse();
            assertThat(meta.message()).isEqualTo("Default reminder time (24h from now)");
            assertThat(meta.at()).isEqualTo("2026-03-11 12:00:00 UTC");
            assertThat(meta.overdue()).isFalse();
        }

        @Test
        @DisplayName("Zapisany termin w przyszłości: bez komunikatu")
        void storedReminderTime() {
            ReminderMeta meta = calculator.computeReminderMeta(
                ticketUntil(NOW.plus(Duration.ofMinutes(90))), "pending reminder", 4, NOW);

            assertThat(meta.hasTime()).isTrue();
            assertThat(meta.message()).isNull();
            assertThat(meta.relative()).isEqualTo("1h 30m");
        }

        @Test
        @DisplayName("Brak zgłoszenia daje pusty wynik")
        void nullTicket() {
            ReminderMeta meta = calculator.computeReminderMeta(null, "pending reminder", 4, NOW);

            assertThat(meta.pending()).isFalse();
            assertThat(meta.at()).isNull();
        }
    }

    private static final class MutableClock extends Clock {

        private Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
