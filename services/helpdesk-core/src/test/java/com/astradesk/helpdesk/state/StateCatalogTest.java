package com.astradesk.helpdesk.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.astradesk.helpdesk.domain.TicketState;
import com.astradesk.helpdesk.error.UnknownStateException;

import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

@DisplayName("StateCatalog")
class StateCatalogTest {

    private static final TicketState NEW = new TicketState(1L, "new", 1);
    private static final TicketState OPEN = new TicketState(4L, "open", 2);
    private static final TicketState PENDING_REMINDER = new TicketState(6L, "Pending Reminder", 4);

    private TicketStateRepository repository;
    private StateCatalog catalog;

    @BeforeEach
    void setUp() {
        repository = mock(TicketStateRepository.class);
        when(repository.findAllValid()).thenReturn(Flux.just(NEW, OPEN, PENDING_REMINDER));
        catalog = new StateCatalog(repository);
    }

    @Test
    @DisplayName("Nazwa kanoniczna pasuje bez względu na wielkość liter")
    void matchesNameCaseInsensitively() {
        StepVerifier.create(catalog.resolveState("PENDING reminder", 0))
            .assertNext(resolution -> {
                assertThat(resolution.stateId()).isEqualTo(6L);
                assertThat(resolution.state()).isEqualTo(PENDING_REMINDER);
                assertThat(resolution.usedFallback()).isFalse();
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Slug pasuje do nazwy ze spacjami")
    void matchesSlug() {
        StepVerifier.create(catalog.resolveState("pending_reminder", 0))
            .assertNext(resolution -> assertThat(resolution.stateId()).isEqualTo(6L))
            .verifyComplete();
    }

    @Test
    @DisplayName("Identyfikator liczbowy pasuje do id stanu")
    void matchesNumericId() {
        StepVerifier.create(catalog.resolveState(" 4 ", 0))
            .assertNext(resolution -> assertThat(resolution.state()).isEqualTo(OPEN))
            .verifyComplete();
    }

    @Test
    @DisplayName("Nieznany stan bez fallbacku kończy się błędem 'unknown status'")
    void unknownWithoutFallbackFails() {
        StepVerifier.create(catalog.resolveState("on hold", 0))
            .expectErrorSatisfies(error -> assertThat(error)
                .isInstanceOf(UnknownStateException.class)
                .hasMessage(UnknownStateException.REASON))
            .verify();
    }

    @Test
    @DisplayName("Nieznany stan z fallbackiem zwraca fallback z komunikatem")
    void unknownWithFallbackUsesIt() {
        StepVerifier.create(catalog.resolveState("on hold", 4))
            .assertNext(resolution -> {
                assertThat(resolution.stateId()).isEqualTo(4L);
                assertThat(resolution.state()).isNull();
                assertThat(resolution.usedFallback()).isTrue();
                assertThat(resolution.advisory()).contains("on hold");
            })
            .verifyComplete();
    }

    @Test
    @DisplayName("Pusty tekst nigdy nie pasuje")
    void blankNeverMatches() {
        StepVerifier.create(catalog.resolveState("  ", 0))
            .expectError(UnknownStateException.class)
            .verify();
    }

    @Test
    @DisplayName("loadState dla id <= 0 nie pyta bazy")
    void loadStateSkipsNonPositiveIds() {
        StepVerifier.create(catalog.loadState(0))
            .verifyComplete();

        verify(repository, never()).findById(anyLong());
    }
}
