// src/test/java/com/astradesk/helpdesk/web/TicketControllerTest.java
// Testy warstwy webowej dla TicketController w usłudze Helpdesk Core.
// Sprawdzają mapowanie żądań, kody błędów i zabezpieczenia (JWT).
// Plik ten jest częścią usługi Helpdesk Core w projekcie AstraDesk.
package com.astradesk.helpdesk.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.mockJwt;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.JwtMutator;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.astradesk.helpdesk.SecurityConfig;
import com.astradesk.helpdesk.domain.CallerIdentity;
import com.astradesk.helpdesk.domain.HistoryEntry;
import com.astradesk.helpdesk.domain.Ticket;
import com.astradesk.helpdesk.error.InvalidTicketRequestException;
import com.astradesk.helpdesk.error.QueueAccessDeniedException;
import com.astradesk.helpdesk.error.TicketNotFoundException;
import com.astradesk.helpdesk.error.TicketUpdateFailedException;
import com.astradesk.helpdesk.ticket.BulkOutcome;
import com.astradesk.helpdesk.ticket.NoteResult;
import com.astradesk.helpdesk.ticket.TicketPage;
import com.astradesk.helpdesk.ticket.TicketQueryService;
import com.astradesk.helpdesk.ticket.TicketTransitionService;

import reactor.core.publisher.Mono;

/**
 * Testy warstwy webowej dla {@link TicketController}.
 *
 * Serwisy są mockowane; weryfikujemy kontrakt HTTP: kody statusu, kształt
 * odpowiedzi błędów oraz rozpoznanie wywołującego z tokena JWT.
 */
@WebFluxTest(controllers = TicketController.class)
@Import({SecurityConfig.class, CallerIdentityResolver.class, TicketMapper.class})
@DisplayName("Ticket Controller Tests")
class TicketControllerTest {

    @Autowired
    private WebTestClient webClient;

    @MockBean
    private TicketQueryService queryService;

    @MockBean
    private TicketTransitionService transitionService;

    @MockBean
    private ReactiveJwtDecoder jwtDecoder;

    private static JwtMutator agent() {
        return mockJwt().jwt(jwt -> jwt.subject("agent").claim("uid", 7).claim("preferred_username", "agent"));
    }

    private static Ticket ticket(long stateId) {
        Ticket ticket = new Ticket(42L, "2026031010000042", "VPN does not connect", 10L, stateId, 3L);
        ticket.setChangedBy(7L);
        ticket.setChangedAt(Instant.parse("2026-03-10T12:00:00Z"));
        return ticket;
    }

    @Nested
    @DisplayName("Endpoint PUT /api/v1/tickets/{id}/status")
    class UpdateStatusTests {

        @Test
        @DisplayName("Powinien zmienić status i zwrócić zgłoszenie")
        void shouldUpdateStatus() {
            // Given
            when(transitionService.updateState(any(), eq(42L), eq("closed successful"), isNull()))
                .thenReturn(Mono.just(ticket(2L)));

            // When & Then
            webClient.mutateWith(agent())
                .put().uri("/api/v1/tickets/42/status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "closed successful"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo(42)
                .jsonPath("$.state_id").isEqualTo(2)
                .jsonPath("$.changed_by").isEqualTo(7);

            ArgumentCaptor<CallerIdentity> caller = ArgumentCaptor.forClass(CallerIdentity.class);
            verify(transitionService).updateState(caller.capture(), eq(42L), eq("closed successful"), isNull());
            assertThat(caller.getValue().userId()).isEqualTo(7L);
            assertThat(caller.getValue().login()).isEqualTo("agent");
        }

        @Test
        @DisplayName("Powinien przekazać pending_until z JSON w snake_case")
        void shouldPassPendingUntil() {
            when(transitionService.updateState(any(), eq(42L), eq("pending reminder"), eq("2026-03-11T09:00:00Z")))
                .thenReturn(Mono.just(ticket(6L)));

            webClient.mutateWith(agent())
                .put().uri("/api/v1/tickets/42/status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "pending reminder", "pending_until", "2026-03-11T09:00:00Z"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.state_id").isEqualTo(6);
        }

        @Test
        @DisplayName("Powinien zwrócić 400 z powodem z walidacji serwisu")
        void shouldReturnBadRequestWithReason() {
            when(transitionService.updateState(any(), eq(42L), eq("pending reminder"), isNull()))
                .thenReturn(Mono.error(new InvalidTicketRequestException("pending_until is required for pending states")));

            webClient.mutateWith(agent())
                .put().uri("/api/v1/tickets/42/status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "pending reminder"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("pending_until is required for pending states")
                .jsonPath("$.status").isEqualTo(400);
        }

        @Test
        @DisplayName("Powinien zwrócić 403 z ogólnym komunikatem")
        void shouldReturnForbidden() {
            when(transitionService.updateState(any(), eq(42L), eq("open"), isNull()))
                .thenReturn(Mono.error(new QueueAccessDeniedException()));

            webClient.mutateWith(agent())
                .put().uri("/api/v1/tickets/42/status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "open"))
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.error").isEqualTo(QueueAccessDeniedException.REASON);
        }

        @Test
        @DisplayName("Powinien zwrócić 500 bez szczegółów błędu bazy")
        void shouldReturnServerErrorOnWriteFailure() {
            when(transitionService.updateState(any(), eq(42L), eq("open"), isNull()))
                .thenReturn(Mono.error(new TicketUpdateFailedException("Failed to update ticket status",
                    new IllegalStateException("duplicate key on ticket_pkey"))));

            webClient.mutateWith(agent())
                .put().uri("/api/v1/tickets/42/status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "open"))
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Failed to update ticket status");
        }

        @Test
        @DisplayName("Powinien zwrócić 400 dla niepoprawnego JSON")
        void shouldRejectMalformedJson() {
            webClient.mutateWith(agent())
                .put().uri("/api/v1/tickets/42/status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"status\": ")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid request");

            verifyNoInteractions(transitionService);
        }

        @Test
        @DisplayName("Powinien zwrócić status 401 dla nieuwierzytelnionego użytkownika")
        void shouldReturnUnauthorizedWithoutToken() {
            webClient.put().uri("/api/v1/tickets/42/status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "open"))
                .exchange()
                .expectStatus().isUnauthorized();

            verifyNoInteractions(transitionService);
        }

        @Test
        @DisplayName("Powinien zwrócić 401, gdy token nie identyfikuje agenta")
        void shouldReturnUnauthorizedWithoutAgentId() {
            webClient.mutateWith(mockJwt().jwt(jwt -> jwt.subject("service-account")))
                .put().uri("/api/v1/tickets/42/status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "open"))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Authentication required");

            verifyNoInteractions(transitionService);
        }
    }

    @Nested
    @DisplayName("Endpointy odczytu")
    class ReadTests {

        @Test
        @DisplayName("Powinien zwrócić 404 dla nieistniejącego zgłoszenia")
        void shouldReturnNotFound() {
            when(queryService.getTicket(any(), eq(99L))).thenReturn(Mono.error(new TicketNotFoundException(99L)));

            webClient.mutateWith(agent())
                .get().uri("/api/v1/tickets/99")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo(TicketNotFoundException.REASON)
                .jsonPath("$.status").isEqualTo(404);
        }

        @Test
        @DisplayName("Powinien przekazać filtry listy i zwrócić stronę")
        void shouldListTickets() {
            when(queryService.listTickets(any(), eq(10L), eq("open"), eq(5), isNull()))
                .thenReturn(Mono.just(new TicketPage(List.of(), 0, 5, 0)));

            webClient.mutateWith(agent())
                .get().uri("/api/v1/tickets?queue_id=10&state_type=open&limit=5")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total").isEqualTo(0)
                .jsonPath("$.limit").isEqualTo(5)
                .jsonPath("$.tickets").isArray();
        }

        @Test
        @DisplayName("Powinien zwrócić historię od najnowszych wpisów")
        void shouldReturnHistory() {
            HistoryEntry entry = new HistoryEntry(900L, 42L, "StateUpdate", "State changed from open to closed",
                10L, 5L, 3L, 2L, null, 7L, Instant.parse("2026-03-10T12:00:00Z"));
            when(queryService.history(any(), eq(42L), isNull())).thenReturn(Mono.just(List.of(entry)));

            webClient.mutateWith(agent())
                .get().uri("/api/v1/tickets/42/history")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo(900)
                .jsonPath("$[0].message").isEqualTo("State changed from open to closed");
        }
    }

    @Nested
    @DisplayName("Notatki i zmiany zbiorcze")
    class WriteTests {

        @Test
        @DisplayName("Powinien utworzyć notatkę i zwrócić 201")
        void shouldCreateNote() {
            when(transitionService.addNote(any(), eq(42L), eq("Called the customer"), isNull(), isNull()))
                .thenReturn(Mono.just(new NoteResult(77L, ticket(4L))));

            webClient.mutateWith(agent())
                .post().uri("/api/v1/tickets/42/notes")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("body", "Called the customer"))
                .exchange()
                .expectStatus().isCreated()
                .expectHeader().valueEquals("Location", "/api/v1/tickets/42/history")
                .expectBody()
                .jsonPath("$.article_id").isEqualTo(77)
                .jsonPath("$.ticket.id").isEqualTo(42);
        }

        @Test
        @DisplayName("Powinien raportować wynik zmiany zbiorczej per zgłoszenie")
        void shouldReportBulkOutcomes() {
            when(transitionService.bulkUpdateState(any(), eq(List.of(42L, 43L)), eq("closed successful"), isNull()))
                .thenReturn(Mono.just(List.of(
                    BulkOutcome.succeeded(42L),
                    BulkOutcome.failed(43L, 403, QueueAccessDeniedException.REASON))));

            webClient.mutateWith(agent())
                .post().uri("/api/v1/tickets/bulk/status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("ticket_ids", List.of(42, 43), "status", "closed successful"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.succeeded").isEqualTo(1)
                .jsonPath("$.failed").isEqualTo(1)
                .jsonPath("$.results[1].status").isEqualTo(403)
                .jsonPath("$.results[0].error").doesNotExist();
        }

        @Test
        @DisplayName("Powinien odrzucić zbyt dużą listę zgłoszeń walidacją")
        void shouldRejectOversizedBulk() {
            List<Long> ids = new ArrayList<>();
            for (long id = 1; id <= 501; id++) {
                ids.add(id);
            }

            webClient.mutateWith(agent())
                .post().uri("/api/v1/tickets/bulk/status")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("ticket_ids", ids, "status", "open"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("ticketIds at most 500 tickets per request");

            verify(transitionService, never())
                .bulkUpdateState(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Powinien zmienić właściciela")
        void shouldAssignOwner() {
            Ticket updated = ticket(4L);
            updated.setOwnerId(9L);
            when(transitionService.assignOwner(any(), eq(42L), eq(9L))).thenReturn(Mono.just(updated));

            webClient.mutateWith(agent())
                .put().uri("/api/v1/tickets/42/owner")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("agent_id", 9))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.owner_id").isEqualTo(9);

            verify(transitionService).assignOwner(any(), anyLong(), eq(9L));
        }
    }
}
