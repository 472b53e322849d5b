package com.astradesk.helpdesk.web;

import java.net.URI;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.astradesk.helpdesk.ticket.TicketQueryService;
import com.astradesk.helpdesk.ticket.TicketTransitionService;
import com.astradesk.helpdesk.web.dto.AddNoteRequest;
import com.astradesk.helpdesk.web.dto.AssignAgentRequest;
import com.astradesk.helpdesk.web.dto.BulkStatusRequest;
import com.astradesk.helpdesk.web.dto.BulkStatusResponse;
import com.astradesk.helpdesk.web.dto.HistoryEntryResponse;
import com.astradesk.helpdesk.web.dto.MoveQueueRequest;
import com.astradesk.helpdesk.web.dto.NoteResponse;
import com.astradesk.helpdesk.web.dto.TicketDetailResponse;
import com.astradesk.helpdesk.web.dto.TicketListResponse;
import com.astradesk.helpdesk.web.dto.TicketResponse;
import com.astradesk.helpdesk.web.dto.UpdatePriorityRequest;
import com.astradesk.helpdesk.web.dto.UpdateStatusRequest;

import jakarta.validation.Valid;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Ticket reads and transitions. Queue permissions are enforced by the services;
 * this layer only resolves the caller and shapes the payloads.
 */
@RestController
@PreAuthorize("isAuthenticated()")
@RequestMapping(path = "/api/v1/tickets", produces = MediaType.APPLICATION_JSON_VALUE)
public class TicketController {

    private final TicketQueryService queryService;
    private final TicketTransitionService transitionService;
    private final CallerIdentityResolver callerResolver;
    private final TicketMapper ticketMapper;

    public TicketController(
        TicketQueryService queryService,
        TicketTransitionService transitionService,
        CallerIdentityResolver callerResolver,
        TicketMapper ticketMapper
    ) {
        this.queryService = queryService;
        this.transitionService = transitionService;
        this.callerResolver = callerResolver;
        this.ticketMapper = ticketMapper;
    }

    @GetMapping
    public Mono<TicketListResponse> listTickets(
        @AuthenticationPrincipal Jwt jwt,
        @RequestParam(name = "queue_id", required = false) Long queueId,
        @RequestParam(name = "state_type", required = false) String stateType,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "offset", required = false) Integer offset
    ) {
        return callerResolver.caller(jwt)
            .flatMap(caller -> queryService.listTickets(caller, queueId, stateType, limit, offset))
            .map(ticketMapper::toListResponse);
    }

    @GetMapping("/{id}")
    public Mono<TicketDetailResponse> getTicket(@AuthenticationPrincipal Jwt jwt, @PathVariable long id) {
        return callerResolver.caller(jwt)
            .flatMap(caller -> queryService.getTicket(caller, id))
            .map(ticketMapper::toDetailResponse);
    }

    @GetMapping("/{id}/history")
    public Flux<HistoryEntryResponse> getHistory(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable long id,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return callerResolver.caller(jwt)
            .flatMap(caller -> queryService.history(caller, id, limit))
            .flatMapIterable(entries -> entries)
            .map(ticketMapper::toHistoryResponse);
    }

    @PutMapping(path = "/{id}/status", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TicketResponse> updateStatus(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable long id,
        @Valid @RequestBody UpdateStatusRequest request
    ) {
        return callerResolver.caller(jwt)
            .flatMap(caller -> transitionService.updateState(caller, id, request.getStatus(), request.getPendingUntil()))
            .map(ticketMapper::toResponse);
    }

    @PutMapping(path = "/{id}/priority", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TicketResponse> updatePriority(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable long id,
        @Valid @RequestBody UpdatePriorityRequest request
    ) {
        return callerResolver.caller(jwt)
            .flatMap(caller -> transitionService.updatePriority(caller, id, request.getPriorityId()))
            .map(ticketMapper::toResponse);
    }

    @PutMapping(path = "/{id}/queue", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TicketResponse> moveQueue(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable long id,
        @Valid @RequestBody MoveQueueRequest request
    ) {
        return callerResolver.caller(jwt)
            .flatMap(caller -> transitionService.moveQueue(caller, id, request.getQueueId()))
            .map(ticketMapper::toResponse);
    }

    @PutMapping(path = "/{id}/owner", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TicketResponse> assignOwner(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable long id,
        @Valid @RequestBody AssignAgentRequest request
    ) {
        return callerResolver.caller(jwt)
            .flatMap(caller -> transitionService.assignOwner(caller, id, request.getAgentId()))
            .map(ticketMapper::toResponse);
    }

    @PutMapping(path = "/{id}/responsible", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TicketResponse> assignResponsible(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable long id,
        @Valid @RequestBody AssignAgentRequest request
    ) {
        return callerResolver.caller(jwt)
            .flatMap(caller -> transitionService.assignResponsible(caller, id, request.getAgentId()))
            .map(ticketMapper::toResponse);
    }

    @PostMapping(path = "/{id}/notes", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<NoteResponse>> addNote(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable long id,
        @Valid @RequestBody AddNoteRequest request
    ) {
        return callerResolver.caller(jwt)
            .flatMap(caller -> transitionService.addNote(
                caller, id, request.getBody(), request.getNextStatus(), request.getPendingUntil()))
            .map(ticketMapper::toNoteResponse)
            .map(response -> ResponseEntity
                .created(URI.create("/api/v1/tickets/" + id + "/history"))
                .body(response));
    }

    @PostMapping(path = "/bulk/status", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<BulkStatusResponse> bulkUpdateStatus(
        @AuthenticationPrincipal Jwt jwt,
        @Valid @RequestBody BulkStatusRequest request
    ) {
        return callerResolver.caller(jwt)
            .flatMap(caller -> transitionService.bulkUpdateState(
                caller, request.getTicketIds(), request.getStatus(), request.getPendingUntil()))
            .map(BulkStatusResponse::of);
    }
}
