package com.astradesk.helpdesk.web;

import org.springframework.http.MediaType;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.astradesk.helpdesk.state.StateCatalog;
import com.astradesk.helpdesk.web.dto.TicketStateResponse;

import reactor.core.publisher.Flux;

@RestController
@PreAuthorize("isAuthenticated()")
@RequestMapping(path = "/api/v1/ticket-states", produces = MediaType.APPLICATION_JSON_VALUE)
public class TicketStateController {

    private final StateCatalog stateCatalog;
    private final TicketMapper ticketMapper;

    public TicketStateController(StateCatalog stateCatalog, TicketMapper ticketMapper) {
        this.stateCatalog = stateCatalog;
        this.ticketMapper = ticketMapper;
    }

    @GetMapping
    public Flux<TicketStateResponse> listStates() {
        return stateCatalog.listStates().map(ticketMapper::toStateResponse);
    }
}
