package com.astradesk.helpdesk.web;

import org.springframework.http.MediaType;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.astradesk.helpdesk.access.PreferredQueue;
import com.astradesk.helpdesk.access.PreferredQueueService;
import com.astradesk.helpdesk.error.InvalidTicketRequestException;
import com.astradesk.helpdesk.error.QueueNotFoundException;
import com.astradesk.helpdesk.stats.QueueStats;
import com.astradesk.helpdesk.stats.StatisticsService;
import com.astradesk.helpdesk.ticket.TicketQueryService;
import com.astradesk.helpdesk.web.dto.QueueResponse;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@PreAuthorize("isAuthenticated()")
@RequestMapping(path = "/api/v1/queues", produces = MediaType.APPLICATION_JSON_VALUE)
public class QueueController {

    static final String CUSTOMER_REQUIRED = "customer_id or customer_login is required";

    private final TicketQueryService queryService;
    private final StatisticsService statisticsService;
    private final PreferredQueueService preferredQueueService;
    private final CallerIdentityResolver callerResolver;
    private final TicketMapper ticketMapper;

    public QueueController(
        TicketQueryService queryService,
        StatisticsService statisticsService,
        PreferredQueueService preferredQueueService,
        CallerIdentityResolver callerResolver,
        TicketMapper ticketMapper
    ) {
        this.queryService = queryService;
        this.statisticsService = statisticsService;
        this.preferredQueueService = preferredQueueService;
        this.callerResolver = callerResolver;
        this.ticketMapper = ticketMapper;
    }

    @GetMapping
    public Flux<QueueResponse> listQueues(@AuthenticationPrincipal Jwt jwt) {
        return callerResolver.caller(jwt)
            .flatMapMany(queryService::listQueues)
            .map(ticketMapper::toQueueResponse);
    }

    @GetMapping("/{id}/stats")
    public Mono<QueueStats> queueStats(@AuthenticationPrincipal Jwt jwt, @PathVariable long id) {
        return callerResolver.caller(jwt)
            .flatMap(caller -> statisticsService.queueStats(caller, id));
    }

    /**
     * Queue a new ticket for this customer should go to, based on customer group
     * grants. A match on the login wins over a match on the company.
     */
    @GetMapping("/preferred")
    public Mono<PreferredQueue> preferredQueue(
        @AuthenticationPrincipal Jwt jwt,
        @RequestParam(name = "customer_id", required = false) String customerId,
        @RequestParam(name = "customer_login", required = false) String customerLogin
    ) {
        if (isBlank(customerId) && isBlank(customerLogin)) {
            return Mono.error(new InvalidTicketRequestException(CUSTOMER_REQUIRED));
        }
        return callerResolver.caller(jwt)
            .flatMap(caller -> preferredQueueService.preferredQueue(customerId, customerLogin))
            .switchIfEmpty(Mono.error(QueueNotFoundException::new));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
