package com.astradesk.helpdesk.web;

import org.springframework.http.MediaType;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.astradesk.helpdesk.stats.DashboardStats;
import com.astradesk.helpdesk.stats.QueueMetrics;
import com.astradesk.helpdesk.stats.StatisticsService;

import reactor.core.publisher.Mono;

/**
 * Dashboard and queue load figures, always limited to the caller's readable queues.
 */
@RestController
@PreAuthorize("isAuthenticated()")
@RequestMapping(path = "/api/v1/statistics", produces = MediaType.APPLICATION_JSON_VALUE)
public class StatisticsController {

    private final StatisticsService statisticsService;
    private final CallerIdentityResolver callerResolver;

    public StatisticsController(StatisticsService statisticsService, CallerIdentityResolver callerResolver) {
        this.statisticsService = statisticsService;
        this.callerResolver = callerResolver;
    }

    @GetMapping("/dashboard")
    public Mono<DashboardStats> dashboard(
        @AuthenticationPrincipal Jwt jwt,
        @RequestParam(name = "queue_id", required = false) Long queueId
    ) {
        return callerResolver.caller(jwt)
            .flatMap(caller -> statisticsService.dashboard(caller, queueId));
    }

    @GetMapping("/queues")
    public Mono<QueueMetrics> queueMetrics(@AuthenticationPrincipal Jwt jwt) {
        return callerResolver.caller(jwt)
            .flatMap(statisticsService::queueMetrics);
    }
}
