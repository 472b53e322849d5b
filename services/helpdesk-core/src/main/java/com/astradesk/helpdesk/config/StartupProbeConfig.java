package com.astradesk.helpdesk.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import com.astradesk.helpdesk.ticket.TicketRepository;

/**
 * Counts tickets once at startup and logs the result.
 */
@Configuration
@Profile("!test")
public class StartupProbeConfig {

    private static final Logger log = LoggerFactory.getLogger(StartupProbeConfig.class);

    @Bean
    public ApplicationRunner databaseProbe(TicketRepository repository) {
        return args -> repository.count()
            .subscribe(
                count -> log.info("Helpdesk core started. Existing ticket count: {}", count),
                error -> log.warn("Startup database probe failed: {}", error.getMessage())
            );
    }
}
