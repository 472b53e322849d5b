package com.astradesk.helpdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.astradesk.helpdesk.config.HelpdeskProperties;

/**
 * Spring Boot entry point for the AstraDesk helpdesk core service.
 *
 * <p>The application exposes a reactive API for queue-scoped ticket reads, state
 * and assignment transitions with an audit trail, and dashboard statistics.</p>
 */
@SpringBootApplication
@EnableConfigurationProperties(HelpdeskProperties.class)
public class HelpdeskApp {

    public static void main(String[] args) {
        SpringApplication.run(HelpdeskApp.class, args);
    }
}
