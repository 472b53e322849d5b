package com.astradesk.helpdesk.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Application-wide beans that don't belong to a specific feature.
 *
 * <p>All "now" comparisons (pending deadlines, change timestamps, history rows)
 * go through this clock so they can be pinned in tests.</p>
 */
@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
