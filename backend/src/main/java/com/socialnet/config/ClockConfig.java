package com.socialnet.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Single source of "now" for job etas, claims and schedule ticks.
 *
 * Pinned to UTC, the same zone Hibernate uses for JDBC timestamps, so a
 * {@code LocalDateTime} eta means the same instant on every host. API clients send
 * {@code scheduledAt} as UTC wall-clock time.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
