package com.postboard.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * UTC clock used to stamp created_at on users, posts and notifications.
 * Tests construct services with {@link Clock#fixed} instead.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock postboardClock() {
        return Clock.systemUTC();
    }
}
