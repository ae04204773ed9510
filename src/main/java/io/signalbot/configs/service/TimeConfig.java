package io.signalbot.configs.service;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {
    /**
     * Single time source for cooldowns, throttling and the journal.
     * Tests replace it with a controllable clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
