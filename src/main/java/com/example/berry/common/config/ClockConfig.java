package com.example.berry.common.config;

import com.example.berry.common.util.MonotonicClock;
import com.example.berry.common.util.SystemMonotonicClock;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    @Bean
    public MonotonicClock monotonicClock() {
        return new SystemMonotonicClock();
    }

    /**
     * Wall clock, only used for timestamps that are persisted.
     */
    @Bean
    public Clock wallClock() {
        return Clock.systemDefaultZone();
    }
}
