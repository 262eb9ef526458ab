package com.leadnurture.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Every component that needs "now" takes this Clock, so day and hour windows,
 * quotas, backoff and session expiry can all be driven with virtual time in tests.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(NurtureProperties properties) {
        return Clock.system(properties.getZone());
    }
}
