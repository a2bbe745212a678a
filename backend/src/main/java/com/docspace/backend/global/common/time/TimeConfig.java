package com.docspace.backend.global.common.time;

import java.time.Clock;
import java.time.ZoneOffset;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the shared UTC clock used for token expiry, session TTLs and audit timestamps.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
