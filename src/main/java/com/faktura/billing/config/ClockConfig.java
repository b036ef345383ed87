package com.faktura.billing.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Business-day clock used by the scheduled jobs.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${faktura.time-zone:Europe/Berlin}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
