package com.fieldpulse.locationtracking.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * The clock every service reads "now" from. Its zone decides where days and
 * weeks begin for timeframes and which hour a movement falls in.
 */
@Configuration
@Slf4j
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${tracking.time-zone:UTC}") String timeZone) {
        ZoneId zone = ZoneId.of(timeZone);
        log.info("Tracking time zone: {}", zone);
        return Clock.system(zone);
    }
}
