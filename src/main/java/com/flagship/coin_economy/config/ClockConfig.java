package com.flagship.coin_economy.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single time source for cap resets, refund scheduling and expiry cut-offs.
 * The zone decides where "today" starts for the daily spend cap.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${economy.zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
