package com.customerapi.customer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TimeConfig {

    /**
     * UTC clock for ages, date-of-birth checks and audit timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
