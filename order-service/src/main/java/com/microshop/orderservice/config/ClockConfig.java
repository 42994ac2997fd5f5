package com.microshop.orderservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    // source of the default order date
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
