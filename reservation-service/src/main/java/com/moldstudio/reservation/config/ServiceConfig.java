package com.moldstudio.reservation.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

import java.time.Clock;

/**
 * Enables {@code @Retryable}. Retry advice runs outside the transaction advice,
 * so every attempt gets a fresh transaction.
 */
@Configuration
@EnableRetry
public class ServiceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
