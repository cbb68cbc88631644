package com.airlinesim.payment.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * Randomness and time sources shared by the gateway stub.
 * Tests construct the components directly with a seeded {@link Random} and a fixed {@link Clock}.
 */
@Configuration
public class RandomSourceConfiguration {

    @Bean
    public Random paymentRandom() {
        return new SecureRandom();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
