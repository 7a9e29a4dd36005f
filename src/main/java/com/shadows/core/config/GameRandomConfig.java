package com.shadows.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class GameRandomConfig {

    private static final Logger log = LoggerFactory.getLogger(GameRandomConfig.class);

    /**
     * Shared random source for generation and spawn rolls. Setting {@code shadows.random.seed}
     * makes every run reproducible.
     */
    @Bean
    public Random gameRandom(@Value("${shadows.random.seed:#{null}}") Long seed) {
        if (seed != null) {
            log.info("Using seeded random source ({})", seed);
            return new Random(seed);
        }
        return new Random();
    }
}
