package com.shadows.core.config;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GameRandomConfigTest {

    @Test
    void seededSourceIsReproducible() {
        var config = new GameRandomConfig();
        Random first = config.gameRandom(99L);
        Random second = config.gameRandom(99L);

        for (int i = 0; i < 5; i++) {
            assertEquals(first.nextInt(), second.nextInt());
        }
    }

    @Test
    void unseededSourceIsCreated() {
        assertNotNull(new GameRandomConfig().gameRandom(null));
    }
}
