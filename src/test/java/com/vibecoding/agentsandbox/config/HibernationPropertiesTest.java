package com.vibecoding.agentsandbox.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class HibernationPropertiesTest {

    @Test
    @DisplayName("defaults are 30 minutes soft and 24 hours hard")
    void defaults() {
        HibernationProperties properties = new HibernationProperties();

        assertDoesNotThrow(properties::validateConfig);
        assertEquals(Duration.ofMinutes(30), properties.getSoftTtl());
        assertEquals(Duration.ofHours(24), properties.getHardTtl());
    }

    @Test
    @DisplayName("hard TTL must exceed soft TTL")
    void hardMustExceedSoft() {
        HibernationProperties properties = new HibernationProperties();
        properties.setSoftTtl(Duration.ofHours(2));
        properties.setHardTtl(Duration.ofHours(2));

        IllegalStateException e = assertThrows(IllegalStateException.class, properties::validateConfig);
        assertTrue(e.getMessage().contains("hard-ttl"));
    }

    @Test
    @DisplayName("soft TTL must be positive")
    void softMustBePositive() {
        HibernationProperties properties = new HibernationProperties();
        properties.setSoftTtl(Duration.ZERO);

        assertThrows(IllegalStateException.class, properties::validateConfig);
    }
}
