package com.vibecoding.agentsandbox.service;

import io.fabric8.kubernetes.api.model.EnvFromSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SecretComposerTest {

    private final SecretComposer composer = new SecretComposer();

    @Test
    @DisplayName("every subset of user secrets keeps slot order and puts the platform secret last")
    void everySubsetKeepsOrder() {
        for (int mask = 0; mask < 32; mask++) {
            List<String> slots = new ArrayList<>();
            List<String> expected = new ArrayList<>();
            for (int slot = 0; slot < 5; slot++) {
                if ((mask & (1 << slot)) != 0) {
                    slots.add("user-" + (slot + 1));
                    expected.add("user-" + (slot + 1));
                } else {
                    slots.add(null);
                }
            }

            List<EnvFromSource> sources = composer.compose(slots, "aws-access-token");

            assertEquals(expected.size() + 1, sources.size(), "mask " + mask);
            for (int i = 0; i < expected.size(); i++) {
                assertEquals(expected.get(i), sources.get(i).getSecretRef().getName());
                assertTrue(sources.get(i).getSecretRef().getOptional());
            }
            EnvFromSource platform = sources.get(sources.size() - 1);
            assertEquals("aws-access-token", platform.getSecretRef().getName());
            assertFalse(platform.getSecretRef().getOptional());
        }
    }

    @Test
    @DisplayName("secret1 and secret3 set produce db, llm, platform")
    void secretOneAndThree() {
        List<EnvFromSource> sources = composer.compose(
            Arrays.asList("db", null, "llm", null, null), "platform-secret");

        assertEquals(3, sources.size());
        assertEquals("db", sources.get(0).getSecretRef().getName());
        assertEquals("llm", sources.get(1).getSecretRef().getName());
        assertEquals("platform-secret", sources.get(2).getSecretRef().getName());
        assertTrue(sources.get(0).getSecretRef().getOptional());
        assertTrue(sources.get(1).getSecretRef().getOptional());
        assertFalse(sources.get(2).getSecretRef().getOptional());
    }

    @Test
    @DisplayName("blank slots are treated as unset")
    void blankSlotsSkipped() {
        List<EnvFromSource> sources = composer.compose(Arrays.asList("", "  ", "api", null, ""), "platform");

        assertEquals(2, sources.size());
        assertEquals("api", sources.get(0).getSecretRef().getName());
    }

    @Test
    @DisplayName("output is identical for identical input")
    void deterministic() {
        List<String> slots = Arrays.asList("a", "b", null, "d", null);
        assertEquals(composer.compose(slots, "p"), composer.compose(slots, "p"));
    }

    @Test
    @DisplayName("blank platform secret is rejected")
    void blankPlatformRejected() {
        assertThrows(IllegalArgumentException.class, () -> composer.compose(List.of(), " "));
        assertThrows(IllegalArgumentException.class, () -> composer.compose(List.of(), null));
    }

    @Test
    @DisplayName("more than five user slots are rejected")
    void tooManySlotsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> composer.compose(List.of("1", "2", "3", "4", "5", "6"), "platform"));
    }
}
