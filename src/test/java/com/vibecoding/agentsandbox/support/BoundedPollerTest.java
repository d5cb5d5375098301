package com.vibecoding.agentsandbox.support;

import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundedPollerTest {

    @Test
    @DisplayName("returns as soon as the check yields a value")
    void returnsFirstValue() {
        AtomicInteger calls = new AtomicInteger();
        BoundedPoller poller = BoundedPoller.linear(Duration.ofMillis(1));

        Optional<String> result = poller.poll(
            () -> calls.incrementAndGet() >= 3 ? Optional.of("done") : Optional.empty(),
            Duration.ofSeconds(5));

        assertEquals(Optional.of("done"), result);
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("gives up with empty after the timeout")
    void timesOut() {
        BoundedPoller poller = BoundedPoller.linear(Duration.ofMillis(5));

        assertTrue(poller.poll(Optional::empty, Duration.ofMillis(30)).isEmpty());
    }

    @Test
    @DisplayName("waits grow with the interval function")
    void exponentialWaits() {
        List<Long> waits = new ArrayList<>();
        AtomicInteger calls = new AtomicInteger();
        BoundedPoller poller = new BoundedPoller(
            IntervalFunction.ofExponentialBackoff(Duration.ofMillis(10), 2.0, Duration.ofMillis(40)), waits::add);

        poller.poll(() -> calls.incrementAndGet() > 4 ? Optional.of(1) : Optional.empty(), Duration.ofMinutes(1));

        assertEquals(List.of(10L, 20L, 40L, 40L), waits);
    }

    @Test
    @DisplayName("check failures propagate")
    void checkFailurePropagates() {
        BoundedPoller poller = BoundedPoller.linear(Duration.ofMillis(1));

        assertThrows(IllegalStateException.class, () -> poller.poll(() -> {
            throw new IllegalStateException("boom");
        }, Duration.ofSeconds(1)));
    }
}
