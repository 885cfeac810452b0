package com.broadcaster.broker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReconnectBackoff Tests")
class ReconnectBackoffTest {

    private static final Duration BASE = Duration.ofSeconds(1);
    private static final Duration CAP = Duration.ofSeconds(60);

    /**
     * Random that always returns the same fraction.
     */
    private static Random fixed(double value) {
        return new Random() {
            @Override
            public double nextDouble() {
                return value;
            }
        };
    }

    @ParameterizedTest(name = "attempt {0} -> {1}s")
    @CsvSource({"1, 1", "2, 2", "3, 4", "6, 32", "7, 60", "12, 60"})
    @DisplayName("Unjittered delay should double up to the cap")
    void doubling(int attempt, long expectedSeconds) {
        var backoff = new ReconnectBackoff(BASE, CAP);

        assertEquals(Duration.ofSeconds(expectedSeconds), backoff.unjitteredDelay(attempt));
    }

    @Test
    @DisplayName("Exponent should stop growing after six doublings")
    void exponentCap() {
        var backoff = new ReconnectBackoff(Duration.ofMillis(100), Duration.ofHours(1));

        assertEquals(Duration.ofMillis(6400), backoff.unjitteredDelay(7));
        assertEquals(Duration.ofMillis(6400), backoff.unjitteredDelay(20));
    }

    @Test
    @DisplayName("Jitter should scale the delay between half and one and a half")
    void jitterBounds() {
        assertEquals(Duration.ofMillis(500), new ReconnectBackoff(BASE, CAP, fixed(0.0)).nextDelay());
        assertEquals(Duration.ofMillis(1000), new ReconnectBackoff(BASE, CAP, fixed(0.5)).nextDelay());
        assertEquals(Duration.ofMillis(1499), new ReconnectBackoff(BASE, CAP, fixed(0.999)).nextDelay());

        var backoff = new ReconnectBackoff(BASE, CAP);
        for (int i = 0; i < 20; i++) {
            Duration delay = backoff.nextDelay();
            Duration nominal = backoff.unjitteredDelay(backoff.attempts());
            assertTrue(delay.toMillis() >= nominal.toMillis() / 2);
            assertTrue(delay.toMillis() <= nominal.toMillis() * 3 / 2);
        }
    }

    @Test
    @DisplayName("Reset should restart from the base delay")
    void reset() {
        var backoff = new ReconnectBackoff(BASE, CAP, fixed(0.5));
        backoff.nextDelay();
        backoff.nextDelay();
        assertEquals(Duration.ofSeconds(4), backoff.nextDelay());

        backoff.reset();

        assertEquals(0, backoff.attempts());
        assertEquals(Duration.ofSeconds(1), backoff.nextDelay());
    }

    @Test
    @DisplayName("Should reject invalid bounds")
    void invalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> new ReconnectBackoff(Duration.ZERO, CAP));
        assertThrows(IllegalArgumentException.class, () -> new ReconnectBackoff(CAP, BASE));
    }
}
