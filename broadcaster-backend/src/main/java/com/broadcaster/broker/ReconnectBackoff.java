package com.broadcaster.broker;

import java.time.Duration;
import java.util.Random;

/**
 * Exponential reconnect delay with jitter.
 *
 * delay(n) = min(base * 2^min(n - 1, 6), cap) * U[0.5, 1.5], where n counts attempts since
 * the last successful subscription.
 */
public final class ReconnectBackoff {
    private static final int MAX_EXPONENT = 6;

    private final Duration base;
    private final Duration cap;
    private final Random random;
    private int attempts;

    public ReconnectBackoff(Duration base, Duration cap) {
        this(base, cap, new Random());
    }

    public ReconnectBackoff(Duration base, Duration cap, Random random) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("Base delay must be positive");
        }
        if (cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("Max delay must not be below base delay");
        }
        this.base = base;
        this.cap = cap;
        this.random = random;
    }

    /**
     * Delay for the given attempt before jitter.
     */
    public Duration unjitteredDelay(int attempt) {
        int exponent = Math.min(Math.max(attempt, 1) - 1, MAX_EXPONENT);
        Duration delay = base.multipliedBy(1L << exponent);
        return delay.compareTo(cap) > 0 ? cap : delay;
    }

    /**
     * Counts one more attempt and returns its jittered delay.
     */
    public synchronized Duration nextDelay() {
        attempts++;
        double jitter = 0.5 + random.nextDouble();
        return Duration.ofMillis(Math.round(unjitteredDelay(attempts).toMillis() * jitter));
    }

    public synchronized void reset() {
        attempts = 0;
    }

    public synchronized int attempts() {
        return attempts;
    }
}
