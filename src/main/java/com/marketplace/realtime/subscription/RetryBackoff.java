package com.marketplace.realtime.subscription;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with ±25% jitter:
 * {@code min(baseDelay * 2^attempt, maxDelay)} scaled by a factor in [0.75, 1.25].
 */
public class RetryBackoff {

    static final double JITTER_RATIO = 0.25;

    private final RetryConfig config;
    private final DoubleSupplier random;

    public RetryBackoff(RetryConfig config) {
        this(config, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param random source of values in [0, 1)
     */
    public RetryBackoff(RetryConfig config, DoubleSupplier random) {
        this.config = config;
        this.random = random;
    }

    /**
     * Delay for the given attempt before jitter is applied.
     */
    public Duration baseDelay(int attempt) {
        long base = config.baseDelay().toMillis();
        long max = config.maxDelay().toMillis();
        if (attempt >= 62 || base == 0) {
            return Duration.ofMillis(base == 0 ? 0 : max);
        }
        long factor = 1L << attempt;
        long exponential = base > max / factor ? max : base * factor;
        return Duration.ofMillis(Math.min(exponential, max));
    }

    public Duration delay(int attempt) {
        long base = baseDelay(attempt).toMillis();
        double jitter = base * JITTER_RATIO * (random.getAsDouble() * 2 - 1);
        return Duration.ofMillis(Math.round(base + jitter));
    }

    public RetryConfig config() {
        return config;
    }
}
