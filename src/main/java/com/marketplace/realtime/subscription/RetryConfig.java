package com.marketplace.realtime.subscription;

import java.time.Duration;
import java.util.Objects;

/**
 * Reconnect policy for a subscription.
 *
 * @param maxRetries consecutive failed reconnects tolerated before giving up
 * @param baseDelay  delay before the first reconnect
 * @param maxDelay   cap applied before jitter
 */
public record RetryConfig(int maxRetries, Duration baseDelay, Duration maxDelay) {

    public static final RetryConfig DEFAULTS =
            new RetryConfig(5, Duration.ofMillis(1000), Duration.ofMillis(16000));

    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (baseDelay.isNegative() || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Expected 0 <= baseDelay <= maxDelay");
        }
    }
}
