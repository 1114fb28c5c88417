package com.marketplace.realtime.scheduling;

import java.time.Duration;
import java.time.Instant;

/**
 * Timer abstraction used for reconnect backoff and UI debouncing, so tests can
 * drive time explicitly.
 */
public interface DelayScheduler {

    ScheduledTask schedule(Runnable task, Duration delay);

    Instant now();
}
