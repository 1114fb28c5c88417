package com.marketplace.realtime.scheduling;

import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * {@link DelayScheduler} backed by Spring's {@link TaskScheduler}.
 */
public class TaskSchedulerDelayScheduler implements DelayScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;

    public TaskSchedulerDelayScheduler(TaskScheduler taskScheduler, Clock clock) {
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    @Override
    public ScheduledTask schedule(Runnable task, Duration delay) {
        ScheduledFuture<?> future = taskScheduler.schedule(task, clock.instant().plus(delay));
        return () -> future.cancel(false);
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
