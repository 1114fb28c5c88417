package com.marketplace.realtime.scheduling;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Manually advanced {@link DelayScheduler}. Tasks run on the calling thread of
 * {@link #advance(Duration)} in due order.
 */
public class VirtualDelayScheduler implements DelayScheduler {

    private final PriorityQueue<VirtualTask> queue = new PriorityQueue<>(
            Comparator.comparing((VirtualTask task) -> task.dueAt).thenComparingLong(task -> task.sequence));
    private final List<Duration> requestedDelays = new ArrayList<>();
    private Instant now;
    private long sequence;

    public VirtualDelayScheduler() {
        this(Instant.parse("2024-01-01T00:00:00Z"));
    }

    public VirtualDelayScheduler(Instant start) {
        this.now = start;
    }

    @Override
    public synchronized ScheduledTask schedule(Runnable task, Duration delay) {
        requestedDelays.add(delay);
        VirtualTask scheduled = new VirtualTask(task, now.plus(delay), sequence++);
        queue.add(scheduled);
        return () -> scheduled.cancelled = true;
    }

    @Override
    public synchronized Instant now() {
        return now;
    }

    public void advance(Duration duration) {
        Instant target;
        synchronized (this) {
            target = now.plus(duration);
        }
        while (true) {
            VirtualTask next;
            synchronized (this) {
                next = queue.peek();
                if (next == null || next.dueAt.isAfter(target)) {
                    now = target;
                    return;
                }
                queue.poll();
                now = next.dueAt;
            }
            if (!next.cancelled) {
                next.task.run();
            }
        }
    }

    /**
     * Runs every pending task, however far in the future.
     */
    public void runAll() {
        advance(Duration.ofDays(365));
    }

    public synchronized int pendingCount() {
        return (int) queue.stream().filter(task -> !task.cancelled).count();
    }

    public synchronized List<Duration> requestedDelays() {
        return List.copyOf(requestedDelays);
    }

    private static final class VirtualTask {
        private final Runnable task;
        private final Instant dueAt;
        private final long sequence;
        private volatile boolean cancelled;

        private VirtualTask(Runnable task, Instant dueAt, long sequence) {
            this.task = task;
            this.dueAt = dueAt;
            this.sequence = sequence;
        }
    }
}
