package com.marketplace.realtime.scheduling;

/**
 * Handle to a delayed task.
 */
public interface ScheduledTask {

    /**
     * Cancels the task if it has not started yet. Safe to call more than once.
     */
    void cancel();
}
