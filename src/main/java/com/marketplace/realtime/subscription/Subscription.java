package com.marketplace.realtime.subscription;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.ChangeFeed;
import com.marketplace.realtime.feed.ChannelHandle;
import com.marketplace.realtime.feed.ChannelListener;
import com.marketplace.realtime.feed.ChannelStatus;
import com.marketplace.realtime.scheduling.DelayScheduler;
import com.marketplace.realtime.scheduling.ScheduledTask;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * A self-healing channel subscription.
 * <p>
 * Delivery, status handling, retry timers and teardown all run under one lock.
 * Every (re)subscribe opens a new channel generation; signals from an older
 * generation are dropped, so nothing reaches the callbacks once
 * {@link #unsubscribe()} has returned.
 */
public class Subscription {

    private static final Logger logger = LoggerFactory.getLogger(Subscription.class);

    private final SubscriptionConfig config;
    private final ChangeFeed feed;
    private final DelayScheduler scheduler;
    private final RetryBackoff backoff;
    private final Counter retryCounter;
    private final Counter exhaustedCounter;
    private final Consumer<Subscription> onRelease;

    private final ReentrantLock lock = new ReentrantLock();

    private SubscriptionState state;
    private ChannelHandle channel;
    private ScheduledTask retryTask;
    private long generation;
    private int attempt;
    private boolean unsubscribed;

    Subscription(SubscriptionConfig config,
                 ChangeFeed feed,
                 DelayScheduler scheduler,
                 RetryBackoff backoff,
                 Counter retryCounter,
                 Counter exhaustedCounter,
                 Consumer<Subscription> onRelease) {
        this.config = config;
        this.feed = feed;
        this.scheduler = scheduler;
        this.backoff = backoff;
        this.retryCounter = retryCounter;
        this.exhaustedCounter = exhaustedCounter;
        this.onRelease = onRelease;
    }

    void start() {
        lock.lock();
        try {
            changeState(SubscriptionState.CONNECTING);
            connect();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the channel and cancels any pending reconnect. Idempotent.
     */
    public void unsubscribe() {
        lock.lock();
        try {
            if (unsubscribed) {
                return;
            }
            unsubscribed = true;
            cancelRetry();
            releaseChannel();
            state = SubscriptionState.CLOSED;
            logger.debug("Unsubscribed from channel {}", config.getChannelName());
        } finally {
            lock.unlock();
        }
        onRelease.accept(this);
    }

    /**
     * Drops the current channel and subscribes again right away with a fresh
     * retry budget. Works from any state except {@link SubscriptionState#CLOSED}.
     */
    public void reconnect() {
        lock.lock();
        try {
            if (unsubscribed) {
                return;
            }
            logger.info("Manual reconnect of channel {}", config.getChannelName());
            cancelRetry();
            releaseChannel();
            attempt = 0;
            changeState(SubscriptionState.CONNECTING);
            connect();
        } finally {
            lock.unlock();
        }
    }

    public SubscriptionState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Consecutive failed attempts since the last successful subscribe or delivered event.
     */
    public int retryCount() {
        lock.lock();
        try {
            return attempt;
        } finally {
            lock.unlock();
        }
    }

    public String channelName() {
        return config.getChannelName();
    }

    public boolean isUnsubscribed() {
        lock.lock();
        try {
            return unsubscribed;
        } finally {
            lock.unlock();
        }
    }

    // lock held
    private void connect() {
        if (unsubscribed) {
            return;
        }
        long current = ++generation;
        ChannelHandle handle;
        try {
            handle = feed.subscribe(config.toChannelRequest(), new GenerationListener(current));
        } catch (RuntimeException e) {
            logger.warn("Failed to open channel {} (attempt {}): {}",
                    config.getChannelName(), attempt, e.getMessage());
            scheduleRetry();
            return;
        }
        if (current == generation && !unsubscribed) {
            channel = handle;
        } else {
            // superseded while subscribing, e.g. by a synchronous failure and unsubscribe
            handle.close();
        }
    }

    // lock held
    private void handleStatus(ChannelStatus status, Throwable cause) {
        switch (status) {
            case SUBSCRIBED -> {
                attempt = 0;
                logger.info("Channel {} subscribed", config.getChannelName());
                changeState(SubscriptionState.SUBSCRIBED);
            }
            case CHANNEL_ERROR, TIMED_OUT -> {
                logger.warn("Channel {} reported {} (attempt {}){}", config.getChannelName(), status, attempt,
                        cause != null ? ": " + cause.getMessage() : "");
                scheduleRetry();
            }
            case CLOSED -> {
                logger.warn("Channel {} closed unexpectedly (attempt {})", config.getChannelName(), attempt);
                scheduleRetry();
            }
        }
    }

    // lock held
    private void scheduleRetry() {
        if (retryTask != null) {
            return;
        }
        RetryConfig retryConfig = backoff.config();
        if (attempt >= retryConfig.maxRetries()) {
            logger.error("Channel {} gave up after {} retries", config.getChannelName(), attempt);
            exhaustedCounter.increment();
            releaseChannel();
            changeState(SubscriptionState.DISCONNECTED);
            return;
        }
        Duration delay = backoff.delay(attempt);
        attempt++;
        retryCounter.increment();
        logger.info("Reconnecting channel {} in {} ms (retry {}/{})",
                config.getChannelName(), delay.toMillis(), attempt, retryConfig.maxRetries());
        changeState(SubscriptionState.RECONNECTING);
        retryTask = scheduler.schedule(this::retry, delay);
    }

    private void retry() {
        lock.lock();
        try {
            retryTask = null;
            if (unsubscribed) {
                return;
            }
            releaseChannel();
            connect();
        } finally {
            lock.unlock();
        }
    }

    // lock held
    private void cancelRetry() {
        if (retryTask != null) {
            retryTask.cancel();
            retryTask = null;
        }
    }

    // lock held
    private void releaseChannel() {
        generation++;
        if (channel != null) {
            ChannelHandle handle = channel;
            channel = null;
            try {
                handle.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing channel {}: {}", config.getChannelName(), e.getMessage());
            }
        }
    }

    // lock held
    private void changeState(SubscriptionState next) {
        if (state == next) {
            return;
        }
        state = next;
        invoke("onStateChange", () -> config.getOnStateChange().accept(next));
    }

    // lock held
    private void dispatch(ChangeEvent event) {
        attempt = 0;
        switch (event.type()) {
            case INSERT -> invoke("onInsert", () -> config.getOnInsert().accept(event));
            case UPDATE -> invoke("onUpdate", () -> config.getOnUpdate().accept(event));
            case DELETE -> invoke("onDelete", () -> config.getOnDelete().accept(event));
        }
        invoke("onChange", () -> config.getOnChange().accept(event));
    }

    private void invoke(String callback, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.error("Callback {} failed on channel {}", callback, config.getChannelName(), e);
        }
    }

    private final class GenerationListener implements ChannelListener {

        private final long owner;

        private GenerationListener(long owner) {
            this.owner = owner;
        }

        @Override
        public void onEvent(ChangeEvent event) {
            lock.lock();
            try {
                if (isCurrent()) {
                    dispatch(event);
                }
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void onStatus(ChannelStatus status, Throwable cause) {
            lock.lock();
            try {
                if (isCurrent()) {
                    handleStatus(status, cause);
                }
            } finally {
                lock.unlock();
            }
        }

        private boolean isCurrent() {
            return !unsubscribed && owner == generation;
        }
    }
}
