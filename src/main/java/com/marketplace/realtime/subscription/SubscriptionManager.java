package com.marketplace.realtime.subscription;

import com.marketplace.realtime.config.RealtimeProperties;
import com.marketplace.realtime.feed.ChangeFeed;
import com.marketplace.realtime.scheduling.DelayScheduler;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Creates {@link Subscription}s on the configured {@link ChangeFeed} and keeps
 * track of the ones still open.
 */
@Component
public class SubscriptionManager {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionManager.class);

    private final ChangeFeed changeFeed;
    private final DelayScheduler scheduler;
    private final MeterRegistry meterRegistry;
    private final RetryConfig defaultRetryConfig;
    private final DoubleSupplier jitterSource;

    private final Set<Subscription> active = ConcurrentHashMap.newKeySet();

    @Autowired
    public SubscriptionManager(ChangeFeed changeFeed,
                               DelayScheduler scheduler,
                               MeterRegistry meterRegistry,
                               RealtimeProperties properties) {
        this(changeFeed, scheduler, meterRegistry, properties.getRetry().toRetryConfig(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public SubscriptionManager(ChangeFeed changeFeed,
                               DelayScheduler scheduler,
                               MeterRegistry meterRegistry,
                               RetryConfig defaultRetryConfig,
                               DoubleSupplier jitterSource) {
        this.changeFeed = changeFeed;
        this.scheduler = scheduler;
        this.meterRegistry = meterRegistry;
        this.defaultRetryConfig = defaultRetryConfig;
        this.jitterSource = jitterSource;
    }

    public Subscription create(SubscriptionConfig config) {
        return create(config, defaultRetryConfig);
    }

    /**
     * Opens the channel described by {@code config}. Connection problems never
     * surface as exceptions, only through {@code onStateChange}.
     */
    public Subscription create(SubscriptionConfig config, RetryConfig retryConfig) {
        String table = config.getTable() != null ? config.getTable() : "presence";
        Counter retries = Counter.builder("realtime.subscription.retries")
                .description("Reconnect attempts scheduled after a channel failure")
                .tag("table", table)
                .register(meterRegistry);
        Counter exhausted = Counter.builder("realtime.subscription.exhausted")
                .description("Subscriptions that gave up after the retry budget")
                .tag("table", table)
                .register(meterRegistry);

        Subscription subscription = new Subscription(config, changeFeed, scheduler,
                new RetryBackoff(retryConfig, jitterSource), retries, exhausted, active::remove);
        active.add(subscription);
        logger.debug("Subscribing to channel {} (table={}, filter={})",
                config.getChannelName(), config.getTable(), config.getFilter());
        subscription.start();
        return subscription;
    }

    public List<Subscription> activeSubscriptions() {
        return List.copyOf(active);
    }

    public RetryConfig defaultRetryConfig() {
        return defaultRetryConfig;
    }

    @PreDestroy
    public void closeAll() {
        if (!active.isEmpty()) {
            logger.info("Closing {} open subscriptions", active.size());
        }
        for (Subscription subscription : List.copyOf(active)) {
            subscription.unsubscribe();
        }
    }
}
