package com.marketplace.realtime.connection;

import com.marketplace.realtime.subscription.Subscription;
import com.marketplace.realtime.subscription.SubscriptionConfig;
import com.marketplace.realtime.subscription.SubscriptionManager;
import com.marketplace.realtime.subscription.SubscriptionState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Tracks global realtime connectivity through a dedicated heartbeat channel,
 * independent of the domain channels.
 */
@Component
public class ConnectionMonitor {

    static final String CHANNEL_NAME = "connection-monitor";

    private static final Logger logger = LoggerFactory.getLogger(ConnectionMonitor.class);

    private final SubscriptionManager subscriptionManager;
    private final List<Consumer<ConnectionStatus>> listeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionStatus status = ConnectionStatus.CONNECTING;
    private Subscription heartbeat;

    public ConnectionMonitor(SubscriptionManager subscriptionManager) {
        this.subscriptionManager = subscriptionManager;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (heartbeat != null) {
            return;
        }
        logger.info("Starting connection monitor on channel {}", CHANNEL_NAME);
        heartbeat = subscriptionManager.create(SubscriptionConfig.presence(CHANNEL_NAME, this::onHeartbeatState));
    }

    @PreDestroy
    public synchronized void stop() {
        if (heartbeat != null) {
            heartbeat.unsubscribe();
            heartbeat = null;
        }
    }

    /**
     * Resets the retry budget, cancels any pending backoff and reconnects now.
     */
    public void reconnect() {
        Subscription current;
        synchronized (this) {
            current = heartbeat;
        }
        if (current == null) {
            start();
        } else {
            current.reconnect();
        }
    }

    public ConnectionStatus status() {
        return status;
    }

    public boolean isConnected() {
        return status == ConnectionStatus.CONNECTED;
    }

    public boolean isReconnecting() {
        return status == ConnectionStatus.RECONNECTING;
    }

    public synchronized int retryCount() {
        return heartbeat != null ? heartbeat.retryCount() : 0;
    }

    public void addListener(Consumer<ConnectionStatus> listener) {
        listeners.add(listener);
    }

    private void onHeartbeatState(SubscriptionState state) {
        switch (state) {
            case CONNECTING -> update(ConnectionStatus.CONNECTING);
            case SUBSCRIBED -> update(ConnectionStatus.CONNECTED);
            case RECONNECTING -> {
                if (status == ConnectionStatus.CONNECTED) {
                    update(ConnectionStatus.DISCONNECTED);
                }
                update(ConnectionStatus.RECONNECTING);
            }
            case DISCONNECTED -> update(ConnectionStatus.DISCONNECTED);
            case CLOSED -> {
                // monitor stopped
            }
        }
    }

    private void update(ConnectionStatus next) {
        ConnectionStatus previous = status;
        if (previous == next) {
            return;
        }
        status = next;
        if (next == ConnectionStatus.CONNECTED) {
            logger.info("Realtime connection established");
        } else if (next == ConnectionStatus.DISCONNECTED) {
            logger.warn("Realtime connection lost ({} -> {})", previous, next);
        } else {
            logger.debug("Realtime connection {} -> {}", previous, next);
        }
        for (Consumer<ConnectionStatus> listener : listeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException e) {
                logger.error("Connection status listener failed", e);
            }
        }
    }
}
