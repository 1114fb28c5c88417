package com.marketplace.realtime.connection;

import com.marketplace.realtime.config.RealtimeProperties;
import com.marketplace.realtime.scheduling.DelayScheduler;
import com.marketplace.realtime.scheduling.ScheduledTask;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Debounced view of {@link ConnectionMonitor} for user-facing affordances: the
 * banner only shows once the connection has been down for the configured delay,
 * so short blips stay invisible.
 */
@Component
public class ConnectionBanner {

    private final DelayScheduler scheduler;
    private final Duration delay;

    private ConnectionStatus lastStatus;
    private ScheduledTask pendingShow;
    private boolean visible;

    @Autowired
    public ConnectionBanner(ConnectionMonitor monitor, DelayScheduler scheduler, RealtimeProperties properties) {
        this(monitor, scheduler, properties.getBannerDelay());
    }

    ConnectionBanner(ConnectionMonitor monitor, DelayScheduler scheduler, Duration delay) {
        this.scheduler = scheduler;
        this.delay = delay;
        this.lastStatus = monitor.status();
        monitor.addListener(this::onStatus);
    }

    synchronized void onStatus(ConnectionStatus status) {
        lastStatus = status;
        if (status.isUp()) {
            if (pendingShow != null) {
                pendingShow.cancel();
                pendingShow = null;
            }
            visible = false;
        } else if (!visible && pendingShow == null) {
            pendingShow = scheduler.schedule(this::show, delay);
        }
    }

    private synchronized void show() {
        pendingShow = null;
        if (!lastStatus.isUp()) {
            visible = true;
        }
    }

    public synchronized boolean isVisible() {
        return visible;
    }

    public synchronized boolean isReconnecting() {
        return visible && lastStatus == ConnectionStatus.RECONNECTING;
    }

    public synchronized BannerMode mode() {
        if (!visible) {
            return BannerMode.HIDDEN;
        }
        return lastStatus == ConnectionStatus.RECONNECTING ? BannerMode.RECONNECTING : BannerMode.DISCONNECTED;
    }
}
