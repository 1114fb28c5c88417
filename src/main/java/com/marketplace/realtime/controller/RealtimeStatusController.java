package com.marketplace.realtime.controller;

import com.marketplace.realtime.connection.ConnectionBanner;
import com.marketplace.realtime.connection.ConnectionMonitor;
import com.marketplace.realtime.subscription.Subscription;
import com.marketplace.realtime.subscription.SubscriptionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Internal view of realtime connectivity for operators.
 */
@Slf4j
@RestController
@RequestMapping("/api/internal/realtime")
@RequiredArgsConstructor
public class RealtimeStatusController {

    private final ConnectionMonitor connectionMonitor;
    private final ConnectionBanner connectionBanner;
    private final SubscriptionManager subscriptionManager;

    @GetMapping("/connection")
    public ResponseEntity<Map<String, Object>> connection() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", connectionMonitor.status());
        body.put("connected", connectionMonitor.isConnected());
        body.put("reconnecting", connectionMonitor.isReconnecting());
        body.put("retryCount", connectionMonitor.retryCount());
        body.put("banner", connectionBanner.mode());

        List<Map<String, Object>> channels = subscriptionManager.activeSubscriptions().stream()
                .map(RealtimeStatusController::describe)
                .toList();
        body.put("channels", channels);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/reconnect")
    public ResponseEntity<Map<String, Object>> reconnect() {
        try {
            log.info("🔄 Manual realtime reconnect requested");
            connectionMonitor.reconnect();
            return ResponseEntity.ok(Map.of("status", connectionMonitor.status()));
        } catch (Exception e) {
            log.error("❌ Manual reconnect failed", e);
            return ResponseEntity.status(500).body(Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private static Map<String, Object> describe(Subscription subscription) {
        Map<String, Object> channel = new LinkedHashMap<>();
        channel.put("name", subscription.channelName());
        channel.put("state", subscription.state());
        channel.put("retryCount", subscription.retryCount());
        return channel;
    }
}
