package com.marketplace.realtime.feed.local;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.Row;
import com.marketplace.realtime.model.Notification;
import com.marketplace.realtime.service.ExpirationAppliedEvent;
import com.marketplace.realtime.service.ExpiredRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.HashMap;
import java.util.Map;

/**
 * Stands in for database change capture when the local feed is active:
 * committed sweep changes are republished as row events.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.realtime", name = "feed", havingValue = "local")
public class LocalChangeCapture {

    private final LocalChangeFeed changeFeed;

    @TransactionalEventListener
    public void onExpirationApplied(ExpirationAppliedEvent event) {
        log.debug("Publishing {} request and {} notification changes from rule '{}'",
                event.requests().size(), event.notifications().size(), event.rule());
        for (ExpiredRequest request : event.requests()) {
            changeFeed.publish(ChangeEvent.update("listing_requests", before(request), after(request)));
        }
        for (Notification notification : event.notifications()) {
            changeFeed.publish(ChangeEvent.insert("notifications", row(notification)));
        }
    }

    private static Row before(ExpiredRequest request) {
        Map<String, Object> values = new HashMap<>();
        values.put("id", request.requestId());
        values.put("client_id", request.clientId());
        values.put("provider_id", request.providerId());
        values.put("status", request.previousStatus().wireValue());
        return Row.of(values);
    }

    private static Row after(ExpiredRequest request) {
        Map<String, Object> values = new HashMap<>();
        values.put("id", request.requestId());
        values.put("client_id", request.clientId());
        values.put("provider_id", request.providerId());
        values.put("status", request.newStatus().wireValue());
        values.put("provider_response", request.providerResponse());
        values.put("updated_at", request.updatedAt());
        return Row.of(values);
    }

    private static Row row(Notification notification) {
        Map<String, Object> values = new HashMap<>();
        values.put("id", String.valueOf(notification.getId()));
        values.put("user_id", notification.getUserId());
        values.put("type", notification.getType().wireValue());
        values.put("title", notification.getTitle());
        values.put("message", notification.getMessage());
        values.put("request_id", notification.getRequestId());
        values.put("actor_id", notification.getActorId());
        values.put("is_read", notification.isRead());
        values.put("created_at", notification.getCreatedAt());
        return Row.of(values);
    }
}
