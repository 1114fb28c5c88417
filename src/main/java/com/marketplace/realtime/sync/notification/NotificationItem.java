package com.marketplace.realtime.sync.notification;

import com.marketplace.realtime.feed.Row;
import com.marketplace.realtime.model.Notification;

import java.time.Instant;

public record NotificationItem(
        String id,
        String userId,
        String type,
        String title,
        String message,
        String requestId,
        String actorId,
        boolean read,
        Instant createdAt,
        Instant readAt
) {

    public static NotificationItem fromRow(Row row) {
        return new NotificationItem(
                row.getString("id"),
                row.getString("user_id"),
                row.getString("type"),
                row.getString("title"),
                row.getString("message"),
                row.getString("request_id"),
                row.getString("actor_id"),
                Boolean.TRUE.equals(row.getBoolean("is_read")),
                row.getInstant("created_at"),
                row.getInstant("read_at"));
    }

    public static NotificationItem fromEntity(Notification notification) {
        return new NotificationItem(
                String.valueOf(notification.getId()),
                notification.getUserId(),
                notification.getType() != null ? notification.getType().wireValue() : null,
                notification.getTitle(),
                notification.getMessage(),
                notification.getRequestId(),
                notification.getActorId(),
                notification.isRead(),
                notification.getCreatedAt(),
                notification.getReadAt());
    }

    NotificationItem markedRead(Instant at) {
        return new NotificationItem(id, userId, type, title, message, requestId, actorId, true, createdAt, at);
    }
}
