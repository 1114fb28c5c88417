package com.marketplace.realtime.sync.chat;

import com.marketplace.realtime.feed.Row;

import java.time.Instant;

/**
 * A chat message as stored in {@code chat_messages}.
 */
public record ChatMessage(
        String id,
        String requestId,
        String senderId,
        String body,
        Instant createdAt,
        boolean read,
        Instant readAt
) {

    public static ChatMessage fromRow(Row row) {
        return new ChatMessage(
                row.getString("id"),
                row.getString("request_id"),
                row.getString("sender_id"),
                row.getString("message"),
                row.getInstant("created_at"),
                Boolean.TRUE.equals(row.getBoolean("is_read")),
                row.getInstant("read_at"));
    }
}
