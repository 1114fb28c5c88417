package com.marketplace.realtime.sync;

/**
 * A short user-facing message raised by a sync consumer.
 *
 * @param recipientId user the notice is meant for
 * @param requestId   related listing request, may be {@code null}
 */
public record Notice(NoticeType type, String recipientId, String title, String description, String requestId) {
}
