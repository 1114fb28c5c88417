package com.marketplace.realtime.sync.chat;

/**
 * Message the local user is about to send, shown until the store confirms it.
 */
public record ChatDraft(String requestId, String senderId, String body) {
}
