package com.marketplace.realtime.sync.chat;

public interface ChatSyncListener {

    /** A message from another participant arrived. */
    default void onNewMessage(ChatMessage message) {
    }

    default void onMessageRead(String messageId) {
    }

    default void onMessageUpdated(ChatMessage message) {
    }
}
