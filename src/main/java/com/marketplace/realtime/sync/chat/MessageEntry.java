package com.marketplace.realtime.sync.chat;

import java.time.Instant;
import java.util.Objects;

/**
 * Either a message the store has confirmed or a local placeholder awaiting
 * confirmation. Placeholders are replaced by their confirmed message, never merged.
 */
public interface MessageEntry {

    String OPTIMISTIC_PREFIX = "optimistic-";

    String id();

    Instant createdAt();

    boolean isOptimistic();

    record Confirmed(ChatMessage message) implements MessageEntry {

        public Confirmed {
            Objects.requireNonNull(message, "message");
        }

        @Override
        public String id() {
            return message.id();
        }

        @Override
        public Instant createdAt() {
            return message.createdAt();
        }

        @Override
        public boolean isOptimistic() {
            return false;
        }
    }

    record Optimistic(String tempId, ChatDraft draft, Instant createdAt) implements MessageEntry {

        public Optimistic {
            if (tempId == null || !tempId.startsWith(OPTIMISTIC_PREFIX)) {
                throw new IllegalArgumentException("Optimistic ids must start with " + OPTIMISTIC_PREFIX);
            }
        }

        @Override
        public String id() {
            return tempId;
        }

        @Override
        public boolean isOptimistic() {
            return true;
        }
    }
}
