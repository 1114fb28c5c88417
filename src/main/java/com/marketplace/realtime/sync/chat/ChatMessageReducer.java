package com.marketplace.realtime.sync.chat;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.Row;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pure reconciliation of the message list. Every operation returns a new,
 * {@code createdAt}-ordered list and leaves its input untouched.
 * <p>
 * Confirmed messages are keyed by server id, so a server echo and a
 * {@link #replaceOptimistic} for the same message converge on one entry
 * whichever comes first.
 */
public final class ChatMessageReducer {

    private static final Comparator<MessageEntry> DISPLAY_ORDER = Comparator
            .comparing(MessageEntry::createdAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(MessageEntry::id);

    private ChatMessageReducer() {
    }

    public static List<MessageEntry> apply(List<MessageEntry> entries, ChangeEvent event) {
        return switch (event.type()) {
            case INSERT, UPDATE -> upsert(entries, ChatMessage.fromRow(event.after()));
            case DELETE -> remove(entries, idOf(event.before()));
        };
    }

    public static List<MessageEntry> addOptimistic(List<MessageEntry> entries, MessageEntry.Optimistic entry) {
        List<MessageEntry> next = new ArrayList<>(entries);
        next.add(entry);
        return sorted(next);
    }

    public static List<MessageEntry> replaceOptimistic(List<MessageEntry> entries, String tempId, ChatMessage confirmed) {
        return upsert(remove(entries, tempId), confirmed);
    }

    public static List<MessageEntry> removeOptimistic(List<MessageEntry> entries, String tempId) {
        return remove(entries, tempId);
    }

    static List<MessageEntry> upsert(List<MessageEntry> entries, ChatMessage message) {
        List<MessageEntry> next = new ArrayList<>(entries.size() + 1);
        boolean replaced = false;
        for (MessageEntry entry : entries) {
            if (!entry.isOptimistic() && entry.id().equals(message.id())) {
                next.add(new MessageEntry.Confirmed(message));
                replaced = true;
            } else {
                next.add(entry);
            }
        }
        if (!replaced) {
            next.add(new MessageEntry.Confirmed(message));
        }
        return sorted(next);
    }

    static List<MessageEntry> remove(List<MessageEntry> entries, String id) {
        if (id == null) {
            return entries;
        }
        List<MessageEntry> next = new ArrayList<>(entries);
        next.removeIf(entry -> id.equals(entry.id()));
        return sorted(next);
    }

    private static String idOf(Row row) {
        return row != null ? row.getString("id") : null;
    }

    private static List<MessageEntry> sorted(List<MessageEntry> entries) {
        entries.sort(DISPLAY_ORDER);
        return List.copyOf(entries);
    }
}
