package com.marketplace.realtime.sync.chat;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.RowFilter;
import com.marketplace.realtime.subscription.Subscription;
import com.marketplace.realtime.subscription.SubscriptionConfig;
import com.marketplace.realtime.subscription.SubscriptionManager;
import com.marketplace.realtime.subscription.SubscriptionState;
import com.marketplace.realtime.sync.QueryKey;
import com.marketplace.realtime.sync.SyncContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Live message list of one request's chat, merging server events with the
 * local user's optimistic placeholders.
 */
@Slf4j
public class ChatSync implements AutoCloseable {

    public static final String TABLE = "chat_messages";

    private final String requestId;
    private final SyncContext context;
    private final ChatSyncListener listener;
    private final Clock clock;
    private final QueryKey queryKey;

    private List<MessageEntry> entries = List.of();
    private final Subscription subscription;

    public ChatSync(SubscriptionManager subscriptionManager,
                    SyncContext context,
                    Clock clock,
                    String requestId,
                    ChatSyncListener listener) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.context = context;
        this.clock = clock;
        this.listener = listener != null ? listener : new ChatSyncListener() { };
        this.queryKey = QueryKey.of(TABLE, requestId);
        this.subscription = subscriptionManager.create(SubscriptionConfig.builder()
                .channelName("chat-messages-" + requestId)
                .table(TABLE)
                .filter(RowFilter.eq("request_id", requestId))
                .onInsert(this::onInsert)
                .onUpdate(this::onUpdate)
                .onDelete(this::onDelete)
                .build());
    }

    /**
     * Shows {@code draft} right away under a temporary id.
     *
     * @return the temporary id to pass to {@link #replaceOptimisticMessage} or {@link #removeOptimisticMessage}
     */
    public String addOptimisticMessage(ChatDraft draft) {
        String tempId = MessageEntry.OPTIMISTIC_PREFIX + UUID.randomUUID();
        synchronized (this) {
            entries = ChatMessageReducer.addOptimistic(entries,
                    new MessageEntry.Optimistic(tempId, draft, clock.instant()));
        }
        return tempId;
    }

    public void replaceOptimisticMessage(String tempId, ChatMessage confirmed) {
        synchronized (this) {
            entries = ChatMessageReducer.replaceOptimistic(entries, tempId, confirmed);
        }
    }

    /**
     * Drops a placeholder whose send failed.
     */
    public void removeOptimisticMessage(String tempId) {
        synchronized (this) {
            entries = ChatMessageReducer.removeOptimistic(entries, tempId);
        }
    }

    public synchronized List<MessageEntry> messages() {
        return entries;
    }

    public SubscriptionState state() {
        return subscription.state();
    }

    @Override
    public void close() {
        subscription.unsubscribe();
    }

    private void onInsert(ChangeEvent event) {
        ChatMessage message = ChatMessage.fromRow(event.after());
        reduce(event);
        context.queryCache().refetchActive(queryKey);
        if (!Objects.equals(message.senderId(), context.currentUser().currentUserId())) {
            listener.onNewMessage(message);
        }
    }

    private void onUpdate(ChangeEvent event) {
        ChatMessage message = ChatMessage.fromRow(event.after());
        reduce(event);
        context.queryCache().invalidate(queryKey);
        boolean wasUnread = event.before() != null && Boolean.FALSE.equals(event.before().getBoolean("is_read"));
        if (wasUnread && message.read()) {
            log.debug("Message {} in request {} marked read", message.id(), requestId);
            listener.onMessageRead(message.id());
        } else {
            listener.onMessageUpdated(message);
        }
    }

    private void onDelete(ChangeEvent event) {
        reduce(event);
        context.queryCache().invalidate(queryKey);
    }

    private synchronized void reduce(ChangeEvent event) {
        entries = ChatMessageReducer.apply(entries, event);
    }
}
