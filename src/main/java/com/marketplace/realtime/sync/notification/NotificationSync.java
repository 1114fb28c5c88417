package com.marketplace.realtime.sync.notification;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.ChangeEventType;
import com.marketplace.realtime.feed.RowFilter;
import com.marketplace.realtime.repository.NotificationRepository;
import com.marketplace.realtime.subscription.Subscription;
import com.marketplace.realtime.subscription.SubscriptionConfig;
import com.marketplace.realtime.subscription.SubscriptionManager;
import com.marketplace.realtime.sync.QueryKey;
import com.marketplace.realtime.sync.SyncContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * The signed-in user's latest notifications with optimistic read marks.
 */
@Slf4j
public class NotificationSync implements AutoCloseable {

    public static final String TABLE = "notifications";
    static final int PAGE_SIZE = 50;

    private static final Comparator<NotificationItem> NEWEST_FIRST = Comparator
            .comparing(NotificationItem::createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final String userId;
    private final SyncContext context;
    private final NotificationRepository repository;
    private final Clock clock;
    private final Consumer<NotificationItem> onNotification;
    private final QueryKey queryKey;

    private final Map<String, NotificationItem> items = new LinkedHashMap<>();
    private final Set<String> optimisticReadIds = new HashSet<>();

    private final Subscription subscription;

    public NotificationSync(SubscriptionManager subscriptionManager,
                            SyncContext context,
                            NotificationRepository repository,
                            Clock clock,
                            Consumer<NotificationItem> onNotification) {
        this.userId = context.requireUserId();
        this.context = context;
        this.repository = repository;
        this.clock = clock;
        this.onNotification = onNotification != null ? onNotification : item -> { };
        this.queryKey = QueryKey.of(TABLE, userId);
        refetch();
        this.subscription = subscriptionManager.create(SubscriptionConfig.builder()
                .channelName(TABLE + ":" + userId)
                .table(TABLE)
                .filter(RowFilter.eq("user_id", userId))
                .events(EnumSet.of(ChangeEventType.INSERT, ChangeEventType.UPDATE))
                .onInsert(this::onInsert)
                .onUpdate(this::onUpdate)
                .build());
    }

    public void refetch() {
        try {
            List<NotificationItem> latest = repository.findTop50ByUserIdOrderByCreatedAtDesc(userId).stream()
                    .map(NotificationItem::fromEntity)
                    .collect(Collectors.toList());
            synchronized (this) {
                items.clear();
                latest.forEach(item -> items.put(item.id(), item));
            }
        } catch (DataAccessException e) {
            log.error("Failed to load notifications for user {}", userId, e);
        }
    }

    /**
     * Notifications newest first, with optimistic read marks applied.
     */
    public synchronized List<NotificationItem> notifications() {
        return items.values().stream()
                .map(item -> !item.read() && optimisticReadIds.contains(item.id()) ? item.markedRead(null) : item)
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    public synchronized long unreadCount() {
        return items.values().stream()
                .filter(item -> !item.read() && !optimisticReadIds.contains(item.id()))
                .count();
    }

    /**
     * Counts the notification as read right away, then writes the flag.
     *
     * @return {@code false} if the write failed and the mark was discarded
     */
    public boolean markAsRead(String notificationId) {
        synchronized (this) {
            optimisticReadIds.add(notificationId);
        }
        Instant now = clock.instant();
        boolean written;
        try {
            written = repository.markAsRead(UUID.fromString(notificationId), userId, now) > 0;
        } catch (DataAccessException | IllegalArgumentException e) {
            log.warn("Could not mark notification {} as read: {}", notificationId, e.getMessage());
            written = false;
        }
        synchronized (this) {
            optimisticReadIds.remove(notificationId);
            if (written) {
                items.computeIfPresent(notificationId, (id, item) -> item.markedRead(now));
            }
        }
        context.queryCache().invalidate(queryKey);
        return written;
    }

    public boolean markAllAsRead() {
        Set<String> marked;
        synchronized (this) {
            marked = items.values().stream()
                    .filter(item -> !item.read())
                    .map(NotificationItem::id)
                    .collect(Collectors.toSet());
            optimisticReadIds.addAll(marked);
        }
        Instant now = clock.instant();
        boolean written;
        try {
            repository.markAllAsRead(userId, now);
            written = true;
        } catch (DataAccessException e) {
            log.warn("Could not mark notifications of user {} as read: {}", userId, e.getMessage());
            written = false;
        }
        synchronized (this) {
            optimisticReadIds.removeAll(marked);
            if (written) {
                marked.forEach(id -> items.computeIfPresent(id, (key, item) -> item.markedRead(now)));
            }
        }
        context.queryCache().invalidate(queryKey);
        return written;
    }

    @Override
    public void close() {
        subscription.unsubscribe();
    }

    void onInsert(ChangeEvent event) {
        NotificationItem item = NotificationItem.fromRow(event.after());
        synchronized (this) {
            items.put(item.id(), item);
            trim();
        }
        context.queryCache().refetchActive(queryKey);
        onNotification.accept(item);
    }

    void onUpdate(ChangeEvent event) {
        NotificationItem item = NotificationItem.fromRow(event.after());
        synchronized (this) {
            if (items.containsKey(item.id())) {
                items.put(item.id(), item);
            }
            if (item.read()) {
                optimisticReadIds.remove(item.id());
            }
        }
        context.queryCache().invalidate(queryKey);
    }

    // lock held
    private void trim() {
        if (items.size() <= PAGE_SIZE) {
            return;
        }
        List<NotificationItem> kept = items.values().stream()
                .sorted(NEWEST_FIRST)
                .limit(PAGE_SIZE)
                .collect(Collectors.toList());
        items.clear();
        kept.forEach(item -> items.put(item.id(), item));
    }
}
