package com.marketplace.realtime.sync.notification;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.Row;
import com.marketplace.realtime.feed.local.LocalChangeFeed;
import com.marketplace.realtime.model.Notification;
import com.marketplace.realtime.model.NotificationType;
import com.marketplace.realtime.repository.NotificationRepository;
import com.marketplace.realtime.scheduling.VirtualDelayScheduler;
import com.marketplace.realtime.subscription.RetryConfig;
import com.marketplace.realtime.subscription.SubscriptionManager;
import com.marketplace.realtime.sync.CurrentUserProvider;
import com.marketplace.realtime.sync.NoticeDispatcher;
import com.marketplace.realtime.sync.QueryCache;
import com.marketplace.realtime.sync.QueryKey;
import com.marketplace.realtime.sync.SyncContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationSync Tests")
class NotificationSyncTest {

    private static final String USER = "user-1";
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final UUID FIRST = UUID.fromString("00000000-0000-0000-0000-000000000001");
    private static final UUID SECOND = UUID.fromString("00000000-0000-0000-0000-000000000002");

    @Mock
    private QueryCache queryCache;

    @Mock
    private NoticeDispatcher notices;

    @Mock
    private NotificationRepository repository;

    private LocalChangeFeed feed;
    private SubscriptionManager manager;
    private SyncContext context;
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        feed = new LocalChangeFeed();
        manager = new SubscriptionManager(feed, new VirtualDelayScheduler(),
                new SimpleMeterRegistry(), RetryConfig.DEFAULTS, () -> 0.5);
        context = new SyncContext(CurrentUserProvider.of(USER), queryCache, notices);
    }

    private static Notification stored(UUID id, Instant createdAt) {
        return Notification.builder()
                .id(id)
                .userId(USER)
                .type(NotificationType.REQUEST_ACCEPTED)
                .title("Accepted")
                .message("Your request was accepted")
                .createdAt(createdAt)
                .build();
    }

    private static Row row(String id, boolean read, Instant createdAt) {
        Map<String, Object> values = new HashMap<>();
        values.put("id", id);
        values.put("user_id", USER);
        values.put("type", "new_message");
        values.put("title", "New message");
        values.put("is_read", read);
        values.put("created_at", createdAt.toString());
        return Row.of(values);
    }

    private NotificationSync open(List<NotificationItem> received) {
        when(repository.findTop50ByUserIdOrderByCreatedAtDesc(USER)).thenReturn(List.of(
                stored(FIRST, NOW.minusSeconds(60)),
                stored(SECOND, NOW.minusSeconds(30))));
        return new NotificationSync(manager, context, repository, clock, received::add);
    }

    @Test
    @DisplayName("Loads the latest notifications newest first")
    void initialLoad() {
        NotificationSync sync = open(new ArrayList<>());

        assertThat(sync.notifications()).extracting(NotificationItem::id)
                .containsExactly(SECOND.toString(), FIRST.toString());
        assertThat(sync.unreadCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Inserts are prepended, refetched and handed to the callback")
    void insert() {
        List<NotificationItem> received = new ArrayList<>();
        NotificationSync sync = open(received);

        feed.publish(ChangeEvent.insert(NotificationSync.TABLE, row("n3", false, NOW)));

        assertThat(sync.notifications().get(0).id()).isEqualTo("n3");
        assertThat(sync.unreadCount()).isEqualTo(3);
        assertThat(received).extracting(NotificationItem::id).containsExactly("n3");
        verify(queryCache).refetchActive(QueryKey.of(NotificationSync.TABLE, USER));
    }

    @Test
    @DisplayName("The page keeps only the newest entries")
    void trimsToPage() {
        NotificationSync sync = open(new ArrayList<>());

        for (int i = 0; i < NotificationSync.PAGE_SIZE; i++) {
            feed.publish(ChangeEvent.insert(NotificationSync.TABLE, row("n" + i, false, NOW.plusSeconds(i))));
        }

        assertThat(sync.notifications()).hasSize(NotificationSync.PAGE_SIZE);
        assertThat(sync.notifications()).extracting(NotificationItem::id)
                .doesNotContain(FIRST.toString(), SECOND.toString());
    }

    @Test
    @DisplayName("A read mark shows immediately and sticks after the write")
    void optimisticMark() {
        NotificationSync sync = open(new ArrayList<>());
        AtomicLong unreadDuringWrite = new AtomicLong(-1);
        when(repository.markAsRead(eq(FIRST), eq(USER), eq(NOW))).thenAnswer(invocation -> {
            unreadDuringWrite.set(sync.unreadCount());
            return 1;
        });

        boolean written = sync.markAsRead(FIRST.toString());

        assertThat(written).isTrue();
        assertThat(unreadDuringWrite.get()).isEqualTo(1);
        assertThat(sync.unreadCount()).isEqualTo(1);
        verify(queryCache).invalidate(QueryKey.of(NotificationSync.TABLE, USER));
    }

    @Test
    @DisplayName("A failed write discards the read mark")
    void failedMark() {
        NotificationSync sync = open(new ArrayList<>());
        when(repository.markAsRead(any(), any(), any())).thenThrow(new DataAccessResourceFailureException("down"));

        boolean written = sync.markAsRead(FIRST.toString());

        assertThat(written).isFalse();
        assertThat(sync.unreadCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Ids that are not UUIDs are rejected without a write")
    void malformedId() {
        NotificationSync sync = open(new ArrayList<>());

        assertThat(sync.markAsRead("not-a-uuid")).isFalse();
        assertThat(sync.unreadCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Mark all clears the unread count")
    void markAll() {
        NotificationSync sync = open(new ArrayList<>());
        when(repository.markAllAsRead(USER, NOW)).thenReturn(2);

        assertThat(sync.markAllAsRead()).isTrue();

        assertThat(sync.unreadCount()).isZero();
        assertThat(sync.notifications()).allMatch(NotificationItem::read);
    }

    @Test
    @DisplayName("A failed mark all keeps every notification unread")
    void failedMarkAll() {
        NotificationSync sync = open(new ArrayList<>());
        when(repository.markAllAsRead(USER, NOW)).thenThrow(new DataAccessResourceFailureException("down"));

        assertThat(sync.markAllAsRead()).isFalse();

        assertThat(sync.unreadCount()).isEqualTo(2);
        assertThat(sync.notifications()).noneMatch(NotificationItem::read);
        verify(queryCache).invalidate(QueryKey.of(NotificationSync.TABLE, USER));
    }

    @Test
    @DisplayName("Read flags from the feed replace the stored item")
    void updateFromFeed() {
        NotificationSync sync = open(new ArrayList<>());

        feed.publish(ChangeEvent.update(NotificationSync.TABLE,
                row(FIRST.toString(), false, NOW.minusSeconds(60)),
                row(FIRST.toString(), true, NOW.minusSeconds(60))));

        assertThat(sync.unreadCount()).isEqualTo(1);
    }
}
