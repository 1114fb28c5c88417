package com.marketplace.realtime.sync.request;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.Row;
import com.marketplace.realtime.feed.local.LocalChangeFeed;
import com.marketplace.realtime.model.RequestStatus;
import com.marketplace.realtime.scheduling.VirtualDelayScheduler;
import com.marketplace.realtime.subscription.RetryConfig;
import com.marketplace.realtime.subscription.SubscriptionManager;
import com.marketplace.realtime.sync.CurrentUserProvider;
import com.marketplace.realtime.sync.Notice;
import com.marketplace.realtime.sync.NoticeDispatcher;
import com.marketplace.realtime.sync.NoticeType;
import com.marketplace.realtime.sync.QueryCache;
import com.marketplace.realtime.sync.SyncContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.support.ResourceBundleMessageSource;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("RequestStatusSync Tests")
class RequestStatusSyncTest {

    private static final String CLIENT = "client-1";
    private static final String PROVIDER = "provider-1";

    @Mock
    private QueryCache queryCache;

    @Mock
    private NoticeDispatcher notices;

    @Mock
    private StatusChangeListener listener;

    private LocalChangeFeed feed;
    private SubscriptionManager manager;
    private StatusNoticeCatalog catalog;

    @BeforeEach
    void setUp() {
        feed = new LocalChangeFeed();
        manager = new SubscriptionManager(feed, new VirtualDelayScheduler(),
                new SimpleMeterRegistry(), RetryConfig.DEFAULTS, () -> 0.5);
        ResourceBundleMessageSource messageSource = new ResourceBundleMessageSource();
        messageSource.setBasename("messages");
        messageSource.setDefaultEncoding("UTF-8");
        messageSource.setFallbackToSystemLocale(false);
        catalog = new StatusNoticeCatalog(messageSource, Locale.ENGLISH);
    }

    private RequestStatusSync syncFor(String userId) {
        SyncContext context = new SyncContext(CurrentUserProvider.of(userId), queryCache, notices);
        return new RequestStatusSync(manager, context, catalog, true, listener);
    }

    private static Row request(String id, String status) {
        Map<String, Object> values = new HashMap<>();
        values.put("id", id);
        values.put("client_id", CLIENT);
        values.put("provider_id", PROVIDER);
        values.put("status", status);
        return Row.of(values);
    }

    private static ChangeEvent statusChange(String id, String from, String to) {
        return ChangeEvent.update(RequestStatusSync.TABLE, request(id, from), request(id, to));
    }

    @Test
    @DisplayName("Opens one channel per role")
    void subscribesBothRoles() {
        RequestStatusSync sync = syncFor(CLIENT);

        assertThat(sync.subscriptions()).hasSize(2);
        assertThat(feed.openChannels("requests-client:" + CLIENT)).isEqualTo(1);
        assertThat(feed.openChannels("requests-provider:" + CLIENT)).isEqualTo(1);

        sync.close();
        assertThat(feed.openChannelCount()).isZero();
    }

    @Test
    @DisplayName("Requires a signed-in user")
    void requiresUser() {
        SyncContext anonymous = new SyncContext(CurrentUserProvider.of(null), queryCache, notices);

        assertThatThrownBy(() -> new RequestStatusSync(manager, anonymous, catalog, true, listener))
                .isInstanceOf(IllegalStateException.class);
    }

    @Nested
    @DisplayName("Status changes")
    class StatusChanges {

        @Test
        @DisplayName("Refetches before the notice and the callback")
        void refetchFirst() {
            syncFor(CLIENT);

            feed.publish(statusChange("r1", "pending", "accepted"));

            InOrder order = inOrder(queryCache, notices, listener);
            order.verify(queryCache).refetchActive(RequestStatusSync.REQUESTS_QUERY);
            ArgumentCaptor<Notice> notice = ArgumentCaptor.forClass(Notice.class);
            order.verify(notices).dispatch(notice.capture());
            order.verify(listener).onStatusChange("r1", RequestStatus.ACCEPTED, RequestStatus.PENDING);
            assertThat(notice.getValue().type()).isEqualTo(NoticeType.STATUS_CHANGED);
            assertThat(notice.getValue().recipientId()).isEqualTo(CLIENT);
            assertThat(notice.getValue().title()).isEqualTo("Request accepted");
            assertThat(notice.getValue().requestId()).isEqualTo("r1");
        }

        @Test
        @DisplayName("A failing notice does not block the callback")
        void noticeFailureIsolated() {
            doThrow(new IllegalStateException("toast broke")).when(notices).dispatch(any());
            syncFor(CLIENT);

            feed.publish(statusChange("r1", "accepted", "in_progress"));

            verify(queryCache).refetchActive(RequestStatusSync.REQUESTS_QUERY);
            verify(listener).onStatusChange("r1", RequestStatus.IN_PROGRESS, RequestStatus.ACCEPTED);
        }

        @Test
        @DisplayName("Duplicate deliveries are reported once")
        void duplicateIgnored() {
            syncFor(CLIENT);

            feed.publish(statusChange("r1", "pending", "accepted"));
            feed.publish(statusChange("r1", "pending", "accepted"));

            verify(listener, times(1)).onStatusChange(eq("r1"), eq(RequestStatus.ACCEPTED), any());
            verify(queryCache, times(2)).refetchActive(RequestStatusSync.REQUESTS_QUERY);
        }

        @Test
        @DisplayName("A late non-terminal status after a terminal one is ignored")
        void staleAfterTerminal() {
            syncFor(CLIENT);

            feed.publish(statusChange("r1", "awaiting_payment", "completed"));
            feed.publish(statusChange("r1", "accepted", "in_progress"));

            verify(listener).onStatusChange("r1", RequestStatus.COMPLETED, RequestStatus.AWAITING_PAYMENT);
            verify(listener, never()).onStatusChange(eq("r1"), eq(RequestStatus.IN_PROGRESS), any());
        }

        @Test
        @DisplayName("Unknown status values are skipped after the refetch")
        void unknownStatus() {
            syncFor(CLIENT);

            feed.publish(statusChange("r1", "pending", "teleported"));

            verify(queryCache).refetchActive(RequestStatusSync.REQUESTS_QUERY);
            verifyNoInteractions(listener, notices);
        }

        @Test
        @DisplayName("Statuses without a notice text only fire the callback")
        void noNoticeForPending() {
            syncFor(CLIENT);

            feed.publish(statusChange("r1", "price_proposed", "pending"));

            verify(listener).onStatusChange("r1", RequestStatus.PENDING, RequestStatus.PRICE_PROPOSED);
            verifyNoInteractions(notices);
        }

        @Test
        @DisplayName("Notices can be turned off")
        void noticesDisabled() {
            SyncContext context = new SyncContext(CurrentUserProvider.of(CLIENT), queryCache, notices);
            new RequestStatusSync(manager, context, catalog, false, listener);

            feed.publish(statusChange("r1", "pending", "rejected"));

            verify(listener).onStatusChange("r1", RequestStatus.REJECTED, RequestStatus.PENDING);
            verifyNoInteractions(notices);
        }
    }

    @Nested
    @DisplayName("Other events")
    class OtherEvents {

        @Test
        @DisplayName("New requests are announced to the provider only")
        void newRequestForProvider() {
            syncFor(PROVIDER);

            feed.publish(ChangeEvent.insert(RequestStatusSync.TABLE, request("r2", "pending")));

            ArgumentCaptor<Notice> notice = ArgumentCaptor.forClass(Notice.class);
            verify(notices).dispatch(notice.capture());
            assertThat(notice.getValue().type()).isEqualTo(NoticeType.NEW_REQUEST);
            assertThat(notice.getValue().recipientId()).isEqualTo(PROVIDER);
        }

        @Test
        @DisplayName("The client only refetches on insert")
        void insertForClient() {
            syncFor(CLIENT);

            feed.publish(ChangeEvent.insert(RequestStatusSync.TABLE, request("r2", "pending")));

            verify(queryCache).refetchActive(RequestStatusSync.REQUESTS_QUERY);
            verifyNoInteractions(notices);
        }

        @Test
        @DisplayName("A new work report is announced to the client")
        void reportArrived() {
            syncFor(CLIENT);
            Map<String, Object> reported = new HashMap<>(request("r1", "awaiting_client_confirmation").asMap());
            reported.put("completion_description", "Pipes replaced");

            feed.publish(ChangeEvent.update(RequestStatusSync.TABLE,
                    request("r1", "awaiting_client_confirmation"), Row.of(reported)));

            ArgumentCaptor<Notice> notice = ArgumentCaptor.forClass(Notice.class);
            verify(notices).dispatch(notice.capture());
            assertThat(notice.getValue().type()).isEqualTo(NoticeType.REPORT_ARRIVED);
            verifyNoInteractions(listener);
        }

        @Test
        @DisplayName("Deletes refetch without notices")
        void delete() {
            syncFor(CLIENT);

            feed.publish(ChangeEvent.delete(RequestStatusSync.TABLE, request("r1", "pending")));

            verify(queryCache).refetchActive(RequestStatusSync.REQUESTS_QUERY);
            verifyNoInteractions(notices, listener);
        }
    }
}
