package com.marketplace.realtime.sync;

import com.marketplace.realtime.repository.ListingRepository;
import com.marketplace.realtime.repository.NotificationRepository;
import com.marketplace.realtime.repository.RequestLocationRepository;
import com.marketplace.realtime.subscription.SubscriptionManager;
import com.marketplace.realtime.sync.chat.ChatSync;
import com.marketplace.realtime.sync.chat.ChatSyncListener;
import com.marketplace.realtime.sync.location.LocationSync;
import com.marketplace.realtime.sync.notification.NotificationItem;
import com.marketplace.realtime.sync.notification.NotificationSync;
import com.marketplace.realtime.sync.request.RequestStatusSync;
import com.marketplace.realtime.sync.request.StatusChangeListener;
import com.marketplace.realtime.sync.request.StatusNoticeCatalog;
import com.marketplace.realtime.sync.views.ListingCatalogSync;
import com.marketplace.realtime.sync.views.ViewCounterSync;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.function.Consumer;
import java.util.function.LongConsumer;

/**
 * Entry point for opening sync consumers with the application's cache and
 * notice ports. Every consumer must be closed by its owner.
 */
@Component
@RequiredArgsConstructor
public class RealtimeSyncFactory {

    private final SubscriptionManager subscriptionManager;
    private final QueryCache queryCache;
    private final NoticeDispatcher noticeDispatcher;
    private final StatusNoticeCatalog statusNoticeCatalog;
    private final RequestLocationRepository requestLocationRepository;
    private final ListingRepository listingRepository;
    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public SyncContext contextFor(CurrentUserProvider currentUser) {
        return new SyncContext(currentUser, queryCache, noticeDispatcher);
    }

    public ChatSync openChat(CurrentUserProvider currentUser, String requestId, ChatSyncListener listener) {
        return new ChatSync(subscriptionManager, contextFor(currentUser), clock, requestId, listener);
    }

    public RequestStatusSync openRequestStatus(CurrentUserProvider currentUser,
                                               boolean showNotices,
                                               StatusChangeListener listener) {
        return new RequestStatusSync(subscriptionManager, contextFor(currentUser), statusNoticeCatalog,
                showNotices, listener);
    }

    public LocationSync openLocations(String requestId) {
        return new LocationSync(subscriptionManager, requestLocationRepository, requestId);
    }

    public ViewCounterSync openViewCounter(CurrentUserProvider currentUser, String listingId, LongConsumer listener) {
        return new ViewCounterSync(subscriptionManager, contextFor(currentUser), listingRepository, listingId, listener);
    }

    public ListingCatalogSync openListingCatalog(CurrentUserProvider currentUser) {
        return new ListingCatalogSync(subscriptionManager, contextFor(currentUser));
    }

    public NotificationSync openNotifications(CurrentUserProvider currentUser, Consumer<NotificationItem> listener) {
        return new NotificationSync(subscriptionManager, contextFor(currentUser), notificationRepository, clock,
                listener);
    }
}
