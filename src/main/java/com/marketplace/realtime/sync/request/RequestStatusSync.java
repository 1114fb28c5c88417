package com.marketplace.realtime.sync.request;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.Row;
import com.marketplace.realtime.feed.RowFilter;
import com.marketplace.realtime.model.RequestStatus;
import com.marketplace.realtime.subscription.Subscription;
import com.marketplace.realtime.subscription.SubscriptionConfig;
import com.marketplace.realtime.subscription.SubscriptionManager;
import com.marketplace.realtime.sync.Notice;
import com.marketplace.realtime.sync.NoticeType;
import com.marketplace.realtime.sync.QueryKey;
import com.marketplace.realtime.sync.SyncContext;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the signed-in user's request lists fresh and tells them about status
 * changes, on both the client and the provider side.
 * <p>
 * The request list is always refetched first; notices and the status callback
 * follow, and their failures are logged without affecting the refetch.
 */
@Slf4j
public class RequestStatusSync implements AutoCloseable {

    public static final String TABLE = "listing_requests";
    static final QueryKey REQUESTS_QUERY = QueryKey.of(TABLE);

    private final SyncContext context;
    private final StatusNoticeCatalog catalog;
    private final StatusChangeListener listener;
    private final boolean showNotices;
    private final StatusTransitionLog transitions = new StatusTransitionLog();
    private final String userId;

    private final List<Subscription> subscriptions;

    public RequestStatusSync(SubscriptionManager subscriptionManager,
                             SyncContext context,
                             StatusNoticeCatalog catalog,
                             boolean showNotices,
                             StatusChangeListener listener) {
        this.context = context;
        this.catalog = catalog;
        this.showNotices = showNotices;
        this.listener = listener;
        this.userId = context.requireUserId();
        this.subscriptions = List.of(
                subscribe(subscriptionManager, RequestRole.CLIENT),
                subscribe(subscriptionManager, RequestRole.PROVIDER));
    }

    private Subscription subscribe(SubscriptionManager manager, RequestRole role) {
        return manager.create(SubscriptionConfig.builder()
                .channelName(role.channelName(userId))
                .table(TABLE)
                .filter(RowFilter.eq(role.column(), userId))
                .onChange(event -> handle(event, role))
                .build());
    }

    public List<Subscription> subscriptions() {
        return subscriptions;
    }

    @Override
    public void close() {
        subscriptions.forEach(Subscription::unsubscribe);
    }

    void handle(ChangeEvent event, RequestRole role) {
        switch (event.type()) {
            case INSERT -> {
                refetch();
                if (role == RequestRole.PROVIDER) {
                    notify(NoticeType.NEW_REQUEST, event.after().getString("id"));
                }
            }
            case UPDATE -> handleUpdate(event, role);
            case DELETE -> refetch();
        }
    }

    private void handleUpdate(ChangeEvent event, RequestRole role) {
        Row before = event.before() != null ? event.before() : Row.empty();
        Row after = event.after();
        String oldValue = before.getString("status");
        String newValue = after.getString("status");

        if (!Objects.equals(oldValue, newValue)) {
            refetch();
            onStatusChanged(after.getString("id"), oldValue, newValue);
            return;
        }

        boolean reportChanged =
                !Objects.equals(before.get("completion_description"), after.get("completion_description"))
                        || !Objects.equals(before.get("completion_photos"), after.get("completion_photos"));
        refetch();
        if (reportChanged && role == RequestRole.CLIENT) {
            notify(NoticeType.REPORT_ARRIVED, after.getString("id"));
        }
    }

    private void onStatusChanged(String requestId, String oldValue, String newValue) {
        RequestStatus newStatus;
        RequestStatus oldStatus;
        try {
            newStatus = RequestStatus.fromWire(newValue);
            oldStatus = RequestStatus.fromWire(oldValue);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring status change of request {}: {}", requestId, e.getMessage());
            return;
        }
        if (requestId == null || newStatus == null || !transitions.record(requestId, newStatus)) {
            log.debug("Skipping stale or duplicate status {} for request {}", newStatus, requestId);
            return;
        }
        log.info("Request {} changed status {} -> {}", requestId, oldStatus, newStatus);

        if (showNotices) {
            try {
                catalog.forStatus(newStatus).ifPresent(text -> context.notices().dispatch(
                        new Notice(NoticeType.STATUS_CHANGED, userId, text.title(), text.description(), requestId)));
            } catch (RuntimeException e) {
                log.error("Failed to dispatch status notice for request {}", requestId, e);
            }
        }
        if (listener != null) {
            try {
                listener.onStatusChange(requestId, newStatus, oldStatus);
            } catch (RuntimeException e) {
                log.error("Status change callback failed for request {}", requestId, e);
            }
        }
    }

    private void notify(NoticeType type, String requestId) {
        if (!showNotices) {
            return;
        }
        try {
            Optional<NoticeText> text = type == NoticeType.NEW_REQUEST ? catalog.newRequest() : catalog.reportArrived();
            text.ifPresent(t -> context.notices().dispatch(
                    new Notice(type, userId, t.title(), t.description(), requestId)));
        } catch (RuntimeException e) {
            log.error("Failed to dispatch {} notice for request {}", type, requestId, e);
        }
    }

    private void refetch() {
        context.queryCache().refetchActive(REQUESTS_QUERY);
    }
}
