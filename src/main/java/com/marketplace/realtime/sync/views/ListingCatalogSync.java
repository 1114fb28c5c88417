package com.marketplace.realtime.sync.views;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.RowFilter;
import com.marketplace.realtime.subscription.Subscription;
import com.marketplace.realtime.subscription.SubscriptionConfig;
import com.marketplace.realtime.subscription.SubscriptionManager;
import com.marketplace.realtime.sync.SyncContext;

import java.util.Objects;

/**
 * Invalidates cached listing pages when active listings change.
 */
public class ListingCatalogSync implements AutoCloseable {

    private final SyncContext context;
    private final Subscription subscription;

    public ListingCatalogSync(SubscriptionManager subscriptionManager, SyncContext context) {
        this.context = context;
        this.subscription = subscriptionManager.create(SubscriptionConfig.builder()
                .channelName("listings-changes")
                .table(ListingQueries.TABLE)
                .filter(RowFilter.eq("status", "active"))
                .onChange(this::apply)
                .build());
    }

    @Override
    public void close() {
        subscription.unsubscribe();
    }

    void apply(ChangeEvent event) {
        switch (event.type()) {
            case INSERT, DELETE -> context.queryCache().invalidate(ListingQueries.LIST);
            case UPDATE -> {
                String listingId = event.after().getString("id");
                if (listingId == null) {
                    return;
                }
                context.queryCache().invalidate(ListingQueries.detail(listingId));
                Object before = event.before() != null ? event.before().get("views_count") : null;
                if (!Objects.equals(before, event.after().get("views_count"))) {
                    context.queryCache().invalidate(ListingQueries.LIST);
                }
            }
        }
    }
}
