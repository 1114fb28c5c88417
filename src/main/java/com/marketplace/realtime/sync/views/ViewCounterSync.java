package com.marketplace.realtime.sync.views;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.ChangeEventType;
import com.marketplace.realtime.feed.RowFilter;
import com.marketplace.realtime.model.Listing;
import com.marketplace.realtime.repository.ListingRepository;
import com.marketplace.realtime.subscription.Subscription;
import com.marketplace.realtime.subscription.SubscriptionConfig;
import com.marketplace.realtime.subscription.SubscriptionManager;
import com.marketplace.realtime.sync.SyncContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongConsumer;

/**
 * Live view count of a single listing.
 */
@Slf4j
public class ViewCounterSync implements AutoCloseable {

    private final String listingId;
    private final SyncContext context;
    private final LongConsumer listener;
    private final AtomicLong viewsCount = new AtomicLong();

    private final Subscription subscription;

    public ViewCounterSync(SubscriptionManager subscriptionManager,
                           SyncContext context,
                           ListingRepository listingRepository,
                           String listingId,
                           LongConsumer listener) {
        this.listingId = listingId;
        this.context = context;
        this.listener = listener != null ? listener : count -> { };
        viewsCount.set(initialCount(listingRepository));
        this.subscription = subscriptionManager.create(SubscriptionConfig.builder()
                .channelName("listing-views:" + listingId)
                .table(ListingQueries.TABLE)
                .filter(RowFilter.eq("id", listingId))
                .events(EnumSet.of(ChangeEventType.UPDATE))
                .onUpdate(this::onUpdate)
                .build());
    }

    private long initialCount(ListingRepository listingRepository) {
        try {
            return listingRepository.findById(listingId).map(Listing::getViewsCount).orElse(0L);
        } catch (DataAccessException e) {
            log.warn("Could not load view count of listing {}: {}", listingId, e.getMessage());
            return 0L;
        }
    }

    public long viewsCount() {
        return viewsCount.get();
    }

    @Override
    public void close() {
        subscription.unsubscribe();
    }

    void onUpdate(ChangeEvent event) {
        context.queryCache().invalidate(ListingQueries.detail(listingId));
        Long next = event.after().getLong("views_count");
        if (next == null) {
            return;
        }
        Long previous = event.before() != null ? event.before().getLong("views_count") : null;
        long current = viewsCount.getAndSet(next);
        boolean changed = previous != null ? previous.longValue() != next : current != next;
        if (changed) {
            context.queryCache().invalidate(ListingQueries.LIST);
            listener.accept(next);
        }
    }
}
