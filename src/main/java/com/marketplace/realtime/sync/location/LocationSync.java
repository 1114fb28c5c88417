package com.marketplace.realtime.sync.location;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.RowFilter;
import com.marketplace.realtime.repository.RequestLocationRepository;
import com.marketplace.realtime.subscription.Subscription;
import com.marketplace.realtime.subscription.SubscriptionConfig;
import com.marketplace.realtime.subscription.SubscriptionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Live positions of the participants of one request, keyed by user id.
 * Only active shares are kept.
 */
@Slf4j
public class LocationSync implements AutoCloseable {

    public static final String TABLE = "request_locations";

    private final String requestId;
    private final RequestLocationRepository repository;
    private final Map<String, LocationRecord> locations = new LinkedHashMap<>();
    private DataAccessException error;

    private final Subscription subscription;

    public LocationSync(SubscriptionManager subscriptionManager,
                        RequestLocationRepository repository,
                        String requestId) {
        this.requestId = requestId;
        this.repository = repository;
        refetch();
        this.subscription = subscriptionManager.create(SubscriptionConfig.builder()
                .channelName(TABLE + ":" + requestId)
                .table(TABLE)
                .filter(RowFilter.eq("request_id", requestId))
                .onChange(this::apply)
                .build());
    }

    /**
     * Reloads the active locations from the store of record.
     */
    public void refetch() {
        try {
            Map<String, LocationRecord> loaded = new LinkedHashMap<>();
            repository.findByRequestIdAndActiveTrue(requestId)
                    .forEach(location -> loaded.put(location.getUserId(), LocationRecord.fromEntity(location)));
            synchronized (this) {
                locations.clear();
                locations.putAll(loaded);
                error = null;
            }
        } catch (DataAccessException e) {
            log.error("Failed to load locations for request {}", requestId, e);
            synchronized (this) {
                error = e;
            }
        }
    }

    public synchronized Map<String, LocationRecord> locations() {
        return Map.copyOf(locations);
    }

    public synchronized Optional<LocationRecord> location(String userId) {
        return Optional.ofNullable(locations.get(userId));
    }

    public synchronized Optional<DataAccessException> error() {
        return Optional.ofNullable(error);
    }

    @Override
    public void close() {
        subscription.unsubscribe();
    }

    synchronized void apply(ChangeEvent event) {
        switch (event.type()) {
            case INSERT, UPDATE -> {
                LocationRecord record = LocationRecord.fromRow(event.after());
                if (record.userId() == null) {
                    return;
                }
                if (record.active()) {
                    locations.put(record.userId(), record);
                } else {
                    locations.remove(record.userId());
                }
            }
            case DELETE -> {
                String userId = event.before() != null ? event.before().getString("user_id") : null;
                if (userId != null) {
                    locations.remove(userId);
                }
            }
        }
    }
}
