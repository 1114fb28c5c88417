package com.marketplace.realtime.sync.views;

import com.marketplace.realtime.sync.QueryKey;

final class ListingQueries {

    static final String TABLE = "listings";
    static final QueryKey LIST = QueryKey.of(TABLE, "list");

    private ListingQueries() {
    }

    static QueryKey detail(String listingId) {
        return QueryKey.of(TABLE, "detail", listingId);
    }
}
