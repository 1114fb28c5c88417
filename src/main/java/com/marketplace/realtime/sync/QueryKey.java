package com.marketplace.realtime.sync;

import java.util.Arrays;
import java.util.List;

/**
 * Cache key of a query, e.g. {@code ["listings", "detail", "abc"]}.
 */
public record QueryKey(List<Object> parts) {

    public QueryKey {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("QueryKey needs at least one part");
        }
        parts = List.copyOf(parts);
    }

    public static QueryKey of(Object... parts) {
        return new QueryKey(Arrays.asList(parts));
    }

    @Override
    public String toString() {
        return parts.toString();
    }
}
