package com.marketplace.realtime.sync;

/**
 * Published by {@link ApplicationEventQueryCache}.
 *
 * @param refetch whether in-use entries should reload immediately
 */
public record QueryInvalidatedEvent(QueryKey key, boolean refetch) {
}
