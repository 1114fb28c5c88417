package com.marketplace.realtime.sync;

/**
 * Invalidation port of the query cache that serves read models to clients.
 */
public interface QueryCache {

    /**
     * Marks matching entries stale; they reload on their next read.
     */
    void invalidate(QueryKey key);

    /**
     * Invalidates matching entries and reloads the ones currently in use right away.
     */
    void refetchActive(QueryKey key);
}
