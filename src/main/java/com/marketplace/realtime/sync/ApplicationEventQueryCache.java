package com.marketplace.realtime.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Fans cache invalidations out as {@link QueryInvalidatedEvent}s to whichever
 * client gateway is listening.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApplicationEventQueryCache implements QueryCache {

    private final ApplicationEventPublisher publisher;

    @Override
    public void invalidate(QueryKey key) {
        log.debug("Invalidating query {}", key);
        publisher.publishEvent(new QueryInvalidatedEvent(key, false));
    }

    @Override
    public void refetchActive(QueryKey key) {
        log.debug("Refetching active query {}", key);
        publisher.publishEvent(new QueryInvalidatedEvent(key, true));
    }
}
