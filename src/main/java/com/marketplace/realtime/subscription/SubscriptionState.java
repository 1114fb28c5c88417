package com.marketplace.realtime.subscription;

public enum SubscriptionState {
    CONNECTING,
    SUBSCRIBED,
    RECONNECTING,
    /** Retries exhausted; only a manual reconnect revives the subscription. */
    DISCONNECTED,
    /** Released by {@link Subscription#unsubscribe()}. */
    CLOSED
}
