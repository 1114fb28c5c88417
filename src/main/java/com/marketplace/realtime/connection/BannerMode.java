package com.marketplace.realtime.connection;

public enum BannerMode {
    HIDDEN,
    /** Automatic reconnect in progress. */
    RECONNECTING,
    /** Retries exhausted, the user has to reconnect manually. */
    DISCONNECTED
}
