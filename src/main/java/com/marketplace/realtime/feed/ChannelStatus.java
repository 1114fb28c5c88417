package com.marketplace.realtime.feed;

/**
 * Lifecycle signals a channel reports to its listener.
 */
public enum ChannelStatus {
    SUBSCRIBED,
    CHANNEL_ERROR,
    TIMED_OUT,
    CLOSED;

    public boolean isFailure() {
        return this == CHANNEL_ERROR || this == TIMED_OUT;
    }
}
