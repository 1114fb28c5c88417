package com.marketplace.realtime.feed;

/**
 * Receives everything a single channel produces.
 */
public interface ChannelListener {

    void onEvent(ChangeEvent event);

    /**
     * @param status new channel status
     * @param cause  transport failure behind an error status, may be {@code null}
     */
    void onStatus(ChannelStatus status, Throwable cause);
}
