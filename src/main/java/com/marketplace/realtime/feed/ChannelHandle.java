package com.marketplace.realtime.feed;

/**
 * Open channel returned by {@link ChangeFeed#subscribe}. Closing releases the
 * transport resources; closing twice is a no-op.
 */
public interface ChannelHandle {

    String channelName();

    void close();
}
