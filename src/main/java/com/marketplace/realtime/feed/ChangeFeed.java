package com.marketplace.realtime.feed;

/**
 * Push-capable database change feed. Implementations deliver row mutations for
 * the requested table at least once while the channel is connected, and report
 * transport failures through {@link ChannelListener#onStatus}.
 */
public interface ChangeFeed {

    /**
     * Opens a channel. Status and events may be reported on any thread, including
     * the calling one before this method returns.
     */
    ChannelHandle subscribe(ChannelRequest request, ChannelListener listener);
}
