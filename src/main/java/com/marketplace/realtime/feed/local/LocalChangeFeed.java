package com.marketplace.realtime.feed.local;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.ChangeFeed;
import com.marketplace.realtime.feed.ChannelHandle;
import com.marketplace.realtime.feed.ChannelListener;
import com.marketplace.realtime.feed.ChannelRequest;
import com.marketplace.realtime.feed.ChannelStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-process change feed for single-node runs and tests. Events passed to
 * {@link #publish} are delivered synchronously, in order, to every open channel
 * that accepts them. Channel failures can be simulated per channel name.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.realtime", name = "feed", havingValue = "local")
public class LocalChangeFeed implements ChangeFeed {

    private final List<LocalChannel> channels = new CopyOnWriteArrayList<>();
    private final Map<String, ChannelStatus> failOnSubscribe = new ConcurrentHashMap<>();

    @Override
    public ChannelHandle subscribe(ChannelRequest request, ChannelListener listener) {
        LocalChannel channel = new LocalChannel(request, listener);
        channels.add(channel);
        ChannelStatus failure = failOnSubscribe.get(request.channelName());
        if (failure != null) {
            log.debug("Simulating {} on subscribe of {}", failure, request.channelName());
            listener.onStatus(failure, new IllegalStateException("Simulated " + failure));
        } else {
            listener.onStatus(ChannelStatus.SUBSCRIBED, null);
        }
        return channel;
    }

    public void publish(ChangeEvent event) {
        for (LocalChannel channel : channels) {
            if (!channel.closed.get() && channel.request.accepts(event)) {
                channel.listener.onEvent(event);
            }
        }
    }

    /**
     * Reports {@code status} on every open channel named {@code channelName}.
     */
    public void failChannel(String channelName, ChannelStatus status) {
        for (LocalChannel channel : channels) {
            if (!channel.closed.get() && channel.request.channelName().equals(channelName)) {
                channel.listener.onStatus(status, new IllegalStateException("Simulated " + status));
            }
        }
    }

    /**
     * Makes every following subscribe of {@code channelName} fail with {@code status};
     * {@code null} restores normal subscribes.
     */
    public void setFailOnSubscribe(String channelName, ChannelStatus status) {
        if (status == null) {
            failOnSubscribe.remove(channelName);
        } else {
            failOnSubscribe.put(channelName, status);
        }
    }

    public int openChannels(String channelName) {
        return (int) channels.stream()
                .filter(channel -> channel.request.channelName().equals(channelName))
                .count();
    }

    public int openChannelCount() {
        return channels.size();
    }

    private final class LocalChannel implements ChannelHandle {

        private final ChannelRequest request;
        private final ChannelListener listener;
        private final AtomicBoolean closed = new AtomicBoolean();

        private LocalChannel(ChannelRequest request, ChannelListener listener) {
            this.request = request;
            this.listener = listener;
        }

        @Override
        public String channelName() {
            return request.channelName();
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                channels.remove(this);
                listener.onStatus(ChannelStatus.CLOSED, null);
            }
        }
    }
}
