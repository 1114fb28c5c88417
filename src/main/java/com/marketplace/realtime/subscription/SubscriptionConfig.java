package com.marketplace.realtime.subscription;

import com.marketplace.realtime.feed.ChangeEvent;
import com.marketplace.realtime.feed.ChangeEventType;
import com.marketplace.realtime.feed.ChannelRequest;
import com.marketplace.realtime.feed.RowFilter;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Consumer;

/**
 * What a subscription listens to and where its events go. A config without a
 * table describes a presence channel that only reports connectivity.
 */
@Getter
@Builder
public class SubscriptionConfig {

    @NonNull
    private final String channelName;

    private final String table;

    private final RowFilter filter;

    @Builder.Default
    private final Set<ChangeEventType> events = EnumSet.allOf(ChangeEventType.class);

    @Builder.Default
    private final Consumer<ChangeEvent> onInsert = event -> { };

    @Builder.Default
    private final Consumer<ChangeEvent> onUpdate = event -> { };

    @Builder.Default
    private final Consumer<ChangeEvent> onDelete = event -> { };

    @Builder.Default
    private final Consumer<ChangeEvent> onChange = event -> { };

    @Builder.Default
    private final Consumer<SubscriptionState> onStateChange = state -> { };

    public static SubscriptionConfig presence(String channelName, Consumer<SubscriptionState> onStateChange) {
        return SubscriptionConfig.builder()
                .channelName(channelName)
                .onStateChange(onStateChange)
                .build();
    }

    ChannelRequest toChannelRequest() {
        return new ChannelRequest(channelName, table, filter, events);
    }
}
