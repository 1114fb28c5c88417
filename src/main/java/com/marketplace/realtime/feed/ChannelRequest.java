package com.marketplace.realtime.feed;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * What a channel should deliver.
 *
 * @param channelName unique name of the logical stream
 * @param table       source table, {@code null} for a presence-only channel
 * @param filter      optional row predicate
 * @param events      event types to deliver
 */
public record ChannelRequest(
        String channelName,
        String table,
        RowFilter filter,
        Set<ChangeEventType> events
) {

    public ChannelRequest {
        Objects.requireNonNull(channelName, "channelName");
        events = events == null || events.isEmpty()
                ? EnumSet.allOf(ChangeEventType.class)
                : EnumSet.copyOf(events);
    }

    public boolean isPresence() {
        return table == null;
    }

    public boolean accepts(ChangeEvent event) {
        if (isPresence() || !table.equals(event.table()) || !events.contains(event.type())) {
            return false;
        }
        return filter == null || filter.matches(event);
    }
}
