package com.marketplace.realtime.feed;

import java.util.Objects;

/**
 * One physical row mutation observed on the change feed.
 *
 * @param type   insert, update or delete
 * @param table  source table name
 * @param before row image before the mutation; {@code null} for inserts
 * @param after  row image after the mutation; {@code null} for deletes
 */
public record ChangeEvent(
        ChangeEventType type,
        String table,
        Row before,
        Row after
) {

    public ChangeEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(table, "table");
    }

    public static ChangeEvent insert(String table, Row after) {
        return new ChangeEvent(ChangeEventType.INSERT, table, null, after);
    }

    public static ChangeEvent update(String table, Row before, Row after) {
        return new ChangeEvent(ChangeEventType.UPDATE, table, before, after);
    }

    public static ChangeEvent delete(String table, Row before) {
        return new ChangeEvent(ChangeEventType.DELETE, table, before, null);
    }

    /**
     * The most recent row image: {@code after} when present, otherwise {@code before}.
     */
    public Row latest() {
        return after != null ? after : before;
    }
}
