package com.marketplace.realtime.feed;

import com.marketplace.realtime.exception.InvalidChannelFilterException;

import java.util.Objects;

/**
 * Row-level equality predicate attached to a channel, written as
 * {@code column=eq.value}.
 *
 * @param column column to compare
 * @param value  expected value, compared against the column's string form
 */
public record RowFilter(String column, String value) {

    private static final String EQ = "=eq.";

    public RowFilter {
        if (column == null || column.isBlank()) {
            throw new InvalidChannelFilterException("Filter column must not be blank");
        }
        Objects.requireNonNull(value, "value");
    }

    public static RowFilter eq(String column, String value) {
        return new RowFilter(column, value);
    }

    public static RowFilter parse(String expression) {
        if (expression == null) {
            throw new InvalidChannelFilterException("Filter expression must not be null");
        }
        int idx = expression.indexOf(EQ);
        if (idx <= 0) {
            throw new InvalidChannelFilterException("Unsupported filter expression: " + expression);
        }
        return new RowFilter(expression.substring(0, idx), expression.substring(idx + EQ.length()));
    }

    /**
     * An event matches when either row image carries the expected value, so a
     * delete (before image only) still reaches the channel that saw the insert.
     */
    public boolean matches(ChangeEvent event) {
        return matches(event.after()) || matches(event.before());
    }

    private boolean matches(Row row) {
        return row != null && value.equals(row.getString(column));
    }

    @Override
    public String toString() {
        return column + EQ + value;
    }
}
