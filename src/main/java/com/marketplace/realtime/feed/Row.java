package com.marketplace.realtime.feed;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable column/value image of a database row as delivered by the change feed.
 * Values keep the JSON types the feed produced, the typed accessors convert on read.
 */
public final class Row {

    private static final Row EMPTY = new Row(Map.of());

    private final Map<String, Object> values;

    private Row(Map<String, Object> values) {
        this.values = values;
    }

    public static Row of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        // LinkedHashMap keeps column order and tolerates null values
        return new Row(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static Row empty() {
        return EMPTY;
    }

    public boolean has(String column) {
        return values.containsKey(column);
    }

    public Object get(String column) {
        return values.get(column);
    }

    public String getString(String column) {
        Object value = values.get(column);
        return value == null ? null : value.toString();
    }

    public Boolean getBoolean(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        return Boolean.parseBoolean(value.toString());
    }

    public Long getLong(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.longValue();
        }
        return Long.parseLong(value.toString());
    }

    public Double getDouble(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return Double.parseDouble(value.toString());
    }

    /**
     * Reads a timestamp column. Accepts epoch milliseconds, ISO instants and ISO
     * offset date-times.
     */
    public Instant getInstant(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Number n) {
            return Instant.ofEpochMilli(n.longValue());
        }
        String text = value.toString();
        if (text.endsWith("Z")) {
            return Instant.parse(text);
        }
        return OffsetDateTime.parse(text).toInstant();
    }

    public LocalDate getLocalDate(String column) {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate date) {
            return date;
        }
        if (value instanceof Number n) {
            // Debezium encodes DATE columns as days since epoch
            return LocalDate.ofEpochDay(n.longValue());
        }
        return LocalDate.parse(value.toString());
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row row)) return false;
        return values.equals(row.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "Row" + values;
    }
}
