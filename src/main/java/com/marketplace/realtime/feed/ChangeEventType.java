package com.marketplace.realtime.feed;

/**
 * Kind of row mutation carried by a {@link ChangeEvent}.
 */
public enum ChangeEventType {
    INSERT,
    UPDATE,
    DELETE;

    /**
     * Maps a Debezium {@code op} code to an event type. Snapshot reads ({@code r})
     * are treated as inserts.
     *
     * @return the event type, or {@code null} for unknown codes
     */
    public static ChangeEventType fromOperation(String op) {
        if (op == null) {
            return null;
        }
        return switch (op) {
            case "c", "r" -> INSERT;
            case "u" -> UPDATE;
            case "d" -> DELETE;
            default -> null;
        };
    }
}
