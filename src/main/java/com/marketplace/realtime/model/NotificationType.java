package com.marketplace.realtime.model;

import java.util.Arrays;

public enum NotificationType {
    REQUEST_ACCEPTED("request_accepted"),
    REQUEST_REJECTED("request_rejected"),
    WORK_STARTED("work_started"),
    WORK_COMPLETED("work_completed"),
    CANCELLED_BY_PROVIDER("cancelled_by_provider"),
    REQUEST_EXPIRED("request_expired"),
    NEW_REQUEST("new_request"),
    REQUEST_CANCELLED("request_cancelled"),
    WORK_REMINDER("work_reminder"),
    NEW_MESSAGE("new_message");

    private final String wireValue;

    NotificationType(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static NotificationType fromWire(String value) {
        if (value == null) {
            return null;
        }
        return Arrays.stream(values())
                .filter(type -> type.wireValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown notification type: " + value));
    }

    @Override
    public String toString() {
        return wireValue;
    }
}
