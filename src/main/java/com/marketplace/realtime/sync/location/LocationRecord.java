package com.marketplace.realtime.sync.location;

import com.marketplace.realtime.feed.Row;
import com.marketplace.realtime.model.RequestLocation;

import java.time.Instant;

public record LocationRecord(
        String userId,
        String requestId,
        double latitude,
        double longitude,
        Double accuracy,
        Double heading,
        Double speed,
        boolean active,
        Instant updatedAt
) {

    public static LocationRecord fromRow(Row row) {
        Double latitude = row.getDouble("latitude");
        Double longitude = row.getDouble("longitude");
        return new LocationRecord(
                row.getString("user_id"),
                row.getString("request_id"),
                latitude != null ? latitude : 0d,
                longitude != null ? longitude : 0d,
                row.getDouble("accuracy"),
                row.getDouble("heading"),
                row.getDouble("speed"),
                Boolean.TRUE.equals(row.getBoolean("is_active")),
                row.getInstant("updated_at"));
    }

    public static LocationRecord fromEntity(RequestLocation location) {
        return new LocationRecord(
                location.getUserId(),
                location.getRequestId(),
                location.getLatitude(),
                location.getLongitude(),
                location.getAccuracy(),
                location.getHeading(),
                location.getSpeed(),
                location.isActive(),
                location.getUpdatedAt());
    }
}
