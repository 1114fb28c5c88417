package com.marketplace.realtime.service;

import com.marketplace.realtime.model.RequestStatus;

import java.time.Instant;

/**
 * A request the sweep cancelled, with what changed.
 */
public record ExpiredRequest(
        String requestId,
        String clientId,
        String providerId,
        RequestStatus previousStatus,
        RequestStatus newStatus,
        String providerResponse,
        Instant updatedAt
) {
}
