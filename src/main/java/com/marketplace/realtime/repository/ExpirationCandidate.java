package com.marketplace.realtime.repository;

import java.time.LocalDate;

/**
 * Columns the expiration sweep needs from a request and its listing.
 */
public record ExpirationCandidate(
        String id,
        String clientId,
        String providerId,
        String listingTitle,
        LocalDate preferredDate,
        String preferredTime
) {
}
