package com.marketplace.realtime.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A client's request for a provider's listing.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "listing_requests")
public class ListingRequest {

    @Id
    private String id;

    @Column(nullable = false)
    private String clientId;

    @Column(nullable = false)
    private String providerId;

    private String listingId;

    @Column(nullable = false, length = 40)
    private RequestStatus status = RequestStatus.PENDING;

    @Column(nullable = false)
    private Instant createdAt;

    private Instant updatedAt;

    private LocalDate preferredDate;

    // "HH:mm", free text from the booking form
    @Column(length = 16)
    private String preferredTime;

    @Column(length = 1024)
    private String providerResponse;

    @Column(length = 4096)
    private String completionDescription;

    // JSON array of photo URLs
    @Column(length = 4096)
    private String completionPhotos;

    public ListingRequest(String id, String clientId, String providerId, String listingId, Instant createdAt) {
        this.id = id;
        this.clientId = clientId;
        this.providerId = providerId;
        this.listingId = listingId;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
    }
}
