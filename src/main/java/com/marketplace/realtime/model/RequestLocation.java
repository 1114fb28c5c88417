package com.marketplace.realtime.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Live position a participant shares while a request is in progress.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "request_locations")
public class RequestLocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String requestId;

    @Column(nullable = false)
    private String userId;

    private double latitude;

    private double longitude;

    private Double accuracy;

    private Double heading;

    private Double speed;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    private Instant updatedAt;
}
