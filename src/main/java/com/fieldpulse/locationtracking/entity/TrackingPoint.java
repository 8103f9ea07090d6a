package com.fieldpulse.locationtracking.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One GPS sample reported by a field device.
 *
 * Created by the ingestion pipeline with no address; the address (or the
 * reason it could not be resolved) is attached later by the geocode backfill.
 * Rows are soft-deleted only.
 */
@Entity
@Table(name = "tracking_points", indexes = {
        @Index(name = "idx_tracking_owner_captured", columnList = "ownerId, capturedAt"),
        @Index(name = "idx_tracking_address", columnList = "address")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackingPoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long ownerId;

    @Column(nullable = false)
    private Double latitude;

    @Column(nullable = false)
    private Double longitude;

    private Double accuracy;       // meters

    private Double speed;          // km/h

    private Double heading;        // degrees

    private Double altitude;

    private Double altitudeAccuracy;

    // Device time; never rewritten once persisted
    @Column(nullable = false, updatable = false)
    private Instant capturedAt;

    // Server time
    @Column(nullable = false, updatable = false)
    private Instant receivedAt;

    @Column(columnDefinition = "TEXT")
    private String address;

    @Column(columnDefinition = "TEXT")
    private String addressDecodingError;

    // "lat,lon" as received, kept as a display fallback
    private String rawLocation;

    private Long organisationId;

    private Long branchId;

    // Device-reported stop events
    @Builder.Default
    @Column(nullable = false)
    private boolean stopEvent = false;

    private Instant stopStartedAt;

    private Instant stopEndedAt;

    private Long stopDurationMinutes;

    private Instant deletedAt;

    private String deletedBy;

    /**
     * Attaches a resolved address. Clears any earlier resolution error.
     */
    public void markResolved(String resolvedAddress) {
        this.address = resolvedAddress;
        this.addressDecodingError = null;
    }

    /**
     * Records why the address could not be resolved. Never overwrites a resolved address.
     */
    public void markUnresolved(String error) {
        if (this.address == null) {
            this.addressDecodingError = error;
        }
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

}
