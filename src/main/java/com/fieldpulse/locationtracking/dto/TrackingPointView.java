package com.fieldpulse.locationtracking.dto;

import com.fieldpulse.locationtracking.entity.TrackingPoint;
import com.fieldpulse.locationtracking.util.GeoUtil;
import lombok.*;

import java.time.Instant;

/**
 * Read model of a stored point as handed to the analytics core and returned to callers.
 *
 * {@code address} is the display address: the resolved one, or the "lat, lon" label
 * when resolution failed ({@code fallbackAddress} = true). The entity itself is never
 * written with the label.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class TrackingPointView {

    private Long id;
    private Long ownerId;
    private double latitude;
    private double longitude;
    private Double accuracy;
    private Double speed;
    private Double heading;
    private Double altitude;
    private Double altitudeAccuracy;
    private Instant capturedAt;
    private Instant receivedAt;
    private String address;
    private String addressDecodingError;
    private boolean fallbackAddress;
    private String rawLocation;
    private Long organisationId;
    private Long branchId;
    private boolean stopEvent;
    private Instant stopStartedAt;
    private Instant stopEndedAt;
    private Long stopDurationMinutes;

    public static TrackingPointView from(TrackingPoint point) {
        return TrackingPointView.builder()
                .id(point.getId())
                .ownerId(point.getOwnerId())
                .latitude(point.getLatitude())
                .longitude(point.getLongitude())
                .accuracy(point.getAccuracy())
                .speed(point.getSpeed())
                .heading(point.getHeading())
                .altitude(point.getAltitude())
                .altitudeAccuracy(point.getAltitudeAccuracy())
                .capturedAt(point.getCapturedAt())
                .receivedAt(point.getReceivedAt())
                .address(point.getAddress())
                .addressDecodingError(point.getAddressDecodingError())
                .rawLocation(point.getRawLocation())
                .organisationId(point.getOrganisationId())
                .branchId(point.getBranchId())
                .stopEvent(point.isStopEvent())
                .stopStartedAt(point.getStopStartedAt())
                .stopEndedAt(point.getStopEndedAt())
                .stopDurationMinutes(point.getStopDurationMinutes())
                .build();
    }

    /** Same point, with the coordinate label standing in for a missing address. */
    public TrackingPointView withDisplayAddress() {
        if (address != null) {
            return this;
        }
        return toBuilder()
                .address(GeoUtil.coordinateLabel(latitude, longitude))
                .fallbackAddress(true)
                .build();
    }

}
