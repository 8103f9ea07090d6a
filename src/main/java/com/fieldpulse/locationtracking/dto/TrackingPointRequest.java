package com.fieldpulse.locationtracking.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

/**
 * GPS sample as sent by a device.
 *
 * Two shapes are accepted: flat latitude/longitude fields, or the nested
 * {@code coords} object produced by the mobile location SDK. Speed is km/h,
 * accuracy and altitude are meters, timestamp is epoch milliseconds and may
 * arrive with a fractional part.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackingPointRequest {

    @NotNull(message = "Owner is required")
    private Long owner;

    private Double latitude;

    private Double longitude;

    private Double accuracy;

    private Double speed;

    private Double heading;

    private Double altitude;

    private Double altitudeAccuracy;

    private Double timestamp;

    private Coordinates coords;

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Coordinates {
        private Double latitude;
        private Double longitude;
        private Double accuracy;
        private Double altitude;
        private Double altitudeAccuracy;
        private Double heading;
        private Double speed;
    }

}
