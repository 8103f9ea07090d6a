package com.fieldpulse.locationtracking.dto;

import jakarta.validation.constraints.NotNull;
import lombok.*;

/**
 * A stop detected on the device itself and reported as one event.
 * Times are epoch milliseconds, duration is milliseconds.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StopEventRequest {

    @NotNull(message = "Owner is required")
    private Long owner;

    @NotNull(message = "Latitude is required")
    private Double latitude;

    @NotNull(message = "Longitude is required")
    private Double longitude;

    @NotNull(message = "Start time is required")
    private Long startTime;

    @NotNull(message = "End time is required")
    private Long endTime;

    private Long duration;

    private String address;

}
