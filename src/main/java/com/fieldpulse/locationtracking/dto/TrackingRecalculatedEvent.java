package com.fieldpulse.locationtracking.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDate;

/**
 * Published after a day has been recomputed so downstream report stores can refresh.
 */
@Getter
@AllArgsConstructor
public class TrackingRecalculatedEvent {

    private final Long ownerId;
    private final LocalDate date;
    private final RecalculationResult result;

}
