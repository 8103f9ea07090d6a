package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.time.Instant;

/**
 * Outcome of recomputing one day. {@code report} is null when the day had no
 * usable points; the counters say why.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecalculationResult {

    private String message;
    private TrackingReport report;
    private int originalPointsCount;
    private int filteredPointsCount;
    private int virtualPointsRemoved;
    private Instant recalculatedAt;

}
