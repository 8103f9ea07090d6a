package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything known about one user's movement in one period.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackingReport {

    private OwnerScope user;
    private String timeframe;
    private ReportPeriod period;

    // set for single-day reports only
    private LocalDate date;

    private int totalPoints;

    @Builder.Default
    private List<TrackingPointView> trackingPoints = new ArrayList<>();

    private TrackingAnalytics analytics;
    private TripSummary tripSummary;

    @Builder.Default
    private List<Stop> stops = new ArrayList<>();

    private LocationAnalysis locationAnalysis;
    private TrackingInsights insights;
    private GeocodingStatus geocodingStatus;
    private Instant generatedAt;

}
