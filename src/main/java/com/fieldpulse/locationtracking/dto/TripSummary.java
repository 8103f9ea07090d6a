package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Distance and time totals for one ordered run of points.
 * movingTimeMinutes + stoppedTimeMinutes == totalTimeMinutes.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TripSummary {

    private double totalDistanceKm;
    private String formattedDistance;
    private long totalTimeMinutes;
    private long movingTimeMinutes;
    private long stoppedTimeMinutes;
    private double averageSpeedKmh;
    private double maxSpeedKmh;
    private int numberOfStops;

    // address -> minutes
    @Builder.Default
    private Map<String, Double> locationTimeSpent = new LinkedHashMap<>();

    private int pointsUsed;
    private int pointsFiltered;
    private AccuracyInfo accuracyInfo;

}
