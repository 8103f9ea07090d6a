package com.fieldpulse.locationtracking.dto;

import lombok.*;

/**
 * Headline numbers for a report: distance in km, speeds in km/h, times in minutes.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackingAnalytics {

    private double totalDistance;
    private double averageSpeed;
    private double topSpeed;
    private long timeSpentMoving;
    private long timeSpentStationary;
    private int locationsVisited;
    private String mostVisitedLocation;

    public static TrackingAnalytics empty() {
        return new TrackingAnalytics();
    }

}
