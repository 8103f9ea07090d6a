package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Advisory metrics derived from a trip summary and its stops.
 * Nothing here feeds back into the summary or stop values.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackingInsights {

    private EfficiencyRating efficiencyRating;
    private int productivityScore;
    private int productiveStops;
    private TravelOptimization travelOptimization;

    @Builder.Default
    private List<KeyLocation> keyLocations = new ArrayList<>();

    private TravelEfficiency travelEfficiency;
    private RouteOptimization routeOptimization;
    private MovementPattern movementPatterns;

}
