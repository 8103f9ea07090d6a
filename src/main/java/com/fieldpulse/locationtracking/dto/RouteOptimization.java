package com.fieldpulse.locationtracking.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RouteOptimization {

    private boolean canOptimize;
    private double currentRouteDistanceKm;
    private double optimizedRouteDistanceKm;
    private double potentialSavingsKm;
    private String recommendation;

}
