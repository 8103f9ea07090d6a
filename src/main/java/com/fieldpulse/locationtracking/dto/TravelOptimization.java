package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TravelOptimization {

    private double totalTravelDistanceKm;

    // High / Medium / Low, or N/A with fewer than two stops
    private String optimizationScore;

    @Builder.Default
    private List<String> suggestions = new ArrayList<>();

}
