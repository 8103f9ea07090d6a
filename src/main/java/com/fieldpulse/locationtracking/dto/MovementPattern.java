package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MovementPattern {

    private String pattern;
    private Integer peakMovementHour;
    private double peakMovementDistanceKm;
    private String analysis;

    // top five hours by distance
    @Builder.Default
    private List<HourlyMovement> hourlyBreakdown = new ArrayList<>();

}
