package com.fieldpulse.locationtracking.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TravelEfficiency {

    private EfficiencyRating score;
    private double averageSpeedKmh;
    private double maxSpeedKmh;
    private double movingRatio;

}
