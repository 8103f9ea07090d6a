package com.fieldpulse.locationtracking.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HourlyMovement {

    private int hour;
    private double distanceKm;
    private int segments;

}
