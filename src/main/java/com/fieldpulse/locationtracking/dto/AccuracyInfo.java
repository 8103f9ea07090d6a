package com.fieldpulse.locationtracking.dto;

import lombok.*;

/** How the accuracy filter classified a set of points. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccuracyInfo {

    private int hasAccuracy;
    private int noAccuracy;
    private int aboveThreshold;

    public static AccuracyInfo none() {
        return new AccuracyInfo(0, 0, 0);
    }

}
