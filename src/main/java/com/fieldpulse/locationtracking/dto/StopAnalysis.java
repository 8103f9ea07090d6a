package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StopAnalysis {

    @Builder.Default
    private List<Stop> stops = new ArrayList<>();

    @Builder.Default
    private List<StopLocation> locations = new ArrayList<>();

    private long averageTimeMinutes;
    private String averageTimeFormatted;
    private AccuracyInfo accuracyInfo;
    private int pointsUsed;
    private int pointsFiltered;

}
