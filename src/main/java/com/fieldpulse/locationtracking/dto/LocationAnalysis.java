package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LocationAnalysis {

    @Builder.Default
    private List<StopLocation> locationsVisited = new ArrayList<>();

    private long averageTimePerLocationMinutes;
    private String averageTimePerLocationFormatted;

    @Builder.Default
    private Map<String, Double> timeSpentByLocation = new LinkedHashMap<>();

}
