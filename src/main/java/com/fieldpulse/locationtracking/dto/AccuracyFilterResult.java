package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccuracyFilterResult {

    private List<TrackingPointView> keptPoints;
    private int originalCount;
    private int inaccurateCount;
    private AccuracyInfo accuracyInfo;

}
