package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MultiUserReport {

    private String timeframe;
    private ReportPeriod period;
    private int requestedUsers;
    private int totalUsers;
    private int totalPoints;

    @Builder.Default
    private List<TrackingReport> users = new ArrayList<>();

    private OrganizationSummary organizationSummary;

}
