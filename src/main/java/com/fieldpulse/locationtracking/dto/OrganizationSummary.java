package com.fieldpulse.locationtracking.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrganizationSummary {

    private double totalDistanceKm;
    private long averagePointsPerUser;
    private OwnerScope mostActiveUser;
    private OwnerScope leastActiveUser;

    public static OrganizationSummary empty() {
        return new OrganizationSummary();
    }

}
