package com.fieldpulse.locationtracking.dto;

import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StopLocation {

    private String address;
    private double latitude;
    private double longitude;
    private long timeSpentMinutes;
    private String timeSpentFormatted;

    public static StopLocation of(Stop stop) {
        return StopLocation.builder()
                .address(stop.getAddress())
                .latitude(stop.getLatitude())
                .longitude(stop.getLongitude())
                .timeSpentMinutes(stop.getDurationMinutes())
                .timeSpentFormatted(stop.getDurationFormatted())
                .build();
    }

}
