package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Stop {

    private double latitude;
    private double longitude;
    private String address;
    private Instant startTime;
    private Instant endTime;
    private long durationMinutes;
    private String durationFormatted;
    private int pointsCount;

}
