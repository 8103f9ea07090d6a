package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.time.Instant;

/** Inclusive time window of a report. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReportPeriod {

    private Instant start;
    private Instant end;

}
