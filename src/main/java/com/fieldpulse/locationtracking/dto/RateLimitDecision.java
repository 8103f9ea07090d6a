package com.fieldpulse.locationtracking.dto;

import lombok.*;

import java.time.Instant;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RateLimitDecision {

    private boolean allowed;
    private int remaining;
    private Instant resetAt;

}
