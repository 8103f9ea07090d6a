package com.fieldpulse.locationtracking.cache;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * State of a rate-limit window after one increment attempt.
 */
@Getter
@AllArgsConstructor
@ToString
public class WindowCount {

    private final boolean allowed;
    private final int count;
    private final Instant resetAt;

}
