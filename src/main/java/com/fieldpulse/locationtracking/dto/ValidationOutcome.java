package com.fieldpulse.locationtracking.dto;

/**
 * Verdict of the location validator for a candidate sample.
 */
public enum ValidationOutcome {
    ACCEPT,
    REJECT_VIRTUAL,
    REJECT_INACCURATE,
    REJECT_OUT_OF_RANGE
}
