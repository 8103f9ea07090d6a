package com.fieldpulse.locationtracking.dto;

/**
 * Non-fatal outcomes reported back to the device with an ingestion result.
 */
public enum WarningType {

    /** Synthetic test-harness coordinate, discarded. */
    VIRTUAL_LOCATION,

    /** Accuracy missing or above the threshold, discarded. */
    LOW_ACCURACY_GPS,

    /** Owner already sent the maximum number of points in the current window. */
    RATE_LIMIT_EXCEEDED,

    /** Address could not be resolved for the point. */
    GEOCODING_ERROR
}
