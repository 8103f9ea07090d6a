package com.fieldpulse.locationtracking.exception;

public class TrackingPointNotFoundException extends RuntimeException {

    public TrackingPointNotFoundException(Long id) {
        super("Tracking point not found: " + id);
    }
}
