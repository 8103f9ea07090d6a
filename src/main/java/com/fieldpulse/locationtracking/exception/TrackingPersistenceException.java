package com.fieldpulse.locationtracking.exception;

/**
 * Storage rejected a write. Wraps the underlying data-access failure.
 */
public class TrackingPersistenceException extends RuntimeException {

    public TrackingPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
