package com.fieldpulse.locationtracking.exception;

/**
 * Sample cannot be stored: coordinates missing, malformed or out of range.
 * Retrying the same payload will fail the same way.
 */
public class InvalidLocationException extends RuntimeException {

    public InvalidLocationException(String message) {
        super(message);
    }
}
