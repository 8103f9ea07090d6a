package com.fieldpulse.locationtracking.exception;

public class OwnerNotFoundException extends RuntimeException {

    public OwnerNotFoundException(Long ownerId) {
        super("User with ID " + ownerId + " not found");
    }
}
