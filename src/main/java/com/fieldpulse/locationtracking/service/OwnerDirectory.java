package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.dto.OwnerScope;

import java.util.Optional;

/**
 * Lookup into the user directory. Tracking only needs to know that a user exists
 * and which organisation / branch they belong to.
 */
public interface OwnerDirectory {

    Optional<OwnerScope> find(Long ownerId);
}
