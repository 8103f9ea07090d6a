package com.fieldpulse.locationtracking.repository;

import com.fieldpulse.locationtracking.entity.TrackedUser;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for TrackedUser entity
 */
@Repository
public interface TrackedUserRepository extends JpaRepository<TrackedUser, Long> {
}
