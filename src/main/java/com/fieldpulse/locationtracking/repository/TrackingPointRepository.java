package com.fieldpulse.locationtracking.repository;

import com.fieldpulse.locationtracking.entity.TrackingPoint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for TrackingPoint entity
 */
@Repository
public interface TrackingPointRepository extends JpaRepository<TrackingPoint, Long> {

    /**
     * Time-range read used by every analytics query. Scope filters are optional:
     * a null organisation or branch matches every row.
     */
    @Query("SELECT t FROM TrackingPoint t " +
           "WHERE t.ownerId = :ownerId " +
           "AND t.capturedAt BETWEEN :start AND :end " +
           "AND t.deletedAt IS NULL " +
           "AND (:organisationId IS NULL OR t.organisationId = :organisationId) " +
           "AND (:branchId IS NULL OR t.branchId = :branchId) " +
           "ORDER BY t.capturedAt ASC")
    List<TrackingPoint> findInRange(@Param("ownerId") Long ownerId,
                                    @Param("start") Instant start,
                                    @Param("end") Instant end,
                                    @Param("organisationId") Long organisationId,
                                    @Param("branchId") Long branchId);

    Optional<TrackingPoint> findByIdAndDeletedAtIsNull(Long id);

    List<TrackingPoint> findByOwnerIdAndDeletedAtIsNullOrderByCapturedAtAsc(Long ownerId);

    List<TrackingPoint> findByOwnerIdAndStopEventTrueAndDeletedAtIsNullOrderByCapturedAtAsc(Long ownerId);

    // Backfill candidates, newest first
    List<TrackingPoint> findByAddressIsNullAndDeletedAtIsNullOrderByCapturedAtDesc(Pageable pageable);

    List<TrackingPoint> findByOwnerIdAndAddressIsNullAndDeletedAtIsNullOrderByCapturedAtDesc(Long ownerId, Pageable pageable);
}
