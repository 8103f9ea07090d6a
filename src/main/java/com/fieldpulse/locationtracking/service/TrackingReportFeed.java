package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.dto.Timeframe;
import com.fieldpulse.locationtracking.dto.TrackingReport;

import java.time.LocalDate;

/**
 * Read-only view of tracking reports for consumers outside this module
 * (daily activity reports, payroll exports). Consumers that need to react to
 * recomputed days listen for {@code TrackingRecalculatedEvent}.
 */
public interface TrackingReportFeed {

    TrackingReport getDailyReport(Long ownerId, LocalDate date);

    TrackingReport getReport(Long ownerId, Timeframe timeframe, LocalDate startDate, LocalDate endDate,
                             Long organisationId, Long branchId);
}
