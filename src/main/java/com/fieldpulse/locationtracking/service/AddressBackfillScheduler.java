package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.dto.BackfillSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically resolves addresses for points stored while geocoding was down
 * or skipped by the circuit breaker. Enabled with
 * {@code tracking.geocoding.backfill.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "tracking.geocoding.backfill.enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class AddressBackfillScheduler {

    private final TrackingAnalyticsService trackingAnalyticsService;

    @Scheduled(fixedDelayString = "#{${tracking.geocoding.backfill.interval-minutes:15} * 60000}",
               initialDelayString = "60000")
    public void backfillPendingAddresses() {
        try {
            BackfillSummary summary = trackingAnalyticsService.bulkBackfill(null, null);
            if (summary.getProcessed() > 0) {
                log.info("[BACKFILL] {} points processed, {} resolved, {} failed{}",
                        summary.getProcessed(), summary.getSuccessful(), summary.getFailed(),
                        summary.isCircuitOpen() ? " (circuit open)" : "");
            }
        } catch (RuntimeException e) {
            log.error("[BACKFILL] Scheduled address backfill failed", e);
        }
    }
}
