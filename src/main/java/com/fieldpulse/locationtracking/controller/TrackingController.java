package com.fieldpulse.locationtracking.controller;

import com.fieldpulse.locationtracking.config.SwaggerConfig;
import com.fieldpulse.locationtracking.dto.ApiResponse;
import com.fieldpulse.locationtracking.dto.BackfillSummary;
import com.fieldpulse.locationtracking.dto.BatchIngestResult;
import com.fieldpulse.locationtracking.dto.IngestResult;
import com.fieldpulse.locationtracking.dto.MultiUserReport;
import com.fieldpulse.locationtracking.dto.MultiUserReportRequest;
import com.fieldpulse.locationtracking.dto.RecalculationResult;
import com.fieldpulse.locationtracking.dto.StopEventRequest;
import com.fieldpulse.locationtracking.dto.Timeframe;
import com.fieldpulse.locationtracking.dto.TrackingPointRequest;
import com.fieldpulse.locationtracking.dto.TrackingPointView;
import com.fieldpulse.locationtracking.dto.TrackingReport;
import com.fieldpulse.locationtracking.service.TrackingAnalyticsService;
import com.fieldpulse.locationtracking.service.TrackingIngestionService;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

/**
 * REST surface for device uploads, tracking reports and point administration.
 */
@RestController
@RequestMapping("/api/tracking")
@RequiredArgsConstructor
@Slf4j
public class TrackingController {

    private final TrackingIngestionService trackingIngestionService;
    private final TrackingAnalyticsService trackingAnalyticsService;

    /**
     * Single location fix from a device.
     * 201 when stored; 200 with warnings when the fix was deliberately not stored
     * (virtual location, poor accuracy, rate limited).
     */
    @Tag(name = SwaggerConfig.TAG_INGESTION)
    @PostMapping
    public ResponseEntity<ApiResponse> create(@Valid @RequestBody TrackingPointRequest request,
                                              @RequestParam(required = false) Long branchId,
                                              @RequestParam(name = "orgId", required = false) Long organisationId) {
        log.debug("Location fix received for user {}", request.getOwner());
        IngestResult result = trackingIngestionService.ingest(request, branchId, organisationId);
        return ResponseEntity.status(result.isStored() ? HttpStatus.CREATED : HttpStatus.OK).body(toResponse(result));
    }

    /**
     * Buffered fixes uploaded after the device was offline. Items are handled in
     * timestamp order and one bad item never aborts the rest.
     */
    @Tag(name = SwaggerConfig.TAG_INGESTION)
    @PostMapping("/batch")
    public ResponseEntity<ApiResponse> createBatch(@RequestBody List<@Valid TrackingPointRequest> requests,
                                                   @RequestParam(required = false) Long branchId,
                                                   @RequestParam(name = "orgId", required = false) Long organisationId) {
        BatchIngestResult result = trackingIngestionService.ingestBatch(requests, branchId, organisationId);
        return ResponseEntity.ok(ApiResponse.success(result,
                "Batch processed: " + result.getStored() + "/" + result.getTotal() + " stored"));
    }

    @Tag(name = SwaggerConfig.TAG_INGESTION)
    @PostMapping("/stops")
    public ResponseEntity<ApiResponse> createStopEvent(@Valid @RequestBody StopEventRequest request,
                                                       @RequestParam(required = false) Long branchId,
                                                       @RequestParam(name = "orgId", required = false) Long organisationId) {
        IngestResult result = trackingIngestionService.recordStopEvent(request, branchId, organisationId);
        return ResponseEntity.status(result.isStored() ? HttpStatus.CREATED : HttpStatus.OK).body(toResponse(result));
    }

    @Tag(name = SwaggerConfig.TAG_REPORTS)
    @GetMapping("/stops/{userId}")
    public ResponseEntity<ApiResponse> getStopEvents(@PathVariable Long userId) {
        List<TrackingPointView> stops = trackingAnalyticsService.findStopEvents(userId);
        return ResponseEntity.ok(ApiResponse.success(stops, "Stop events retrieved successfully"));
    }

    @Tag(name = SwaggerConfig.TAG_REPORTS)
    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse> getOne(@PathVariable Long id) {
        TrackingPointView point = trackingAnalyticsService.findOne(id);
        return ResponseEntity.ok(ApiResponse.success(point, "Tracking point retrieved successfully"));
    }

    @Tag(name = SwaggerConfig.TAG_REPORTS)
    @GetMapping("/for/{userId}")
    public ResponseEntity<ApiResponse> getForUser(@PathVariable Long userId) {
        List<TrackingPointView> points = trackingAnalyticsService.findByOwner(userId);
        return ResponseEntity.ok(ApiResponse.success(points, "Tracking points retrieved successfully"));
    }

    // ═══════════════════════════════════════════════════════════════════
    // Reports
    // ═══════════════════════════════════════════════════════════════════

    @Tag(name = SwaggerConfig.TAG_REPORTS)
    @GetMapping("/daily/{userId}")
    public ResponseEntity<ApiResponse> getDaily(@PathVariable Long userId,
                                                @RequestParam(required = false)
                                                @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        TrackingReport report = trackingAnalyticsService.getDailyReport(userId, date);
        return ResponseEntity.ok(ApiResponse.success(report, "Daily tracking report generated successfully"));
    }

    @Tag(name = SwaggerConfig.TAG_REPORTS)
    @GetMapping("/user/{userId}/timeframe/{timeframe}")
    public ResponseEntity<ApiResponse> getByTimeframe(@PathVariable Long userId,
                                                      @PathVariable String timeframe,
                                                      @RequestParam(required = false)
                                                      @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                                      @RequestParam(required = false)
                                                      @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
                                                      @RequestParam(name = "orgId", required = false) Long organisationId,
                                                      @RequestParam(required = false) Long branchId) {
        Timeframe resolved = Timeframe.fromValue(timeframe);
        TrackingReport report = trackingAnalyticsService.getReport(
                userId, resolved, startDate, endDate, organisationId, branchId);
        return ResponseEntity.ok(ApiResponse.success(report,
                "Tracking report for " + resolved.getValue() + " generated successfully"));
    }

    @Tag(name = SwaggerConfig.TAG_REPORTS)
    @GetMapping("/user/{userId}/custom-range")
    public ResponseEntity<ApiResponse> getCustomRange(@PathVariable Long userId,
                                                      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
                                                      @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
                                                      @RequestParam(name = "orgId", required = false) Long organisationId,
                                                      @RequestParam(required = false) Long branchId) {
        TrackingReport report = trackingAnalyticsService.getReport(
                userId, Timeframe.CUSTOM, startDate, endDate, organisationId, branchId);
        return ResponseEntity.ok(ApiResponse.success(report, "Custom range tracking report generated successfully"));
    }

    @Tag(name = SwaggerConfig.TAG_REPORTS)
    @PostMapping("/multi-user/timeframe/{timeframe}")
    public ResponseEntity<ApiResponse> getMultiUser(@PathVariable String timeframe,
                                                    @Valid @RequestBody MultiUserReportRequest request) {
        MultiUserReport report = trackingAnalyticsService.getMultiUserReport(
                request.getUserIds(), Timeframe.fromValue(timeframe), request.getStartDate(), request.getEndDate(),
                request.getOrganisationId(), request.getBranchId());
        return ResponseEntity.ok(ApiResponse.success(report,
                "Tracking reports generated for " + report.getTotalUsers() + " of " + report.getRequestedUsers() + " users"));
    }

    // ═══════════════════════════════════════════════════════════════════
    // Maintenance
    // ═══════════════════════════════════════════════════════════════════

    @Tag(name = SwaggerConfig.TAG_MAINTENANCE)
    @PostMapping("/geocoding/backfill")
    public ResponseEntity<ApiResponse> backfillAddresses(@RequestParam(required = false) Long userId,
                                                         @RequestParam(required = false) Integer limit) {
        BackfillSummary summary = trackingAnalyticsService.bulkBackfill(userId, limit);
        String message = summary.getMessage() != null ? summary.getMessage()
                : "Geocoded " + summary.getSuccessful() + " of " + summary.getProcessed() + " tracking points";
        return ResponseEntity.ok(ApiResponse.success(summary, message));
    }

    @Tag(name = SwaggerConfig.TAG_MAINTENANCE)
    @PostMapping("/re-cal/{userId}")
    public ResponseEntity<ApiResponse> recalculate(@PathVariable Long userId,
                                                   @RequestParam(required = false)
                                                   @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        RecalculationResult result = trackingAnalyticsService.recalculateForDay(userId, date);
        return ResponseEntity.ok(ApiResponse.success(result, result.getMessage()));
    }

    @Tag(name = SwaggerConfig.TAG_MAINTENANCE)
    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse> delete(@PathVariable Long id,
                                              @RequestParam(required = false) String deletedBy) {
        trackingAnalyticsService.softDelete(id, deletedBy);
        return ResponseEntity.ok(ApiResponse.success(null, "Tracking point deleted successfully"));
    }

    @Tag(name = SwaggerConfig.TAG_MAINTENANCE)
    @PatchMapping("/restore/{id}")
    public ResponseEntity<ApiResponse> restore(@PathVariable Long id) {
        trackingAnalyticsService.restore(id);
        return ResponseEntity.ok(ApiResponse.success(null, "Tracking point restored successfully"));
    }

    private ApiResponse toResponse(IngestResult result) {
        return ApiResponse.builder()
                .success(true)
                .message(result.getMessage())
                .data(result.getData())
                .warnings(result.getWarnings())
                .build();
    }
}
