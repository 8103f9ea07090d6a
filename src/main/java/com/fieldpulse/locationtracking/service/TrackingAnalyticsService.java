package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.cache.AnalyticsCache;
import com.fieldpulse.locationtracking.dto.BackfillSummary;
import com.fieldpulse.locationtracking.dto.GeocodingStatus;
import com.fieldpulse.locationtracking.dto.MultiUserReport;
import com.fieldpulse.locationtracking.dto.OwnerScope;
import com.fieldpulse.locationtracking.dto.RecalculationResult;
import com.fieldpulse.locationtracking.dto.ReportPeriod;
import com.fieldpulse.locationtracking.dto.StopAnalysis;
import com.fieldpulse.locationtracking.dto.Timeframe;
import com.fieldpulse.locationtracking.dto.TrackingPointView;
import com.fieldpulse.locationtracking.dto.TrackingRecalculatedEvent;
import com.fieldpulse.locationtracking.dto.TrackingReport;
import com.fieldpulse.locationtracking.dto.TripSummary;
import com.fieldpulse.locationtracking.entity.TrackingPoint;
import com.fieldpulse.locationtracking.exception.OwnerNotFoundException;
import com.fieldpulse.locationtracking.exception.TrackingPointNotFoundException;
import com.fieldpulse.locationtracking.repository.TrackingPointRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Read side of tracking: reports, recalculation, address backfill and point administration.
 *
 * Report pipeline for one user and period:
 *   1. confirm the user, work out the period
 *   2. cached report? return it (1 h, dropped whenever the user sends a point)
 *   3. load points oldest first, skipping deleted ones and virtual coordinates
 *   4. backfill missing addresses; anything still unresolved shows as "lat, lon"
 *   5. trip summary, stops, headline numbers, insights
 */
@Service
@Slf4j
public class TrackingAnalyticsService implements TrackingReportFeed {

    private final TrackingPointRepository trackingPointRepository;
    private final OwnerDirectory ownerDirectory;
    private final LocationValidator locationValidator;
    private final GeocodeResolver geocodeResolver;
    private final TripAnalyzer tripAnalyzer;
    private final StopDetector stopDetector;
    private final AnalyticsAggregator analyticsAggregator;
    private final AnalyticsCache analyticsCache;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor analyticsExecutor;
    private final Clock clock;

    @Value("${tracking.analytics.max-users:100}")
    private int maxUsers = 100;

    @Value("${tracking.geocoding.backfill.limit:100}")
    private int defaultBackfillLimit = 100;

    public TrackingAnalyticsService(TrackingPointRepository trackingPointRepository,
                                    OwnerDirectory ownerDirectory,
                                    LocationValidator locationValidator,
                                    GeocodeResolver geocodeResolver,
                                    TripAnalyzer tripAnalyzer,
                                    StopDetector stopDetector,
                                    AnalyticsAggregator analyticsAggregator,
                                    AnalyticsCache analyticsCache,
                                    ApplicationEventPublisher eventPublisher,
                                    @Qualifier("analyticsTaskExecutor") Executor analyticsExecutor,
                                    Clock clock) {
        this.trackingPointRepository = trackingPointRepository;
        this.ownerDirectory = ownerDirectory;
        this.locationValidator = locationValidator;
        this.geocodeResolver = geocodeResolver;
        this.tripAnalyzer = tripAnalyzer;
        this.stopDetector = stopDetector;
        this.analyticsAggregator = analyticsAggregator;
        this.analyticsCache = analyticsCache;
        this.eventPublisher = eventPublisher;
        this.analyticsExecutor = analyticsExecutor;
        this.clock = clock;
    }

    // ═══════════════════════════════════════════════════════════════════
    // Reports
    // ═══════════════════════════════════════════════════════════════════

    @Override
    public TrackingReport getReport(Long ownerId, Timeframe timeframe, LocalDate startDate, LocalDate endDate,
                                    Long organisationId, Long branchId) {
        OwnerScope owner = requireOwner(ownerId);
        ReportPeriod period = timeframe.resolve(clock, startDate, endDate);
        String reportName = timeframe.getValue() + ":" + period.getStart().toEpochMilli() + "-"
                + period.getEnd().toEpochMilli() + ":" + organisationId + ":" + branchId;

        String cacheKey = analyticsCache.keyFor(ownerId, reportName);
        TrackingReport cached = analyticsCache.get(cacheKey).orElse(null);
        if (cached != null) {
            log.debug("[CACHE HIT] {} report for user {}", timeframe.getValue(), ownerId);
            return cached;
        }

        long started = System.currentTimeMillis();
        List<TrackingPoint> points = withoutVirtual(trackingPointRepository.findInRange(
                ownerId, period.getStart(), period.getEnd(), organisationId, branchId));

        TrackingReport report = compose(owner, timeframe.getValue(), period, null, points);
        analyticsCache.put(cacheKey, report);

        log.info("Built {} report for user {}: {} points in {}ms",
                timeframe.getValue(), ownerId, points.size(), System.currentTimeMillis() - started);
        return report;
    }

    @Override
    public TrackingReport getDailyReport(Long ownerId, LocalDate date) {
        OwnerScope owner = requireOwner(ownerId);
        LocalDate day = date != null ? date : LocalDate.now(clock);
        ReportPeriod period = Timeframe.days(day, day, clock.getZone());

        String cacheKey = analyticsCache.keyFor(ownerId, "daily:" + day);
        TrackingReport cached = analyticsCache.get(cacheKey).orElse(null);
        if (cached != null) {
            log.debug("[CACHE HIT] daily report for user {} on {}", ownerId, day);
            return cached;
        }

        List<TrackingPoint> points = withoutVirtual(trackingPointRepository.findInRange(
                ownerId, period.getStart(), period.getEnd(), null, null));
        TrackingReport report = compose(owner, "daily", period, day, points);
        analyticsCache.put(cacheKey, report);
        return report;
    }

    /**
     * Reports for up to {@code tracking.analytics.max-users} users, built in parallel.
     * A user whose report fails is left out and logged.
     */
    public MultiUserReport getMultiUserReport(List<Long> userIds, Timeframe timeframe, LocalDate startDate,
                                              LocalDate endDate, Long organisationId, Long branchId) {
        if (userIds == null || userIds.isEmpty()) {
            throw new IllegalArgumentException("At least one user ID is required");
        }
        if (userIds.size() > maxUsers) {
            throw new IllegalArgumentException("Maximum of " + maxUsers + " users can be processed at once");
        }
        ReportPeriod period = timeframe.resolve(clock, startDate, endDate);
        Set<Long> distinctIds = new LinkedHashSet<>(userIds);
        log.info("Building {} reports for {} users", timeframe.getValue(), distinctIds.size());

        List<Long> ids = new ArrayList<>(distinctIds);
        List<CompletableFuture<TrackingReport>> futures = new ArrayList<>(ids.size());
        for (Long id : ids) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> getReport(id, timeframe, startDate, endDate, organisationId, branchId), analyticsExecutor));
        }

        List<TrackingReport> reports = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            try {
                reports.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Skipping user {} in multi-user report: {}", ids.get(i), cause.getMessage());
            }
        }

        return MultiUserReport.builder()
                .timeframe(timeframe.getValue())
                .period(period)
                .requestedUsers(distinctIds.size())
                .totalUsers(reports.size())
                .totalPoints(reports.stream().mapToInt(TrackingReport::getTotalPoints).sum())
                .users(reports)
                .organizationSummary(analyticsAggregator.organizationSummary(reports))
                .build();
    }

    /**
     * Recomputes one day from scratch: cached reports are dropped, every stored point
     * of the day is re-read, and the number of virtual points left out is reported.
     */
    public RecalculationResult recalculateForDay(Long ownerId, LocalDate date) {
        OwnerScope owner = requireOwner(ownerId);
        LocalDate day = date != null ? date : LocalDate.now(clock);
        ReportPeriod period = Timeframe.days(day, day, clock.getZone());
        log.info("Recalculating tracking data for user {} on {}", ownerId, day);

        List<TrackingPoint> all = trackingPointRepository.findInRange(
                ownerId, period.getStart(), period.getEnd(), null, null);
        List<TrackingPoint> real = withoutVirtual(all);
        int removed = all.size() - real.size();

        RecalculationResult.RecalculationResultBuilder result = RecalculationResult.builder()
                .originalPointsCount(all.size())
                .filteredPointsCount(real.size())
                .virtualPointsRemoved(removed)
                .recalculatedAt(Instant.now(clock));

        if (all.isEmpty()) {
            return result.message("No tracking data found for the specified date").build();
        }
        if (real.isEmpty()) {
            return result.message("All tracking points for this date were virtual locations and have been filtered out")
                    .build();
        }

        analyticsCache.invalidate(ownerId);
        TrackingReport report = compose(owner, "daily", period, day, real);
        analyticsCache.put(analyticsCache.keyFor(ownerId, "daily:" + day), report);

        RecalculationResult recalculated = result
                .message("Tracking data recalculated successfully with virtual locations filtered out")
                .report(report)
                .build();

        try {
            eventPublisher.publishEvent(new TrackingRecalculatedEvent(ownerId, day, recalculated));
        } catch (RuntimeException e) {
            log.error("Report refresh after recalculation failed for user {} on {}", ownerId, day, e);
        }

        log.info("Recalculated user {} on {}: {} points, {} virtual removed, {} km, {} stops",
                ownerId, day, real.size(), removed,
                report.getTripSummary().getTotalDistanceKm(), report.getStops().size());
        return recalculated;
    }

    // ═══════════════════════════════════════════════════════════════════
    // Address backfill
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Resolves addresses for up to {@code limit} unaddressed points, newest first,
     * optionally for one user only.
     */
    public BackfillSummary bulkBackfill(Long ownerId, Integer limit) {
        int size = limit != null ? limit : defaultBackfillLimit;
        if (size < 1 || size > 1000) {
            throw new IllegalArgumentException("Limit must be between 1 and 1000");
        }
        log.info("Starting bulk geocoding{} (limit {})", ownerId != null ? " for user " + ownerId : "", size);

        PageRequest page = PageRequest.of(0, size);
        List<TrackingPoint> points = ownerId != null
                ? trackingPointRepository.findByOwnerIdAndAddressIsNullAndDeletedAtIsNullOrderByCapturedAtDesc(ownerId, page)
                : trackingPointRepository.findByAddressIsNullAndDeletedAtIsNullOrderByCapturedAtDesc(page);

        List<TrackingPoint> candidates = new ArrayList<>(withoutVirtual(points));
        if (candidates.isEmpty()) {
            return BackfillSummary.empty("No tracking points found that need geocoding", 0);
        }
        candidates.sort(Comparator.comparing(TrackingPoint::getCapturedAt));

        BackfillSummary summary = geocodeResolver.backfill(candidates);
        candidates.stream().map(TrackingPoint::getOwnerId).distinct().forEach(analyticsCache::invalidate);

        log.info("Bulk geocoding finished: {} processed, {} resolved, {} failed, {} skipped",
                summary.getProcessed(), summary.getSuccessful(), summary.getFailed(), summary.getSkipped());
        return summary;
    }

    // ═══════════════════════════════════════════════════════════════════
    // Point administration
    // ═══════════════════════════════════════════════════════════════════

    public TrackingPointView findOne(Long id) {
        TrackingPoint point = trackingPointRepository.findByIdAndDeletedAtIsNull(id)
                .orElseThrow(() -> new TrackingPointNotFoundException(id));
        if (point.getAddress() == null) {
            geocodeResolver.backfill(List.of(point));
        }
        return TrackingPointView.from(point);
    }

    public List<TrackingPointView> findByOwner(Long ownerId) {
        requireOwner(ownerId);
        List<TrackingPoint> points = withoutVirtual(
                trackingPointRepository.findByOwnerIdAndDeletedAtIsNullOrderByCapturedAtAsc(ownerId));
        if (!points.isEmpty()) {
            geocodeResolver.backfill(points);
        }
        return points.stream().map(TrackingPointView::from).collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<TrackingPointView> findStopEvents(Long ownerId) {
        requireOwner(ownerId);
        return withoutVirtual(trackingPointRepository.findByOwnerIdAndStopEventTrueAndDeletedAtIsNullOrderByCapturedAtAsc(ownerId))
                .stream()
                .map(TrackingPointView::from)
                .collect(Collectors.toList());
    }

    @Transactional
    public void softDelete(Long id, String deletedBy) {
        TrackingPoint point = trackingPointRepository.findByIdAndDeletedAtIsNull(id)
                .orElseThrow(() -> new TrackingPointNotFoundException(id));
        point.setDeletedAt(Instant.now(clock));
        point.setDeletedBy(deletedBy != null ? deletedBy : "system");
        trackingPointRepository.save(point);
        analyticsCache.invalidate(point.getOwnerId());
        log.info("Tracking point {} deleted by {}", id, point.getDeletedBy());
    }

    @Transactional
    public void restore(Long id) {
        TrackingPoint point = trackingPointRepository.findById(id)
                .orElseThrow(() -> new TrackingPointNotFoundException(id));
        point.setDeletedAt(null);
        point.setDeletedBy(null);
        trackingPointRepository.save(point);
        analyticsCache.invalidate(point.getOwnerId());
        log.info("Tracking point {} restored", id);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════════

    private TrackingReport compose(OwnerScope owner, String timeframe, ReportPeriod period, LocalDate date,
                                   List<TrackingPoint> points) {
        if (!points.isEmpty()) {
            geocodeResolver.backfill(points);
        }

        List<TrackingPointView> views = points.stream()
                .map(TrackingPointView::from)
                .map(TrackingPointView::withDisplayAddress)
                .collect(Collectors.toList());

        int unresolved = (int) views.stream().filter(TrackingPointView::isFallbackAddress).count();
        if (unresolved > 0) {
            log.warn("No address for {} of {} points of user {}, showing coordinates instead",
                    unresolved, views.size(), owner.getUid());
        }

        TripSummary trip = tripAnalyzer.analyze(views);
        StopAnalysis stopAnalysis = stopDetector.detect(views);
        trip.setNumberOfStops(stopAnalysis.getStops().size());

        return TrackingReport.builder()
                .user(owner)
                .timeframe(timeframe)
                .period(period)
                .date(date)
                .totalPoints(views.size())
                .trackingPoints(views)
                .analytics(analyticsAggregator.headline(trip, views))
                .tripSummary(trip)
                .stops(stopAnalysis.getStops())
                .locationAnalysis(analyticsAggregator.locationAnalysis(trip, stopAnalysis))
                .insights(analyticsAggregator.insights(trip, stopAnalysis, views, clock.getZone()))
                .geocodingStatus(GeocodingStatus.builder()
                        .successful(views.size() - unresolved)
                        .failed(unresolved)
                        .usedFallback(unresolved > 0)
                        .build())
                .generatedAt(Instant.now(clock))
                .build();
    }

    private List<TrackingPoint> withoutVirtual(List<TrackingPoint> points) {
        return points.stream()
                .filter(p -> !locationValidator.isVirtual(p.getLatitude(), p.getLongitude()))
                .collect(Collectors.toList());
    }

    private OwnerScope requireOwner(Long ownerId) {
        return ownerDirectory.find(ownerId).orElseThrow(() -> new OwnerNotFoundException(ownerId));
    }
}
