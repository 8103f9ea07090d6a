package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.cache.AnalyticsCache;
import com.fieldpulse.locationtracking.dto.BatchIngestResult;
import com.fieldpulse.locationtracking.dto.GeocodeResult;
import com.fieldpulse.locationtracking.dto.IngestResult;
import com.fieldpulse.locationtracking.dto.IngestWarning;
import com.fieldpulse.locationtracking.dto.OwnerScope;
import com.fieldpulse.locationtracking.dto.RateLimitDecision;
import com.fieldpulse.locationtracking.dto.StopEventRequest;
import com.fieldpulse.locationtracking.dto.TrackingPointRequest;
import com.fieldpulse.locationtracking.dto.TrackingPointView;
import com.fieldpulse.locationtracking.dto.ValidationOutcome;
import com.fieldpulse.locationtracking.dto.WarningType;
import com.fieldpulse.locationtracking.entity.TrackingPoint;
import com.fieldpulse.locationtracking.exception.InvalidLocationException;
import com.fieldpulse.locationtracking.exception.OwnerNotFoundException;
import com.fieldpulse.locationtracking.exception.TrackingPersistenceException;
import com.fieldpulse.locationtracking.repository.TrackingPointRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Write side of tracking: takes device samples and stores the ones worth keeping.
 *
 * Per sample:
 *   1. flatten the payload (flat fields or nested coords)
 *   2. range check (client error), virtual marker, accuracy (warnings)
 *   3. confirm the user exists, take org / branch from the request or the directory
 *   4. per-user rate limit (warning)
 *   5. store without an address; geocoding happens when the point is read
 *   6. drop the user's cached reports
 *
 * Unknown users are rejected before the rate limiter so they never open a window.
 * Rejections in 2 and 4 come back as {@code stored=false} plus a warning so a device
 * stream keeps flowing. Only bad input and storage faults throw.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingIngestionService {

    private final TrackingPointRepository trackingPointRepository;
    private final LocationValidator locationValidator;
    private final IngestionRateLimiter rateLimiter;
    private final OwnerDirectory ownerDirectory;
    private final AnalyticsCache analyticsCache;
    private final GeocodeResolver geocodeResolver;
    private final Clock clock;

    @Value("${tracking.batch.max-size:100}")
    private int maxBatchSize = 100;

    // ═══════════════════════════════════════════════════════════════════
    // Single sample
    // ═══════════════════════════════════════════════════════════════════

    @Transactional
    public IngestResult ingest(TrackingPointRequest request, Long branchId, Long organisationId) {
        if (request == null || request.getOwner() == null) {
            throw new InvalidLocationException("User ID is required for tracking");
        }
        Long ownerId = request.getOwner();
        TrackingPointRequest sample = flatten(request);
        double latitude = sample.getLatitude();
        double longitude = sample.getLongitude();

        ValidationOutcome outcome = locationValidator.validate(latitude, longitude, sample.getAccuracy());
        switch (outcome) {
            case REJECT_OUT_OF_RANGE:
                throw new InvalidLocationException("Invalid coordinates provided: " + latitude + ", " + longitude);
            case REJECT_VIRTUAL:
                log.debug("Skipping virtual location {}, {} for user {}", latitude, longitude, ownerId);
                return IngestResult.skipped("Virtual location skipped - not recorded",
                        warning(WarningType.VIRTUAL_LOCATION,
                                "Virtual location with coordinates " + latitude + ", " + longitude + " was skipped",
                                coordinates(latitude, longitude)));
            case REJECT_INACCURATE:
                Map<String, Object> details = coordinates(latitude, longitude);
                details.put("accuracy", sample.getAccuracy());
                details.put("threshold", locationValidator.getMaxAccuracyMeters());
                String reported = sample.getAccuracy() != null ? sample.getAccuracy() + "m" : "unknown";
                log.debug("Skipping low accuracy point ({}) for user {}", reported, ownerId);
                return IngestResult.skipped("Low accuracy GPS point skipped - not recorded",
                        warning(WarningType.LOW_ACCURACY_GPS,
                                "GPS point with accuracy " + reported + " was skipped (threshold: "
                                        + locationValidator.getMaxAccuracyMeters() + "m)",
                                details));
            default:
                break;
        }

        OwnerScope owner = ownerDirectory.find(ownerId).orElseThrow(() -> new OwnerNotFoundException(ownerId));

        RateLimitDecision decision = rateLimiter.checkAndConsume(ownerId);
        if (!decision.isAllowed()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("resetAt", decision.getResetAt());
            details.put("remaining", decision.getRemaining());
            return IngestResult.skipped(
                    "Rate limit exceeded. This point was skipped. Please wait until " + decision.getResetAt()
                            + " before sending more points.",
                    warning(WarningType.RATE_LIMIT_EXCEEDED, "Rate limit exceeded for user " + ownerId, details));
        }

        TrackingPoint point = TrackingPoint.builder()
                .ownerId(ownerId)
                .latitude(latitude)
                .longitude(longitude)
                .accuracy(sample.getAccuracy())
                .speed(sample.getSpeed())
                .heading(sample.getHeading())
                .altitude(sample.getAltitude())
                .altitudeAccuracy(sample.getAltitudeAccuracy())
                .capturedAt(capturedAt(sample.getTimestamp()))
                .receivedAt(Instant.now(clock))
                .rawLocation(latitude + "," + longitude)
                .organisationId(organisationId != null ? organisationId : owner.getOrganisationId())
                .branchId(branchId != null ? branchId : owner.getBranchId())
                .build();

        TrackingPoint saved = persist(point);
        analyticsCache.invalidate(ownerId);

        log.info("Tracking point {} recorded for user {}", saved.getId(), ownerId);
        return IngestResult.builder()
                .stored(true)
                .message("Tracking point created successfully")
                .data(TrackingPointView.from(saved))
                .build();
    }

    // ═══════════════════════════════════════════════════════════════════
    // Buffered upload
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Replays samples a device buffered while offline, oldest first. Each sample
     * goes through {@link #ingest} on its own; one bad sample does not stop the rest.
     * Empty entries in the upload are reported as failed items.
     *
     * Not transactional: every stored sample commits on its own.
     */
    public BatchIngestResult ingestBatch(List<TrackingPointRequest> requests, Long branchId, Long organisationId) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("At least one tracking point is required");
        }
        if (requests.size() > maxBatchSize) {
            throw new IllegalArgumentException("Maximum of " + maxBatchSize + " tracking points per batch");
        }
        log.info("Batch sync started — {} buffered points", requests.size());

        List<TrackingPointRequest> ordered = new ArrayList<>(requests.size());
        int missing = 0;
        for (TrackingPointRequest request : requests) {
            if (request != null) {
                ordered.add(request);
            } else {
                missing++;
            }
        }
        ordered.sort(Comparator.comparing(TrackingPointRequest::getTimestamp,
                Comparator.nullsLast(Comparator.naturalOrder())));

        List<IngestResult> results = new ArrayList<>(ordered.size());
        int stored = 0;
        int skipped = 0;
        int failed = 0;
        for (int i = 0; i < missing; i++) {
            results.add(IngestResult.builder().stored(false).message("Tracking point is required").build());
            failed++;
        }
        for (TrackingPointRequest request : ordered) {
            try {
                IngestResult result = ingest(request, branchId, organisationId);
                results.add(result);
                if (result.isStored()) {
                    stored++;
                } else {
                    skipped++;
                }
            } catch (InvalidLocationException | OwnerNotFoundException | TrackingPersistenceException e) {
                log.warn("Batch point failed — user: {}, ts: {} — {}",
                        request.getOwner(), request.getTimestamp(), e.getMessage());
                results.add(IngestResult.builder().stored(false).message(e.getMessage()).build());
                failed++;
            }
        }

        log.info("Batch sync complete — total: {}, stored: {}, skipped: {}, failed: {}",
                requests.size(), stored, skipped, failed);
        return BatchIngestResult.builder()
                .total(requests.size())
                .stored(stored)
                .skipped(skipped)
                .failed(failed)
                .results(results)
                .build();
    }

    // ═══════════════════════════════════════════════════════════════════
    // Device-reported stops
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Stores a stop the device detected itself. Not rate limited; the address is
     * resolved immediately when the device did not send one.
     */
    @Transactional
    public IngestResult recordStopEvent(StopEventRequest request, Long branchId, Long organisationId) {
        double latitude = request.getLatitude();
        double longitude = request.getLongitude();
        if (locationValidator.isOutOfRange(latitude, longitude)) {
            throw new InvalidLocationException("Invalid coordinates provided: " + latitude + ", " + longitude);
        }
        if (request.getEndTime() < request.getStartTime()) {
            throw new IllegalArgumentException("Stop end time cannot be before its start time");
        }
        if (locationValidator.isVirtual(latitude, longitude)) {
            return IngestResult.skipped("Virtual location skipped - not recorded",
                    warning(WarningType.VIRTUAL_LOCATION,
                            "Virtual stop at " + latitude + ", " + longitude + " was skipped",
                            coordinates(latitude, longitude)));
        }

        Long ownerId = request.getOwner();
        OwnerScope owner = ownerDirectory.find(ownerId).orElseThrow(() -> new OwnerNotFoundException(ownerId));

        List<IngestWarning> warnings = new ArrayList<>();
        String address = StringUtils.hasText(request.getAddress()) ? request.getAddress() : null;
        String addressError = null;
        if (address == null) {
            GeocodeResult geocode = geocodeResolver.resolve(latitude, longitude);
            if (geocode.isResolved()) {
                address = geocode.getAddress();
            } else {
                addressError = geocode.getError();
                warnings.add(warning(WarningType.GEOCODING_ERROR, geocode.getError(), coordinates(latitude, longitude)));
            }
        }

        long durationMs = request.getDuration() != null
                ? request.getDuration()
                : request.getEndTime() - request.getStartTime();

        TrackingPoint point = TrackingPoint.builder()
                .ownerId(ownerId)
                .latitude(latitude)
                .longitude(longitude)
                .capturedAt(Instant.ofEpochMilli(request.getStartTime()))
                .receivedAt(Instant.now(clock))
                .address(address)
                .addressDecodingError(addressError)
                .rawLocation(latitude + "," + longitude)
                .organisationId(organisationId != null ? organisationId : owner.getOrganisationId())
                .branchId(branchId != null ? branchId : owner.getBranchId())
                .stopEvent(true)
                .stopStartedAt(Instant.ofEpochMilli(request.getStartTime()))
                .stopEndedAt(Instant.ofEpochMilli(request.getEndTime()))
                .stopDurationMinutes(Math.round(durationMs / 60000.0))
                .build();

        TrackingPoint saved = persist(point);
        analyticsCache.invalidate(ownerId);

        log.info("Stop event {} recorded for user {} ({} min)", saved.getId(), ownerId, saved.getStopDurationMinutes());
        return IngestResult.builder()
                .stored(true)
                .message("Stop event recorded successfully")
                .data(TrackingPointView.from(saved))
                .warnings(warnings)
                .build();
    }

    // ═══════════════════════════════════════════════════════════════════
    // Helpers
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Mobile SDKs nest the fix under {@code coords}; when the flat fields are missing
     * the nested values are used, including accuracy, speed, heading and altitude.
     */
    static TrackingPointRequest flatten(TrackingPointRequest request) {
        TrackingPointRequest.Coordinates coords = request.getCoords();
        boolean useNested = (request.getLatitude() == null || request.getLongitude() == null) && coords != null;

        TrackingPointRequest flat = useNested
                ? TrackingPointRequest.builder()
                        .owner(request.getOwner())
                        .latitude(coords.getLatitude())
                        .longitude(coords.getLongitude())
                        .accuracy(firstNonNull(coords.getAccuracy(), request.getAccuracy()))
                        .speed(firstNonNull(coords.getSpeed(), request.getSpeed()))
                        .heading(firstNonNull(coords.getHeading(), request.getHeading()))
                        .altitude(firstNonNull(coords.getAltitude(), request.getAltitude()))
                        .altitudeAccuracy(firstNonNull(coords.getAltitudeAccuracy(), request.getAltitudeAccuracy()))
                        .timestamp(request.getTimestamp())
                        .build()
                : request;

        if (flat.getLatitude() == null || flat.getLongitude() == null) {
            throw new InvalidLocationException("Latitude and longitude are required");
        }
        return flat;
    }

    /** Device timestamps are epoch millis, sometimes fractional; the fraction is dropped. */
    private Instant capturedAt(Double timestamp) {
        if (timestamp == null) {
            return Instant.now(clock);
        }
        if (timestamp.isNaN() || timestamp.isInfinite()) {
            throw new InvalidLocationException("Invalid timestamp: " + timestamp);
        }
        return Instant.ofEpochMilli((long) Math.floor(timestamp));
    }

    private TrackingPoint persist(TrackingPoint point) {
        try {
            return trackingPointRepository.save(point);
        } catch (DataAccessException e) {
            log.error("Failed to store tracking point for user {}", point.getOwnerId(), e);
            throw new TrackingPersistenceException(
                    "Failed to save tracking point: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private static IngestWarning warning(WarningType type, String message, Map<String, Object> details) {
        return IngestWarning.builder().type(type).message(message).details(details).build();
    }

    private static Map<String, Object> coordinates(double latitude, double longitude) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("latitude", latitude);
        details.put("longitude", longitude);
        return details;
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }
}
