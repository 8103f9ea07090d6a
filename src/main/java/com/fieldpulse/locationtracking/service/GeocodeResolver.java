package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.cache.ExpiringStore;
import com.fieldpulse.locationtracking.dto.BackfillSummary;
import com.fieldpulse.locationtracking.dto.GeocodeResult;
import com.fieldpulse.locationtracking.dto.ReverseGeocodeResponse;
import com.fieldpulse.locationtracking.entity.TrackingPoint;
import com.fieldpulse.locationtracking.repository.TrackingPointRepository;
import com.fieldpulse.locationtracking.util.GeoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Turns coordinates into addresses without hammering the paid geocoding API.
 *
 * Single lookups go through a 24h cache bucketed on 4-decimal coordinates.
 * "No results" answers are cached too, as a marker, so unresolvable spots are
 * not asked about again until the entry expires.
 *
 * Backfill over many stored points:
 *   1. drop points that already have an address
 *   2. drop points within 10 m or 5 min of the same owner's last point selected
 *      for lookup (they take that point's address if it lands close enough)
 *   3. cluster the rest within ~89 m, across owners; only the first point of a
 *      cluster is looked up
 *   4. run clusters in batches of 5 with a pause between batches
 *   5. after 3 failed clusters in a row, skip everything that is left
 *
 * Inside a batch, lookups are started in waves no larger than the number of
 * failures the breaker still allows. With the defaults a fresh batch of 5 runs
 * as a wave of 3 followed by a wave of 2, so no request is ever sent that an
 * open breaker would have skipped.
 *
 * Address resolution happens at read time, never during ingestion, so a failed
 * run can simply be repeated.
 */
@Service
@Slf4j
public class GeocodeResolver {

    static final String CACHE_PREFIX = "tracking:geocode:";
    static final String NO_RESULTS_MARKER = "__NO_RESULTS__";
    static final String NO_RESULTS_ERROR = "No address found for these coordinates";

    // 0.0008 degrees at ~111 km per degree
    static final double GROUP_RADIUS_METERS = 88.8;
    static final double DUPLICATE_DISTANCE_METERS = 10;
    static final Duration DUPLICATE_INTERVAL = Duration.ofMinutes(5);

    private final ReverseGeocodingClient client;
    private final ExpiringStore store;
    private final TrackingPointRepository repository;
    private final Executor executor;

    @Value("${tracking.geocoding.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${tracking.geocoding.retry-backoff-ms:1000}")
    private long retryBackoffMs = 1000;

    @Value("${tracking.geocoding.batch-size:5}")
    private int batchSize = 5;

    @Value("${tracking.geocoding.batch-delay-ms:1000}")
    private long batchDelayMs = 1000;

    @Value("${tracking.geocoding.max-consecutive-failures:3}")
    private int maxConsecutiveFailures = 3;

    @Value("${tracking.geocoding.cache-ttl-hours:24}")
    private long cacheTtlHours = 24;

    public GeocodeResolver(ReverseGeocodingClient client,
                           ExpiringStore store,
                           TrackingPointRepository repository,
                           @Qualifier("geocodeTaskExecutor") Executor executor) {
        this.client = client;
        this.store = store;
        this.repository = repository;
        this.executor = executor;
    }

    // ═══════════════════════════════════════════════════════════════════
    // Single lookup
    // ═══════════════════════════════════════════════════════════════════

    public GeocodeResult resolve(double latitude, double longitude) {
        String key = cacheKey(latitude, longitude);

        Optional<String> cached = readCache(key);
        if (cached.isPresent()) {
            log.debug("Geocode cache hit for {}", key);
            return NO_RESULTS_MARKER.equals(cached.get())
                    ? GeocodeResult.empty(NO_RESULTS_ERROR)
                    : GeocodeResult.resolved(cached.get());
        }

        ReverseGeocodeResponse response = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            response = callProvider(latitude, longitude);

            switch (response.getStatus()) {
                case OK:
                    writeCache(key, response.getAddress());
                    return GeocodeResult.resolved(response.getAddress());
                case ZERO_RESULTS:
                    writeCache(key, NO_RESULTS_MARKER);
                    return GeocodeResult.empty(NO_RESULTS_ERROR);
                case REJECTED:
                    return GeocodeResult.failed(response.getMessage());
                default:
                    break;
            }

            if (attempt < maxAttempts) {
                log.debug("Geocoding attempt {}/{} for {} failed ({}), backing off",
                        attempt, maxAttempts, key, response.getStatus());
                if (!sleep(retryBackoffMs * attempt)) {
                    return GeocodeResult.failed("Geocoding interrupted");
                }
            }
        }

        return GeocodeResult.failed(response != null ? response.getMessage() : "Max retries exceeded for geocoding request");
    }

    static String cacheKey(double latitude, double longitude) {
        return CACHE_PREFIX + GeoUtil.roundCoordinate(latitude) + "_" + GeoUtil.roundCoordinate(longitude);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Backfill
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Resolves addresses for stored points (ordered by time) and writes the outcome
     * back onto them. Points are updated in place and persisted.
     */
    public BackfillSummary backfill(List<TrackingPoint> points) {
        int processed = points.size();
        List<TrackingPoint> pending = new ArrayList<>();
        for (TrackingPoint point : points) {
            if (point.getAddress() == null) {
                pending.add(point);
            }
        }
        if (pending.isEmpty()) {
            return BackfillSummary.empty("No tracking points need geocoding", processed);
        }

        // near-duplicates of the same owner's previous candidate, keyed to that candidate
        List<TrackingPoint> candidates = new ArrayList<>();
        Map<TrackingPoint, TrackingPoint> followers = new IdentityHashMap<>();
        Map<Long, TrackingPoint> lastCandidateByOwner = new HashMap<>();
        for (TrackingPoint point : pending) {
            TrackingPoint lastCandidate = lastCandidateByOwner.get(point.getOwnerId());
            if (lastCandidate != null && isNearDuplicate(lastCandidate, point)) {
                followers.put(point, lastCandidate);
                continue;
            }
            candidates.add(point);
            lastCandidateByOwner.put(point.getOwnerId(), point);
        }

        List<Group> groups = group(candidates);
        int skipped = processed - pending.size() + attachFollowers(groups, followers);
        log.debug("Geocoding {} candidates in {} groups ({} points pending)",
                candidates.size(), groups.size(), pending.size());

        int successful = 0;
        int failed = 0;
        int groupsResolved = 0;
        int groupsFailed = 0;
        int consecutiveFailures = 0;
        int next = 0;
        boolean circuitOpen = false;

        while (next < groups.size() && !circuitOpen) {
            if (next > 0 && !sleep(batchDelayMs)) {
                break;
            }
            int batchEnd = Math.min(next + batchSize, groups.size());

            // waves never exceed the failures left before the breaker opens,
            // so nothing is requested that the breaker would have skipped
            while (next < batchEnd && !circuitOpen) {
                int wave = Math.min(batchEnd - next, maxConsecutiveFailures - consecutiveFailures);
                List<Group> waveGroups = groups.subList(next, next + wave);
                List<CompletableFuture<GeocodeResult>> lookups = new ArrayList<>(wave);
                for (Group group : waveGroups) {
                    lookups.add(CompletableFuture.supplyAsync(
                            () -> resolve(group.representative.getLatitude(), group.representative.getLongitude()),
                            executor));
                }

                for (int i = 0; i < wave; i++) {
                    Group group = waveGroups.get(i);
                    GeocodeResult result = await(lookups.get(i));
                    apply(group, result);

                    if (result.isResolved()) {
                        groupsResolved++;
                        successful += group.members.size();
                        consecutiveFailures = 0;
                    } else {
                        groupsFailed++;
                        failed += group.members.size();
                        if (result.isNoResults()) {
                            consecutiveFailures = 0;
                        } else {
                            consecutiveFailures++;
                            log.warn("Geocoding failed for group at point {}: {}",
                                    group.representative.getId(), result.getError());
                        }
                    }
                    if (consecutiveFailures >= maxConsecutiveFailures) {
                        circuitOpen = true;
                    }
                }
                next += wave;
            }
        }

        int groupsSkipped = groups.size() - next;
        for (Group group : groups.subList(next, groups.size())) {
            skipped += group.members.size();
        }

        if (circuitOpen) {
            log.warn("Geocoding stopped after {} consecutive failures — skipped {}/{} groups, {} points resolved, {} failed",
                    consecutiveFailures, groupsSkipped, groups.size(), successful, failed);
        } else {
            log.debug("Geocoding complete — {} groups, {} points resolved, {} failed", groups.size(), successful, failed);
        }

        return BackfillSummary.builder()
                .message(circuitOpen ? "Geocoding stopped early after consecutive failures" : "Geocoding completed")
                .processed(processed)
                .successful(successful)
                .failed(failed)
                .skipped(skipped)
                .groupsTotal(groups.size())
                .groupsResolved(groupsResolved)
                .groupsFailed(groupsFailed)
                .groupsSkipped(groupsSkipped)
                .circuitOpen(circuitOpen)
                .build();
    }

    private boolean isNearDuplicate(TrackingPoint anchor, TrackingPoint point) {
        double meters = GeoUtil.distanceMeters(anchor.getLatitude(), anchor.getLongitude(),
                point.getLatitude(), point.getLongitude());
        if (meters < DUPLICATE_DISTANCE_METERS) {
            return true;
        }
        Duration gap = Duration.between(anchor.getCapturedAt(), point.getCapturedAt()).abs();
        return gap.compareTo(DUPLICATE_INTERVAL) < 0;
    }

    /** Greedy clustering: each unclaimed candidate claims every later candidate within the radius. */
    private List<Group> group(List<TrackingPoint> candidates) {
        List<Group> groups = new ArrayList<>();
        boolean[] claimed = new boolean[candidates.size()];

        for (int i = 0; i < candidates.size(); i++) {
            if (claimed[i]) {
                continue;
            }
            TrackingPoint representative = candidates.get(i);
            Group group = new Group(representative);
            claimed[i] = true;

            for (int j = i + 1; j < candidates.size(); j++) {
                if (!claimed[j] && withinGroup(representative, candidates.get(j))) {
                    group.members.add(candidates.get(j));
                    claimed[j] = true;
                }
            }
            groups.add(group);
        }
        return groups;
    }

    /** @return how many followers were too far from their group to share its address */
    private int attachFollowers(List<Group> groups, Map<TrackingPoint, TrackingPoint> followers) {
        Map<TrackingPoint, Group> groupOf = new IdentityHashMap<>();
        for (Group group : groups) {
            for (TrackingPoint member : group.members) {
                groupOf.put(member, group);
            }
        }

        int detached = 0;
        for (Map.Entry<TrackingPoint, TrackingPoint> entry : followers.entrySet()) {
            Group group = groupOf.get(entry.getValue());
            if (group != null && withinGroup(group.representative, entry.getKey())) {
                group.members.add(entry.getKey());
            } else {
                detached++;
            }
        }
        return detached;
    }

    private static boolean withinGroup(TrackingPoint representative, TrackingPoint point) {
        return GeoUtil.isWithinRadius(representative.getLatitude(), representative.getLongitude(),
                point.getLatitude(), point.getLongitude(), GROUP_RADIUS_METERS);
    }

    private void apply(Group group, GeocodeResult result) {
        for (TrackingPoint member : group.members) {
            if (result.isResolved()) {
                member.markResolved(result.getAddress());
            } else {
                member.markUnresolved(result.getError());
            }
        }
        try {
            repository.saveAll(group.members);
        } catch (DataAccessException e) {
            log.warn("Failed to store geocoding result for {} points near point {}: {}",
                    group.members.size(), group.representative.getId(), e.getMessage());
        }
    }

    // ═══════════════════════════════════════════════════════════════════
    // Plumbing
    // ═══════════════════════════════════════════════════════════════════

    private ReverseGeocodeResponse callProvider(double latitude, double longitude) {
        try {
            return client.reverseGeocode(latitude, longitude);
        } catch (RuntimeException e) {
            log.warn("Geocoding client error for {}, {}: {}", latitude, longitude, e.getMessage());
            return ReverseGeocodeResponse.transientFailure("Geocoding failed: " + e.getMessage());
        }
    }

    private Optional<String> readCache(String key) {
        try {
            return store.get(key, String.class);
        } catch (RuntimeException e) {
            log.warn("Geocode cache read failed for {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String key, String value) {
        try {
            store.put(key, value, Duration.ofHours(cacheTtlHours));
        } catch (RuntimeException e) {
            log.warn("Geocode cache write failed for {}: {}", key, e.getMessage());
        }
    }

    private static GeocodeResult await(CompletableFuture<GeocodeResult> lookup) {
        try {
            return lookup.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return GeocodeResult.failed("Geocoding failed: " + cause.getMessage());
        }
    }

    private static boolean sleep(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static final class Group {
        private final TrackingPoint representative;
        private final List<TrackingPoint> members = new ArrayList<>();

        private Group(TrackingPoint representative) {
            this.representative = representative;
            this.members.add(representative);
        }
    }
}
