package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.MutableClock;
import com.fieldpulse.locationtracking.cache.CaffeineExpiringStore;
import com.fieldpulse.locationtracking.dto.BackfillSummary;
import com.fieldpulse.locationtracking.dto.GeocodeResult;
import com.fieldpulse.locationtracking.dto.ReverseGeocodeResponse;
import com.fieldpulse.locationtracking.entity.TrackingPoint;
import com.fieldpulse.locationtracking.repository.TrackingPointRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GeocodeResolver.
 *
 * Test cases:
 *  1. cacheHit_sameFourDecimalBucket_oneProviderCall
 *  2. zeroResults_cachedNegativelyAndNotRetried
 *  3. rateLimited_retriedUntilSuccess
 *  4. rejected_notRetried
 *  5. cacheExpiry_after24Hours_callsProviderAgain
 *  6. backfill_groupsNearbyPointsAndSkipsAddressed
 *  7. backfill_nearDuplicateFollowerSharesGroupAddress
 *  8. backfill_circuitBreakerSkipsGroupsAfterThreeFailures
 *  9. backfill_isIdempotent
 * 10. backfill_interleavedOwners_eachPointLookedUp
 */
@ExtendWith(MockitoExtension.class)
class GeocodeResolverTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private ReverseGeocodingClient  client;
    @Mock private TrackingPointRepository repository;

    private final MutableClock clock = new MutableClock(T0, ZoneOffset.UTC);
    private GeocodeResolver resolver;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final Instant T0 = Instant.parse("2024-03-05T08:00:00Z");

    /** Sandton, Johannesburg */
    private static final double LAT = -26.1076;
    private static final double LON = 28.0567;

    @BeforeEach
    void setUp() {
        resolver = new GeocodeResolver(client, new CaffeineExpiringStore(clock, 1000), repository, Runnable::run);
        // no real sleeping in unit tests
        ReflectionTestUtils.setField(resolver, "retryBackoffMs", 0L);
        ReflectionTestUtils.setField(resolver, "batchDelayMs", 0L);
    }

    private TrackingPoint point(long id, double lat, double lon, Instant capturedAt) {
        return point(id, 1L, lat, lon, capturedAt);
    }

    private TrackingPoint point(long id, long ownerId, double lat, double lon, Instant capturedAt) {
        return TrackingPoint.builder()
                .id(id)
                .ownerId(ownerId)
                .latitude(lat)
                .longitude(lon)
                .accuracy(8.0)
                .capturedAt(capturedAt)
                .receivedAt(capturedAt)
                .build();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Single lookups
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Two coordinates rounding to the same 4-decimal bucket → one provider call")
    void cacheHit_sameFourDecimalBucket_oneProviderCall() {
        when(client.reverseGeocode(anyDouble(), anyDouble()))
                .thenReturn(ReverseGeocodeResponse.ok("5 Rivonia Rd, Sandton"));

        GeocodeResult first = resolver.resolve(-26.10761, 28.05672);
        GeocodeResult second = resolver.resolve(-26.10764, 28.05669);

        assertThat(first.getAddress()).isEqualTo("5 Rivonia Rd, Sandton");
        assertThat(second.getAddress()).isEqualTo("5 Rivonia Rd, Sandton");
        verify(client, times(1)).reverseGeocode(anyDouble(), anyDouble());
        assertThat(GeocodeResolver.cacheKey(-26.10761, 28.05672)).isEqualTo("tracking:geocode:-26.1076_28.0567");
    }

    @Test
    @DisplayName("ZERO_RESULTS → no retry, and the empty answer is served from cache afterwards")
    void zeroResults_cachedNegativelyAndNotRetried() {
        when(client.reverseGeocode(LAT, LON)).thenReturn(ReverseGeocodeResponse.zeroResults());

        GeocodeResult first = resolver.resolve(LAT, LON);
        GeocodeResult second = resolver.resolve(LAT, LON);

        assertThat(first.isResolved()).isFalse();
        assertThat(first.isNoResults()).isTrue();
        assertThat(first.getError()).isEqualTo("No address found for these coordinates");
        assertThat(second.isNoResults()).isTrue();
        verify(client, times(1)).reverseGeocode(LAT, LON);
    }

    @Test
    @DisplayName("HTTP 429 twice, then OK → retried with backoff and resolved on the third attempt")
    void rateLimited_retriedUntilSuccess() {
        when(client.reverseGeocode(LAT, LON))
                .thenReturn(ReverseGeocodeResponse.rateLimited("Geocoding rate limit exceeded"))
                .thenReturn(ReverseGeocodeResponse.rateLimited("Geocoding rate limit exceeded"))
                .thenReturn(ReverseGeocodeResponse.ok("5 Rivonia Rd, Sandton"));

        GeocodeResult result = resolver.resolve(LAT, LON);

        assertThat(result.getAddress()).isEqualTo("5 Rivonia Rd, Sandton");
        verify(client, times(3)).reverseGeocode(LAT, LON);
    }

    @Test
    @DisplayName("Transient failures on every attempt → failed after 3 attempts, nothing cached")
    void transientFailure_exhaustsAttempts() {
        when(client.reverseGeocode(LAT, LON)).thenReturn(ReverseGeocodeResponse.transientFailure("Read timed out"));

        GeocodeResult result = resolver.resolve(LAT, LON);
        resolver.resolve(LAT, LON);

        assertThat(result.isResolved()).isFalse();
        assertThat(result.isNoResults()).isFalse();
        assertThat(result.getError()).isEqualTo("Read timed out");
        verify(client, times(6)).reverseGeocode(LAT, LON);
    }

    @Test
    @DisplayName("Provider rejects the request (e.g. bad key) → single attempt, failed")
    void rejected_notRetried() {
        when(client.reverseGeocode(LAT, LON))
                .thenReturn(ReverseGeocodeResponse.rejected("Geocoding API error: REQUEST_DENIED"));

        GeocodeResult result = resolver.resolve(LAT, LON);

        assertThat(result.isResolved()).isFalse();
        assertThat(result.getError()).contains("REQUEST_DENIED");
        verify(client, times(1)).reverseGeocode(LAT, LON);
    }

    @Test
    @DisplayName("Cached address expires after 24 h → provider called again")
    void cacheExpiry_after24Hours_callsProviderAgain() {
        when(client.reverseGeocode(LAT, LON)).thenReturn(ReverseGeocodeResponse.ok("5 Rivonia Rd, Sandton"));

        resolver.resolve(LAT, LON);
        clock.advance(Duration.ofHours(23));
        resolver.resolve(LAT, LON);
        clock.advance(Duration.ofHours(1));
        resolver.resolve(LAT, LON);

        verify(client, times(2)).reverseGeocode(LAT, LON);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Backfill
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Points within 88.8 m share one lookup; already addressed points are left alone")
    void backfill_groupsNearbyPointsAndSkipsAddressed() {
        TrackingPoint addressed = point(1L, LAT, LON, T0);
        addressed.markResolved("Known address");
        // ~33 m north of the next one, 10 min later: not a near-duplicate, same group
        TrackingPoint a = point(2L, LAT, LON, T0.plusSeconds(600));
        TrackingPoint b = point(3L, LAT + 0.0003, LON, T0.plusSeconds(1200));
        when(client.reverseGeocode(LAT, LON)).thenReturn(ReverseGeocodeResponse.ok("5 Rivonia Rd, Sandton"));

        BackfillSummary summary = resolver.backfill(List.of(addressed, a, b));

        verify(client, times(1)).reverseGeocode(anyDouble(), anyDouble());
        verify(repository, times(1)).saveAll(anyList());
        assertThat(a.getAddress()).isEqualTo("5 Rivonia Rd, Sandton");
        assertThat(b.getAddress()).isEqualTo("5 Rivonia Rd, Sandton");
        assertThat(addressed.getAddress()).isEqualTo("Known address");
        assertThat(summary.getProcessed()).isEqualTo(3);
        assertThat(summary.getSuccessful()).isEqualTo(2);
        assertThat(summary.getSkipped()).isEqualTo(1);
        assertThat(summary.getGroupsTotal()).isEqualTo(1);
        assertThat(summary.isCircuitOpen()).isFalse();
    }

    @Test
    @DisplayName("A point 3 m from the previous one is not looked up but inherits its group's address")
    void backfill_nearDuplicateFollowerSharesGroupAddress() {
        TrackingPoint a = point(1L, LAT, LON, T0);
        TrackingPoint follower = point(2L, LAT + 0.00003, LON, T0.plusSeconds(60));
        when(client.reverseGeocode(LAT, LON)).thenReturn(ReverseGeocodeResponse.ok("5 Rivonia Rd, Sandton"));

        BackfillSummary summary = resolver.backfill(List.of(a, follower));

        verify(client, times(1)).reverseGeocode(anyDouble(), anyDouble());
        assertThat(follower.getAddress()).isEqualTo("5 Rivonia Rd, Sandton");
        assertThat(summary.getSuccessful()).isEqualTo(2);
    }

    @Test
    @DisplayName("5 distinct groups, provider down → groups 1-3 fail, breaker opens, groups 4-5 never requested")
    void backfill_circuitBreakerSkipsGroupsAfterThreeFailures() {
        List<TrackingPoint> points = new ArrayList<>();
        double[] lats = {-26.20, -26.21, -26.23, -26.24, -26.25};
        for (int i = 0; i < lats.length; i++) {
            // ~1.1 km and 10 min apart: every point is its own group
            points.add(point(i + 1, lats[i], 28.05, T0.plusSeconds(600L * i)));
        }
        when(client.reverseGeocode(anyDouble(), anyDouble()))
                .thenReturn(ReverseGeocodeResponse.transientFailure("503 Service Unavailable"));

        BackfillSummary summary = resolver.backfill(points);

        verify(client, never()).reverseGeocode(eq(-26.24), anyDouble());
        verify(client, never()).reverseGeocode(eq(-26.25), anyDouble());
        // 3 groups × 3 attempts each
        verify(client, times(9)).reverseGeocode(anyDouble(), anyDouble());

        assertThat(summary.isCircuitOpen()).isTrue();
        assertThat(summary.getGroupsFailed()).isEqualTo(3);
        assertThat(summary.getGroupsSkipped()).isEqualTo(2);
        assertThat(summary.getFailed()).isEqualTo(3);
        assertThat(summary.getSkipped()).isEqualTo(2);
        assertThat(points.get(0).getAddressDecodingError()).isEqualTo("503 Service Unavailable");
        assertThat(points.get(3).getAddressDecodingError()).isNull();
        assertThat(points.get(4).getAddress()).isNull();
    }

    @Test
    @DisplayName("Backfill twice over the same points → second run makes no provider calls")
    void backfill_isIdempotent() {
        TrackingPoint a = point(1L, LAT, LON, T0);
        when(client.reverseGeocode(LAT, LON)).thenReturn(ReverseGeocodeResponse.ok("5 Rivonia Rd, Sandton"));

        resolver.backfill(List.of(a));
        BackfillSummary second = resolver.backfill(List.of(a));

        verify(client, times(1)).reverseGeocode(anyDouble(), anyDouble());
        assertThat(a.getAddress()).isEqualTo("5 Rivonia Rd, Sandton");
        assertThat(second.getSuccessful()).isZero();
        assertThat(second.getSkipped()).isEqualTo(1);
    }

    @Test
    @DisplayName("Owners in different cities reporting a minute apart → not near-duplicates of each other")
    void backfill_interleavedOwners_eachPointLookedUp() {
        double[][] cities = {
                {-26.2041, 28.0473},   // Johannesburg
                {-25.7479, 28.2293},   // Pretoria
                {-29.8587, 31.0218},   // Durban
                {-33.9249, 18.4241},   // Cape Town
                {-29.0852, 26.1596},   // Bloemfontein
        };
        List<TrackingPoint> points = new ArrayList<>();
        for (int i = 0; i < cities.length; i++) {
            points.add(point(i + 1, i + 1, cities[i][0], cities[i][1], T0.plusSeconds(60L * i)));
        }
        when(client.reverseGeocode(anyDouble(), anyDouble()))
                .thenAnswer(invocation -> ReverseGeocodeResponse.ok("Address at " + invocation.getArgument(0)));

        BackfillSummary summary = resolver.backfill(points);

        verify(client, times(5)).reverseGeocode(anyDouble(), anyDouble());
        assertThat(summary.getSuccessful()).isEqualTo(5);
        assertThat(summary.getSkipped()).isZero();
        assertThat(summary.getGroupsTotal()).isEqualTo(5);
        assertThat(points).allSatisfy(p -> assertThat(p.getAddress()).startsWith("Address at "));
        assertThat(points.get(3).getAddress()).isEqualTo("Address at -33.9249");
    }
}
