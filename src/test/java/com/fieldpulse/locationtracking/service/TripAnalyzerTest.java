package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.dto.TrackingPointView;
import com.fieldpulse.locationtracking.dto.TripSummary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for TripAnalyzer.
 *
 * Test cases:
 *  1. slowDrift_countsAsStoppedTime
 *     ~120 m over 10 minutes → distance counted, but 0.7 km/h is not moving.
 *  2. movingAndStationarySegments_timeSplitAddsUp
 *     moving + stopped == total, jitter pairs add no distance.
 *  3. impossibleJump_speedCappedAt200
 *  4. inaccuratePoints_filteredBeforeAnalysis
 *  5. fewerThanTwoPoints_zeroedSummary
 */
class TripAnalyzerTest {

    private final TripAnalyzer tripAnalyzer = new TripAnalyzer(new LocationValidator());

    private static final Instant T0 = Instant.parse("2024-03-05T08:00:00Z");

    private TrackingPointView point(double lat, double lon, long secondsFromStart, Double accuracy, String address) {
        return TrackingPointView.builder()
                .ownerId(1L)
                .latitude(lat)
                .longitude(lon)
                .accuracy(accuracy)
                .capturedAt(T0.plusSeconds(secondsFromStart))
                .address(address)
                .build();
    }

    @Test
    @DisplayName("Two accurate fixes ~120 m and 10 min apart → distance > 0, moving 0, stopped 10")
    void slowDrift_countsAsStoppedTime() {
        List<TrackingPointView> points = List.of(
                point(-26.2041, 28.0473, 0, 10.0, null),
                point(-26.2050, 28.0480, 600, 15.0, null));

        TripSummary summary = tripAnalyzer.analyze(points);

        assertThat(summary.getTotalDistanceKm()).isGreaterThan(0);
        assertThat(summary.getAverageSpeedKmh()).isLessThanOrEqualTo(200);
        assertThat(summary.getTotalTimeMinutes()).isEqualTo(10);
        assertThat(summary.getMovingTimeMinutes()).isZero();
        assertThat(summary.getStoppedTimeMinutes()).isEqualTo(10);
        assertThat(summary.getPointsUsed()).isEqualTo(2);
    }

    @Test
    @DisplayName("Drive, park, drive → moving + stopped == total; 3 s jitter pair adds no distance")
    void movingAndStationarySegments_timeSplitAddsUp() {
        List<TrackingPointView> points = new ArrayList<>(List.of(
                point(-26.2041, 28.0473, 0, 5.0, "Office"),
                // ~1.11 km in 5 min → ~13 km/h
                point(-26.2141, 28.0473, 300, 5.0, "Client A"),
                // jitter: 3 s later, 30 m off
                point(-26.2144, 28.0473, 303, 5.0, "Client A"),
                // parked for ~10 min
                point(-26.2144, 28.0473, 900, 5.0, "Client A"),
                // ~2.22 km in 5 min → ~27 km/h
                point(-26.2344, 28.0473, 1200, 5.0, "Client B")));
        // arrival order must not matter
        Collections.shuffle(points, new Random(7));

        TripSummary summary = tripAnalyzer.analyze(points);

        assertThat(summary.getTotalTimeMinutes()).isEqualTo(20);
        assertThat(summary.getMovingTimeMinutes()).isEqualTo(10);
        assertThat(summary.getStoppedTimeMinutes()).isEqualTo(10);
        assertThat(summary.getMovingTimeMinutes() + summary.getStoppedTimeMinutes())
                .isEqualTo(summary.getTotalTimeMinutes());
        assertThat(summary.getTotalDistanceKm()).isCloseTo(3.336, within(0.01));
        assertThat(summary.getFormattedDistance()).isEqualTo("3.34 km");
        assertThat(summary.getMaxSpeedKmh()).isCloseTo(26.7, within(0.2));
        assertThat(summary.getAverageSpeedKmh()).isCloseTo(20.0, within(0.2));
        // time is booked to the address the segment starts from
        assertThat(summary.getLocationTimeSpent()).containsEntry("Office", 5.0);
        assertThat(summary.getLocationTimeSpent()).containsEntry("Client A", 15.0);
    }

    @Test
    @DisplayName("50 km in one minute → segment speed capped at 200 km/h")
    void impossibleJump_speedCappedAt200() {
        List<TrackingPointView> points = List.of(
                point(-26.00, 28.00, 0, 5.0, null),
                point(-26.45, 28.00, 60, 5.0, null));

        TripSummary summary = tripAnalyzer.analyze(points);

        assertThat(summary.getMaxSpeedKmh()).isEqualTo(200.0);
        assertThat(summary.getAverageSpeedKmh()).isEqualTo(200.0);
        assertThat(summary.getTotalDistanceKm()).isGreaterThan(49);
    }

    @Test
    @DisplayName("Points without accuracy or above 20 m are dropped before any distance is summed")
    void inaccuratePoints_filteredBeforeAnalysis() {
        List<TrackingPointView> points = List.of(
                point(-26.2041, 28.0473, 0, 5.0, null),
                // 5 km off with 500 m accuracy: must not count
                point(-26.2500, 28.0473, 120, 500.0, null),
                point(-26.2041, 28.0473, 240, null, null),
                point(-26.2041, 28.0474, 600, 8.0, null));

        TripSummary summary = tripAnalyzer.analyze(points);

        assertThat(summary.getPointsUsed()).isEqualTo(2);
        assertThat(summary.getPointsFiltered()).isEqualTo(2);
        assertThat(summary.getAccuracyInfo().getNoAccuracy()).isEqualTo(1);
        assertThat(summary.getAccuracyInfo().getAboveThreshold()).isEqualTo(1);
        assertThat(summary.getTotalDistanceKm()).isLessThan(0.05);
    }

    @Test
    @DisplayName("Fewer than 2 usable points → zeroed summary")
    void fewerThanTwoPoints_zeroedSummary() {
        TripSummary summary = tripAnalyzer.analyze(List.of(point(-26.2041, 28.0473, 0, 5.0, null)));

        assertThat(summary.getTotalDistanceKm()).isZero();
        assertThat(summary.getFormattedDistance()).isEqualTo("0 km");
        assertThat(summary.getTotalTimeMinutes()).isZero();
        assertThat(summary.getMovingTimeMinutes()).isZero();
        assertThat(summary.getStoppedTimeMinutes()).isZero();
        assertThat(summary.getPointsUsed()).isEqualTo(1);
        assertThat(tripAnalyzer.analyze(List.of()).getPointsUsed()).isZero();
    }
}
