package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.dto.Stop;
import com.fieldpulse.locationtracking.dto.StopAnalysis;
import com.fieldpulse.locationtracking.dto.StopLocation;
import com.fieldpulse.locationtracking.dto.TrackingPointView;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StopDetector.
 *
 * Test cases:
 *  1. tenPointsWithin20mOver5Minutes_oneStop
 *  2. tenPointsWithin20mOver2Minutes_noStop
 *  3. twoVisits_twoStopsWithAverage
 *  4. resolvedAddressPreferredOverCoordinateLabel
 */
class StopDetectorTest {

    private final StopDetector stopDetector = new StopDetector(new LocationValidator());

    private static final Instant T0 = Instant.parse("2024-03-05T08:00:00Z");
    private static final double LAT = -26.1450;
    private static final double LON = 28.0410;

    private TrackingPointView point(double lat, double lon, long millisFromStart, String address) {
        return TrackingPointView.builder()
                .ownerId(1L)
                .latitude(lat)
                .longitude(lon)
                .accuracy(6.0)
                .capturedAt(T0.plusMillis(millisFromStart))
                .address(address)
                .build();
    }

    /** {@code count} points drifting ~1 m apart, evenly spread over {@code spanMillis}. */
    private List<TrackingPointView> dwell(double lat, double lon, long startMillis, long spanMillis, int count) {
        List<TrackingPointView> points = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            points.add(point(lat + i * 0.00001, lon, startMillis + spanMillis * i / (count - 1), null));
        }
        return points;
    }

    @Test
    @DisplayName("10 points within 20 m over 5 minutes → one stop of ~5 minutes")
    void tenPointsWithin20mOver5Minutes_oneStop() {
        StopAnalysis analysis = stopDetector.detect(dwell(LAT, LON, 0, 300_000, 10));

        assertThat(analysis.getStops()).hasSize(1);
        Stop stop = analysis.getStops().get(0);
        assertThat(stop.getDurationMinutes()).isEqualTo(5);
        assertThat(stop.getDurationFormatted()).isEqualTo("5m");
        assertThat(stop.getPointsCount()).isEqualTo(10);
        assertThat(stop.getStartTime()).isEqualTo(T0);
        assertThat(stop.getEndTime()).isEqualTo(T0.plusSeconds(300));
        // centre is the running average of the cluster
        assertThat(stop.getLatitude()).isCloseTo(LAT + 0.000045, within(1e-7));
        assertThat(analysis.getLocations()).hasSize(1);
        assertThat(analysis.getAverageTimeMinutes()).isEqualTo(5);
    }

    @Test
    @DisplayName("Same 10 points squeezed into 2 minutes → shorter than 3 min, no stop")
    void tenPointsWithin20mOver2Minutes_noStop() {
        StopAnalysis analysis = stopDetector.detect(dwell(LAT, LON, 0, 120_000, 10));

        assertThat(analysis.getStops()).isEmpty();
        assertThat(analysis.getAverageTimeMinutes()).isZero();
        assertThat(analysis.getAverageTimeFormatted()).isEqualTo("0m");
        assertThat(analysis.getPointsUsed()).isEqualTo(10);
    }

    @Test
    @DisplayName("4 min at one site, drive ~1 km, 6 min at another → two stops, average 5 min")
    void twoVisits_twoStopsWithAverage() {
        List<TrackingPointView> points = new ArrayList<>(dwell(LAT, LON, 0, 240_000, 5));
        points.addAll(dwell(LAT - 0.01, LON, 600_000, 360_000, 7));

        StopAnalysis analysis = stopDetector.detect(points);

        assertThat(analysis.getStops()).extracting(Stop::getDurationMinutes).containsExactly(4L, 6L);
        assertThat(analysis.getAverageTimeMinutes()).isEqualTo(5);
        assertThat(analysis.getLocations()).extracting(StopLocation::getTimeSpentMinutes).containsExactly(4L, 6L);
    }

    @Test
    @DisplayName("Cluster starting on a coordinate label takes the later resolved address")
    void resolvedAddressPreferredOverCoordinateLabel() {
        List<TrackingPointView> points = List.of(
                point(LAT, LON, 0, null).withDisplayAddress(),
                point(LAT, LON, 120_000, "Rosebank Mall, Johannesburg"),
                point(LAT, LON, 240_000, null).withDisplayAddress());

        StopAnalysis analysis = stopDetector.detect(points);

        assertThat(analysis.getStops()).hasSize(1);
        assertThat(analysis.getStops().get(0).getAddress()).isEqualTo("Rosebank Mall, Johannesburg");
    }
}
