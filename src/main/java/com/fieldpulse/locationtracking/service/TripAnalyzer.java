package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.dto.AccuracyFilterResult;
import com.fieldpulse.locationtracking.dto.TrackingPointView;
import com.fieldpulse.locationtracking.dto.TripSummary;
import com.fieldpulse.locationtracking.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Distance, speed and moving/stopped time for a run of points.
 *
 * Works pair by pair over accuracy-filtered points:
 *   - pairs closer than 5 s or 5 m are jitter: their time is stationary, their distance is dropped
 *   - otherwise speed = km / hours, capped at 200 km/h
 *   - below 2 km/h the pair is stationary, otherwise moving
 *
 * Stopped time is whatever is left of the elapsed time, so the two always add up.
 * Fewer than two usable points gives an all-zero summary.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripAnalyzer {

    static final long MIN_INTERVAL_MILLIS = 5_000;
    static final double MIN_DISTANCE_METERS = 5;
    static final double MAX_SPEED_KMH = 200;
    static final double MOVING_SPEED_KMH = 2;

    private static final double MILLIS_PER_HOUR = 3_600_000.0;
    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private final LocationValidator locationValidator;

    public TripSummary analyze(List<TrackingPointView> points) {
        AccuracyFilterResult filter = locationValidator.filterByAccuracy(points);
        List<TrackingPointView> usable = new ArrayList<>(filter.getKeptPoints());
        usable.sort(Comparator.comparing(TrackingPointView::getCapturedAt));

        if (usable.size() < 2) {
            return TripSummary.builder()
                    .formattedDistance("0 km")
                    .pointsUsed(usable.size())
                    .pointsFiltered(filter.getInaccurateCount())
                    .accuracyInfo(filter.getAccuracyInfo())
                    .build();
        }

        double distanceKm = 0;
        long movingMillis = 0;
        double maxSpeedKmh = 0;
        Map<String, Long> millisByAddress = new LinkedHashMap<>();

        for (int i = 1; i < usable.size(); i++) {
            TrackingPointView from = usable.get(i - 1);
            TrackingPointView to = usable.get(i);
            long intervalMillis = Duration.between(from.getCapturedAt(), to.getCapturedAt()).toMillis();
            double segmentKm = GeoUtil.distanceKm(from.getLatitude(), from.getLongitude(),
                    to.getLatitude(), to.getLongitude());

            if (from.getAddress() != null) {
                millisByAddress.merge(from.getAddress(), intervalMillis, Long::sum);
            }

            if (intervalMillis < MIN_INTERVAL_MILLIS || segmentKm * 1000 < MIN_DISTANCE_METERS) {
                continue;
            }

            distanceKm += segmentKm;
            double speedKmh = Math.min(segmentKm / (intervalMillis / MILLIS_PER_HOUR), MAX_SPEED_KMH);
            maxSpeedKmh = Math.max(maxSpeedKmh, speedKmh);
            if (speedKmh >= MOVING_SPEED_KMH) {
                movingMillis += intervalMillis;
            }
        }

        long elapsedMillis = Duration.between(usable.get(0).getCapturedAt(),
                usable.get(usable.size() - 1).getCapturedAt()).toMillis();
        long totalMinutes = Math.round(elapsedMillis / MILLIS_PER_MINUTE);
        long movingMinutes = Math.min(Math.round(movingMillis / MILLIS_PER_MINUTE), totalMinutes);

        double averageSpeedKmh = movingMillis > 0
                ? Math.min(distanceKm / (movingMillis / MILLIS_PER_HOUR), MAX_SPEED_KMH)
                : 0;

        Map<String, Double> locationTimeSpent = new LinkedHashMap<>();
        millisByAddress.forEach((address, millis) ->
                locationTimeSpent.put(address, GeoUtil.round(millis / MILLIS_PER_MINUTE, 2)));

        if (filter.getInaccurateCount() > 0) {
            log.debug("Trip analysis: filtered {}/{} points for poor accuracy",
                    filter.getInaccurateCount(), filter.getOriginalCount());
        }

        return TripSummary.builder()
                .totalDistanceKm(GeoUtil.round(distanceKm, 3))
                .formattedDistance(GeoUtil.formatDistance(distanceKm))
                .totalTimeMinutes(totalMinutes)
                .movingTimeMinutes(movingMinutes)
                .stoppedTimeMinutes(totalMinutes - movingMinutes)
                .averageSpeedKmh(GeoUtil.round(averageSpeedKmh, 1))
                .maxSpeedKmh(GeoUtil.round(maxSpeedKmh, 1))
                .locationTimeSpent(locationTimeSpent)
                .pointsUsed(usable.size())
                .pointsFiltered(filter.getInaccurateCount())
                .accuracyInfo(filter.getAccuracyInfo())
                .build();
    }
}
