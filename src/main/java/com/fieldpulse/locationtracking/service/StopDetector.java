package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.dto.AccuracyFilterResult;
import com.fieldpulse.locationtracking.dto.Stop;
import com.fieldpulse.locationtracking.dto.StopAnalysis;
import com.fieldpulse.locationtracking.dto.StopLocation;
import com.fieldpulse.locationtracking.dto.TrackingPointView;
import com.fieldpulse.locationtracking.util.GeoUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds places where the user stayed put.
 *
 * One forward pass: a cluster starts at a point and absorbs following points
 * within 50 m of its running centre. The first point outside closes it; a closed
 * cluster that lasted 3 minutes or more becomes a {@link Stop}. A stop broken by
 * a short excursion is reported as two stops.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StopDetector {

    static final double STOP_RADIUS_METERS = 50;
    static final double MIN_STOP_MINUTES = 3;

    private final LocationValidator locationValidator;

    public StopAnalysis detect(List<TrackingPointView> points) {
        AccuracyFilterResult filter = locationValidator.filterByAccuracy(points);
        List<TrackingPointView> usable = new ArrayList<>(filter.getKeptPoints());
        usable.sort(Comparator.comparing(TrackingPointView::getCapturedAt));

        if (usable.size() < 2) {
            return StopAnalysis.builder()
                    .averageTimeFormatted(GeoUtil.formatDuration(0))
                    .accuracyInfo(filter.getAccuracyInfo())
                    .pointsUsed(usable.size())
                    .pointsFiltered(filter.getInaccurateCount())
                    .build();
        }

        List<Stop> stops = new ArrayList<>();
        Cluster current = null;
        for (TrackingPointView point : usable) {
            if (current == null) {
                current = new Cluster(point);
            } else if (GeoUtil.distanceMeters(current.latitude, current.longitude,
                    point.getLatitude(), point.getLongitude()) <= STOP_RADIUS_METERS) {
                current.absorb(point);
            } else {
                current.close(stops);
                current = new Cluster(point);
            }
        }
        current.close(stops);

        List<StopLocation> locations = new ArrayList<>(stops.size());
        long totalMinutes = 0;
        for (Stop stop : stops) {
            locations.add(StopLocation.of(stop));
            totalMinutes += stop.getDurationMinutes();
        }
        long averageMinutes = stops.isEmpty() ? 0 : Math.round((double) totalMinutes / stops.size());

        log.debug("Stop detection: {} stops from {} points", stops.size(), usable.size());
        return StopAnalysis.builder()
                .stops(stops)
                .locations(locations)
                .averageTimeMinutes(averageMinutes)
                .averageTimeFormatted(GeoUtil.formatDuration(averageMinutes))
                .accuracyInfo(filter.getAccuracyInfo())
                .pointsUsed(usable.size())
                .pointsFiltered(filter.getInaccurateCount())
                .build();
    }

    private static final class Cluster {
        private double latitude;
        private double longitude;
        private String address;
        private final Instant startTime;
        private Instant endTime;
        private int count;

        private Cluster(TrackingPointView first) {
            this.latitude = first.getLatitude();
            this.longitude = first.getLongitude();
            this.startTime = first.getCapturedAt();
            this.endTime = first.getCapturedAt();
            this.count = 1;
            this.address = first.getAddress() != null
                    ? first.getAddress()
                    : GeoUtil.coordinateLabel(first.getLatitude(), first.getLongitude());
        }

        private void absorb(TrackingPointView point) {
            count++;
            latitude = (latitude * (count - 1) + point.getLatitude()) / count;
            longitude = (longitude * (count - 1) + point.getLongitude()) / count;
            endTime = point.getCapturedAt();

            // most recent resolved address wins; coordinate labels never replace it
            if (point.getAddress() != null && !point.isFallbackAddress()) {
                address = point.getAddress();
            }
        }

        private void close(List<Stop> stops) {
            double minutes = Duration.between(startTime, endTime).toMillis() / 60_000.0;
            if (minutes < MIN_STOP_MINUTES) {
                return;
            }
            long rounded = Math.round(minutes);
            stops.add(Stop.builder()
                    .latitude(latitude)
                    .longitude(longitude)
                    .address(address)
                    .startTime(startTime)
                    .endTime(endTime)
                    .durationMinutes(rounded)
                    .durationFormatted(GeoUtil.formatDuration(rounded))
                    .pointsCount(count)
                    .build());
        }
    }
}
