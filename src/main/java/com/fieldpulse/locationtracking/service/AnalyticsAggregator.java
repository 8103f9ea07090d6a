package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.dto.EfficiencyRating;
import com.fieldpulse.locationtracking.dto.HourlyMovement;
import com.fieldpulse.locationtracking.dto.KeyLocation;
import com.fieldpulse.locationtracking.dto.LocationAnalysis;
import com.fieldpulse.locationtracking.dto.MovementPattern;
import com.fieldpulse.locationtracking.dto.OrganizationSummary;
import com.fieldpulse.locationtracking.dto.RouteOptimization;
import com.fieldpulse.locationtracking.dto.Stop;
import com.fieldpulse.locationtracking.dto.StopAnalysis;
import com.fieldpulse.locationtracking.dto.TrackingAnalytics;
import com.fieldpulse.locationtracking.dto.TrackingInsights;
import com.fieldpulse.locationtracking.dto.TrackingPointView;
import com.fieldpulse.locationtracking.dto.TrackingReport;
import com.fieldpulse.locationtracking.dto.TravelEfficiency;
import com.fieldpulse.locationtracking.dto.TravelOptimization;
import com.fieldpulse.locationtracking.dto.TripSummary;
import com.fieldpulse.locationtracking.util.GeoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Secondary metrics layered on a {@link TripSummary} and {@link StopAnalysis}.
 *
 * Everything here is advisory: ratings, suggestions and histograms. Inputs are
 * read, never modified.
 */
@Service
@Slf4j
public class AnalyticsAggregator {

    static final double ROUTE_SAVINGS_THRESHOLD_KM = 2;
    static final int MIN_POINTS_FOR_PATTERNS = 10;
    static final long PRODUCTIVE_STOP_MINUTES = 15;
    private static final int KEY_LOCATION_LIMIT = 5;
    private static final int HOURLY_BREAKDOWN_LIMIT = 5;

    // ═══════════════════════════════════════════════════════════════════
    // Report sections
    // ═══════════════════════════════════════════════════════════════════

    /**
     * @param points time-ordered points of the report, with display addresses
     * @param zone   zone used to bucket movement by hour of day
     */
    public TrackingInsights insights(TripSummary trip, StopAnalysis stopAnalysis,
                                     List<TrackingPointView> points, ZoneId zone) {
        List<Stop> stops = stopAnalysis.getStops();
        List<KeyLocation> keyLocations = new ArrayList<>();
        for (Stop stop : stops.subList(0, Math.min(KEY_LOCATION_LIMIT, stops.size()))) {
            keyLocations.add(new KeyLocation(stop, locationProductivity(stop)));
        }

        return TrackingInsights.builder()
                .efficiencyRating(efficiencyRating(trip, stopAnalysis))
                .productivityScore(productivityScore(stops))
                .productiveStops((int) stops.stream().filter(s -> s.getDurationMinutes() >= PRODUCTIVE_STOP_MINUTES).count())
                .travelOptimization(travelOptimization(stops))
                .keyLocations(keyLocations)
                .travelEfficiency(travelEfficiency(trip))
                .routeOptimization(routeOptimization(points.isEmpty() ? null : points.get(0), stops))
                .movementPatterns(movementPatterns(points, zone))
                .build();
    }

    /** Headline numbers, taken from the trip summary plus address counts over the points. */
    public TrackingAnalytics headline(TripSummary trip, List<TrackingPointView> points) {
        if (points.isEmpty()) {
            return TrackingAnalytics.empty();
        }
        Map<String, Integer> visits = new HashMap<>();
        String mostVisited = null;
        int maxVisits = 0;
        for (TrackingPointView point : points) {
            if (point.getAddress() == null) {
                continue;
            }
            int count = visits.merge(point.getAddress(), 1, Integer::sum);
            if (count > maxVisits) {
                maxVisits = count;
                mostVisited = point.getAddress();
            }
        }

        return TrackingAnalytics.builder()
                .totalDistance(GeoUtil.round(trip.getTotalDistanceKm(), 2))
                .averageSpeed(trip.getAverageSpeedKmh())
                .topSpeed(trip.getMaxSpeedKmh())
                .timeSpentMoving(trip.getMovingTimeMinutes())
                .timeSpentStationary(trip.getStoppedTimeMinutes())
                .locationsVisited(visits.size())
                .mostVisitedLocation(mostVisited)
                .build();
    }

    public LocationAnalysis locationAnalysis(TripSummary trip, StopAnalysis stopAnalysis) {
        return LocationAnalysis.builder()
                .locationsVisited(stopAnalysis.getLocations())
                .averageTimePerLocationMinutes(stopAnalysis.getAverageTimeMinutes())
                .averageTimePerLocationFormatted(stopAnalysis.getAverageTimeFormatted())
                .timeSpentByLocation(trip.getLocationTimeSpent())
                .build();
    }

    // ═══════════════════════════════════════════════════════════════════
    // Ratings
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Scores out of 100: average speed (30), average stop length (30),
     * km per elapsed hour (40). 80+ High, 60+ Medium, else Low.
     */
    public EfficiencyRating efficiencyRating(TripSummary trip, StopAnalysis stopAnalysis) {
        int score = 0;

        double speed = trip.getAverageSpeedKmh();
        if (speed > 15 && speed < 60) {
            score += 30;
        } else if (speed > 10) {
            score += 20;
        } else {
            score += 10;
        }

        long averageStop = stopAnalysis.getAverageTimeMinutes();
        if (averageStop > 15 && averageStop < 120) {
            score += 30;
        } else if (averageStop > 10) {
            score += 20;
        } else {
            score += 10;
        }

        double kmPerHour = trip.getTotalTimeMinutes() > 0
                ? trip.getTotalDistanceKm() / (trip.getTotalTimeMinutes() / 60.0)
                : 0;
        if (kmPerHour > 5) {
            score += 40;
        } else if (kmPerHour > 2) {
            score += 30;
        } else if (kmPerHour > 1) {
            score += 20;
        } else {
            score += 10;
        }

        return EfficiencyRating.fromScore(score);
    }

    public TravelEfficiency travelEfficiency(TripSummary trip) {
        double movingRatio = trip.getTotalTimeMinutes() > 0
                ? (double) trip.getMovingTimeMinutes() / trip.getTotalTimeMinutes()
                : 0;

        int score = 0;
        if (trip.getAverageSpeedKmh() > 20) {
            score += 30;
        } else if (trip.getAverageSpeedKmh() > 10) {
            score += 20;
        } else {
            score += 10;
        }

        if (movingRatio > 0.4) {
            score += 30;
        } else if (movingRatio > 0.2) {
            score += 20;
        } else {
            score += 10;
        }

        score += trip.getMaxSpeedKmh() > 30 && trip.getMaxSpeedKmh() < 80 ? 40 : 20;

        return TravelEfficiency.builder()
                .score(EfficiencyRating.fromScore(score))
                .averageSpeedKmh(trip.getAverageSpeedKmh())
                .maxSpeedKmh(trip.getMaxSpeedKmh())
                .movingRatio(GeoUtil.round(movingRatio, 2))
                .build();
    }

    /** Share of stops lasting 15 minutes or more, as a percentage. */
    public int productivityScore(List<Stop> stops) {
        if (stops.isEmpty()) {
            return 0;
        }
        long productive = stops.stream().filter(s -> s.getDurationMinutes() >= PRODUCTIVE_STOP_MINUTES).count();
        return (int) Math.round(productive * 100.0 / stops.size());
    }

    public String locationProductivity(Stop stop) {
        if (stop.getDurationMinutes() >= 60) {
            return "High";
        }
        if (stop.getDurationMinutes() >= 30) {
            return "Medium";
        }
        return stop.getDurationMinutes() >= PRODUCTIVE_STOP_MINUTES ? "Low" : "Minimal";
    }

    // ═══════════════════════════════════════════════════════════════════
    // Route suggestions
    // ═══════════════════════════════════════════════════════════════════

    public TravelOptimization travelOptimization(List<Stop> stops) {
        if (stops.size() < 2) {
            return TravelOptimization.builder().optimizationScore("N/A").build();
        }

        double distanceKm = pathKm(null, stops);
        List<String> suggestions = new ArrayList<>();
        if (distanceKm > 50) {
            suggestions.add("Consider route optimization to reduce travel distance");
        }
        if (stops.stream().anyMatch(s -> s.getDurationMinutes() < 10)) {
            suggestions.add("Some stops were very short - consider consolidating tasks");
        }

        String score = distanceKm < 30 ? "High" : distanceKm < 60 ? "Medium" : "Low";
        return TravelOptimization.builder()
                .totalTravelDistanceKm(GeoUtil.round(distanceKm, 2))
                .optimizationScore(score)
                .suggestions(suggestions)
                .build();
    }

    /**
     * Compares the day as driven (origin, then each stop in order) with the same
     * stops visited in reverse from the same origin. Savings over 2 km are
     * reported as a recommendation.
     */
    public RouteOptimization routeOptimization(TrackingPointView origin, List<Stop> stops) {
        if (stops.size() < 3) {
            return RouteOptimization.builder()
                    .recommendation("Need at least 3 stops to analyze route optimization")
                    .build();
        }

        List<Stop> reversed = new ArrayList<>(stops);
        Collections.reverse(reversed);

        double current = pathKm(origin, stops);
        double optimized = pathKm(origin, reversed);
        double savings = Math.max(0, current - optimized);
        boolean worthIt = savings > ROUTE_SAVINGS_THRESHOLD_KM;

        return RouteOptimization.builder()
                .canOptimize(worthIt)
                .currentRouteDistanceKm(GeoUtil.round(current, 2))
                .optimizedRouteDistanceKm(GeoUtil.round(optimized, 2))
                .potentialSavingsKm(GeoUtil.round(savings, 2))
                .recommendation(worthIt
                        ? String.format(Locale.ROOT, "Route could be optimized to save %.1fkm", savings)
                        : "Current route appears well optimized")
                .build();
    }

    private static double pathKm(TrackingPointView origin, List<Stop> stops) {
        double km = 0;
        double lat = origin != null ? origin.getLatitude() : stops.get(0).getLatitude();
        double lon = origin != null ? origin.getLongitude() : stops.get(0).getLongitude();
        for (Stop stop : stops) {
            km += GeoUtil.distanceKm(lat, lon, stop.getLatitude(), stop.getLongitude());
            lat = stop.getLatitude();
            lon = stop.getLongitude();
        }
        return km;
    }

    // ═══════════════════════════════════════════════════════════════════
    // Movement by hour
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Distance moved per hour of day; each hop is booked to the hour of its
     * arrival point. Needs at least 10 points.
     */
    public MovementPattern movementPatterns(List<TrackingPointView> points, ZoneId zone) {
        if (points.size() < MIN_POINTS_FOR_PATTERNS) {
            return MovementPattern.builder()
                    .pattern("Insufficient data")
                    .analysis("Need more tracking points for pattern analysis")
                    .build();
        }

        Map<Integer, double[]> byHour = new TreeMap<>();
        for (int i = 1; i < points.size(); i++) {
            TrackingPointView from = points.get(i - 1);
            TrackingPointView to = points.get(i);
            int hour = to.getCapturedAt().atZone(zone).getHour();
            double[] bucket = byHour.computeIfAbsent(hour, h -> new double[2]);
            bucket[0] += GeoUtil.distanceKm(from.getLatitude(), from.getLongitude(), to.getLatitude(), to.getLongitude());
            bucket[1]++;
        }

        List<HourlyMovement> hours = new ArrayList<>();
        byHour.forEach((hour, bucket) -> hours.add(new HourlyMovement(hour, GeoUtil.round(bucket[0], 2), (int) bucket[1])));
        hours.sort(Comparator.comparingDouble(HourlyMovement::getDistanceKm).reversed());

        HourlyMovement peak = hours.get(0);
        return MovementPattern.builder()
                .pattern("Most active during " + peak.getHour() + ":00 hour")
                .peakMovementHour(peak.getHour())
                .peakMovementDistanceKm(peak.getDistanceKm())
                .analysis("Movement distributed across " + hours.size() + " different hours")
                .hourlyBreakdown(new ArrayList<>(hours.subList(0, Math.min(HOURLY_BREAKDOWN_LIMIT, hours.size()))))
                .build();
    }

    // ═══════════════════════════════════════════════════════════════════
    // Across users
    // ═══════════════════════════════════════════════════════════════════

    public OrganizationSummary organizationSummary(List<TrackingReport> reports) {
        if (reports.isEmpty()) {
            return OrganizationSummary.empty();
        }

        double totalDistance = 0;
        long totalPoints = 0;
        TrackingReport most = reports.get(0);
        TrackingReport least = reports.get(0);
        for (TrackingReport report : reports) {
            totalDistance += report.getAnalytics() != null ? report.getAnalytics().getTotalDistance() : 0;
            totalPoints += report.getTotalPoints();
            if (report.getTotalPoints() > most.getTotalPoints()) {
                most = report;
            }
            if (report.getTotalPoints() < least.getTotalPoints()) {
                least = report;
            }
        }

        return OrganizationSummary.builder()
                .totalDistanceKm(GeoUtil.round(totalDistance, 2))
                .averagePointsPerUser(Math.round((double) totalPoints / reports.size()))
                .mostActiveUser(most.getUser())
                .leastActiveUser(least.getUser())
                .build();
    }
}
