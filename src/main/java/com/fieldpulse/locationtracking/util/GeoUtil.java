package com.fieldpulse.locationtracking.util;

import java.util.Locale;

/**
 * Geospatial helpers shared by ingestion, geocoding and analytics.
 *
 * All functions are pure: great-circle distance, coordinate rounding for
 * cache buckets, and human readable distance/duration formatting.
 */
public final class GeoUtil {

    // Earth's radius in meters
    private static final double EARTH_RADIUS_METERS = 6371000;

    private GeoUtil() {
    }

    /**
     * Calculate distance between two GPS coordinates using Haversine formula
     *
     * @param lat1 Latitude of first point
     * @param lon1 Longitude of first point
     * @param lat2 Latitude of second point
     * @param lon2 Longitude of second point
     * @return Distance in meters
     */
    public static double distanceMeters(double lat1, double lon1, double lat2, double lon2) {
        double lat1Rad = Math.toRadians(lat1);
        double lat2Rad = Math.toRadians(lat2);
        double deltaLat = lat2Rad - lat1Rad;
        double deltaLon = Math.toRadians(lon2) - Math.toRadians(lon1);

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2) +
                   Math.cos(lat1Rad) * Math.cos(lat2Rad) *
                   Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);

        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_METERS * c;
    }

    /** Same as {@link #distanceMeters} but in kilometres. */
    public static double distanceKm(double lat1, double lon1, double lat2, double lon2) {
        return distanceMeters(lat1, lon1, lat2, lon2) / 1000.0;
    }

    /**
     * Check if a point is within a radius of a centre
     */
    public static boolean isWithinRadius(double lat1, double lon1, double lat2, double lon2, double radiusMeters) {
        return distanceMeters(lat1, lon1, lat2, lon2) <= radiusMeters;
    }

    /**
     * Rounds a coordinate to 4 decimal places (roughly an 11m bucket).
     */
    public static double roundCoordinate(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }

    /**
     * Display fallback used when no address could be resolved: "lat, lon" at 4 decimals.
     */
    public static String coordinateLabel(double latitude, double longitude) {
        return String.format(Locale.ROOT, "%.4f, %.4f", latitude, longitude);
    }

    /**
     * Format distance to human readable string
     *
     * @param distanceKm distance in kilometres
     * @return "850 meters" below one kilometre, "12.34 km" otherwise
     */
    public static String formatDistance(double distanceKm) {
        if (distanceKm < 1) {
            return Math.round(distanceKm * 1000) + " meters";
        }
        return String.format(Locale.ROOT, "%.2f km", distanceKm);
    }

    /**
     * Format duration from minutes to human readable string, e.g. "45m" or "2h 5m".
     */
    public static String formatDuration(double minutes) {
        if (minutes < 60) {
            return Math.round(minutes) + "m";
        }
        long hours = (long) Math.floor(minutes / 60);
        long remainingMinutes = Math.round(minutes % 60);
        if (remainingMinutes == 60) {
            hours++;
            remainingMinutes = 0;
        }
        return hours + "h" + (remainingMinutes > 0 ? " " + remainingMinutes + "m" : "");
    }

    /** Rounds to the given number of decimal places. */
    public static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }

}
