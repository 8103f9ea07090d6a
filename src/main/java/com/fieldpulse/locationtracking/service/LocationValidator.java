package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.dto.AccuracyFilterResult;
import com.fieldpulse.locationtracking.dto.AccuracyInfo;
import com.fieldpulse.locationtracking.dto.TrackingPointView;
import com.fieldpulse.locationtracking.dto.ValidationOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a GPS sample is worth keeping.
 *
 * Checks run in a fixed order: range, then virtual marker, then accuracy.
 * Only the range check is an input error; the other two are expected noise
 * from the device fleet.
 *
 * Virtual marker: the fleet's test harness emits coordinates whose digits contain
 * "122". Any coordinate whose absolute value, with the decimal point removed,
 * contains that sequence is treated as synthetic. This also catches a handful of
 * real places (e.g. longitude -122.x on the US west coast).
 */
@Service
@Slf4j
public class LocationValidator {

    private static final String VIRTUAL_MARKER = "122";

    @Value("${tracking.accuracy.max-meters:20}")
    private double maxAccuracyMeters = 20;

    public ValidationOutcome validate(double latitude, double longitude, Double accuracy) {
        if (isOutOfRange(latitude, longitude)) {
            return ValidationOutcome.REJECT_OUT_OF_RANGE;
        }
        if (isVirtual(latitude, longitude)) {
            return ValidationOutcome.REJECT_VIRTUAL;
        }
        if (!isAcceptableAccuracy(accuracy)) {
            return ValidationOutcome.REJECT_INACCURATE;
        }
        return ValidationOutcome.ACCEPT;
    }

    public boolean isOutOfRange(double latitude, double longitude) {
        return Double.isNaN(latitude) || Double.isNaN(longitude)
                || Math.abs(latitude) > 90 || Math.abs(longitude) > 180;
    }

    public boolean isVirtual(double latitude, double longitude) {
        boolean virtual = digitsOf(latitude).contains(VIRTUAL_MARKER) || digitsOf(longitude).contains(VIRTUAL_MARKER);
        if (virtual) {
            log.debug("Virtual location detected: lat={}, lon={}", latitude, longitude);
        }
        return virtual;
    }

    /** Missing accuracy counts as unacceptable. */
    public boolean isAcceptableAccuracy(Double accuracy) {
        if (accuracy == null) {
            return false;
        }
        boolean acceptable = accuracy <= maxAccuracyMeters;
        if (!acceptable) {
            log.debug("Low accuracy GPS point: {}m (threshold: {}m)", accuracy, maxAccuracyMeters);
        }
        return acceptable;
    }

    public double getMaxAccuracyMeters() {
        return maxAccuracyMeters;
    }

    /**
     * Keeps only points with an accuracy reading at or under the threshold,
     * preserving order.
     */
    public AccuracyFilterResult filterByAccuracy(List<TrackingPointView> points) {
        int hasAccuracy = 0;
        int noAccuracy = 0;
        int aboveThreshold = 0;
        List<TrackingPointView> kept = new ArrayList<>(points.size());

        for (TrackingPointView point : points) {
            if (point.getAccuracy() == null) {
                noAccuracy++;
                continue;
            }
            hasAccuracy++;
            if (point.getAccuracy() > maxAccuracyMeters) {
                aboveThreshold++;
                continue;
            }
            kept.add(point);
        }

        int inaccurate = points.size() - kept.size();
        if (inaccurate > 0) {
            log.debug("Accuracy filtering: {} -> {} points ({} without accuracy, {} above {}m)",
                    points.size(), kept.size(), noAccuracy, aboveThreshold, maxAccuracyMeters);
        }

        return AccuracyFilterResult.builder()
                .keptPoints(kept)
                .originalCount(points.size())
                .inaccurateCount(inaccurate)
                .accuracyInfo(new AccuracyInfo(hasAccuracy, noAccuracy, aboveThreshold))
                .build();
    }

    private static String digitsOf(double coordinate) {
        return BigDecimal.valueOf(Math.abs(coordinate)).toPlainString().replace(".", "");
    }
}
