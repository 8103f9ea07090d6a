package com.fieldpulse.locationtracking.service;

import com.fieldpulse.locationtracking.dto.AccuracyFilterResult;
import com.fieldpulse.locationtracking.dto.TrackingPointView;
import com.fieldpulse.locationtracking.dto.ValidationOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LocationValidator.
 *
 * Test cases:
 *  1. out-of-range and NaN coordinates are rejected before anything else
 *  2. "122" anywhere in the decimal-stripped absolute coordinate marks it virtual
 *  3. accuracy must be present and at most 20 m
 *  4. accuracy filter keeps order and counts why points were dropped
 */
class LocationValidatorTest {

    private final LocationValidator validator = new LocationValidator();

    @Test
    @DisplayName("Out-of-range or NaN coordinates → REJECT_OUT_OF_RANGE, checked before the virtual marker")
    void outOfRange_rejectedFirst() {
        assertThat(validator.validate(91, 0, 5.0)).isEqualTo(ValidationOutcome.REJECT_OUT_OF_RANGE);
        assertThat(validator.validate(0, -180.5, 5.0)).isEqualTo(ValidationOutcome.REJECT_OUT_OF_RANGE);
        assertThat(validator.validate(Double.NaN, 0, 5.0)).isEqualTo(ValidationOutcome.REJECT_OUT_OF_RANGE);
        // 122 would also trip the virtual marker, but range wins
        assertThat(validator.validate(122.0, 0, 5.0)).isEqualTo(ValidationOutcome.REJECT_OUT_OF_RANGE);

        assertThat(validator.isOutOfRange(90, 180)).isFalse();
        assertThat(validator.isOutOfRange(-90, -180)).isFalse();
    }

    @Test
    @DisplayName("Coordinates containing the digits 122 → REJECT_VIRTUAL, even with good accuracy")
    void virtualMarker() {
        assertThat(validator.validate(37.7749, -122.4194, 5.0)).isEqualTo(ValidationOutcome.REJECT_VIRTUAL);
        // 12.1225 → "121225"
        assertThat(validator.isVirtual(12.1225, 77.5946)).isTrue();
        // 1.22 → "122" once the point is removed
        assertThat(validator.isVirtual(1.22, 30.0)).isTrue();
        assertThat(validator.isVirtual(0.00122, 30.0)).isTrue();

        assertThat(validator.isVirtual(-26.2041, 28.0473)).isFalse();
        assertThat(validator.validate(-26.2041, 28.0473, 5.0)).isEqualTo(ValidationOutcome.ACCEPT);
    }

    @Test
    @DisplayName("Accuracy must be reported and at most 20 m")
    void accuracyThreshold() {
        assertThat(validator.validate(-26.2041, 28.0473, null)).isEqualTo(ValidationOutcome.REJECT_INACCURATE);
        assertThat(validator.validate(-26.2041, 28.0473, 20.5)).isEqualTo(ValidationOutcome.REJECT_INACCURATE);
        assertThat(validator.validate(-26.2041, 28.0473, 20.0)).isEqualTo(ValidationOutcome.ACCEPT);
        assertThat(validator.getMaxAccuracyMeters()).isEqualTo(20.0);
    }

    @Test
    @DisplayName("Accuracy filter keeps accurate points in order and reports missing vs. above threshold")
    void filterByAccuracy_countsReasons() {
        TrackingPointView first = point(1L, 5.0);
        TrackingPointView noReading = point(2L, null);
        TrackingPointView tooCoarse = point(3L, 65.0);
        TrackingPointView last = point(4L, 20.0);

        AccuracyFilterResult result = validator.filterByAccuracy(List.of(first, noReading, tooCoarse, last));

        assertThat(result.getKeptPoints()).extracting(TrackingPointView::getId).containsExactly(1L, 4L);
        assertThat(result.getOriginalCount()).isEqualTo(4);
        assertThat(result.getInaccurateCount()).isEqualTo(2);
        assertThat(result.getAccuracyInfo().getHasAccuracy()).isEqualTo(3);
        assertThat(result.getAccuracyInfo().getNoAccuracy()).isEqualTo(1);
        assertThat(result.getAccuracyInfo().getAboveThreshold()).isEqualTo(1);
    }

    private TrackingPointView point(Long id, Double accuracy) {
        return TrackingPointView.builder()
                .id(id)
                .latitude(-26.2041)
                .longitude(28.0473)
                .accuracy(accuracy)
                .build();
    }
}
