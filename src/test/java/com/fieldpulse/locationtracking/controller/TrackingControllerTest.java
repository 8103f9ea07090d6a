package com.fieldpulse.locationtracking.controller;

import com.fieldpulse.locationtracking.dto.ApiResponse;
import com.fieldpulse.locationtracking.dto.BackfillSummary;
import com.fieldpulse.locationtracking.dto.IngestResult;
import com.fieldpulse.locationtracking.dto.IngestWarning;
import com.fieldpulse.locationtracking.dto.MultiUserReport;
import com.fieldpulse.locationtracking.dto.MultiUserReportRequest;
import com.fieldpulse.locationtracking.dto.Timeframe;
import com.fieldpulse.locationtracking.dto.TrackingPointRequest;
import com.fieldpulse.locationtracking.dto.TrackingPointView;
import com.fieldpulse.locationtracking.dto.TrackingReport;
import com.fieldpulse.locationtracking.dto.WarningType;
import com.fieldpulse.locationtracking.service.TrackingAnalyticsService;
import com.fieldpulse.locationtracking.service.TrackingIngestionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TrackingController.
 *
 * Test cases:
 *  1. storedPoint_returns201WithData
 *  2. skippedPoint_returns200WithWarnings
 *  3. timeframePath_resolvedToEnum
 *  4. unknownTimeframe_rejectedBeforeService
 *  5. multiUserBody_passedThrough
 *  6. backfillSummary_messageFallback
 */
@ExtendWith(MockitoExtension.class)
class TrackingControllerTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private TrackingIngestionService trackingIngestionService;
    @Mock private TrackingAnalyticsService trackingAnalyticsService;

    @InjectMocks
    private TrackingController trackingController;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final Long USER_ID = 1L;

    private TrackingPointRequest request() {
        return TrackingPointRequest.builder()
                .owner(USER_ID).latitude(-26.1929).longitude(28.0305).accuracy(5.0).build();
    }

    @Test
    @DisplayName("Stored point → 201 with the stored point as data")
    void storedPoint_returns201WithData() {
        TrackingPointView view = TrackingPointView.builder().id(10L).ownerId(USER_ID).build();
        when(trackingIngestionService.ingest(any(), eq(100L), isNull()))
                .thenReturn(IngestResult.builder().stored(true).message("Tracking point created successfully").data(view).build());

        ResponseEntity<ApiResponse> response = trackingController.create(request(), 100L, null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody().isSuccess()).isTrue();
        assertThat(response.getBody().getData()).isSameAs(view);
        assertThat(response.getBody().getWarnings()).isEmpty();
    }

    @Test
    @DisplayName("Point skipped as virtual → 200, no data, warning passed through")
    void skippedPoint_returns200WithWarnings() {
        IngestWarning warning = IngestWarning.builder().type(WarningType.VIRTUAL_LOCATION).message("skipped").build();
        when(trackingIngestionService.ingest(any(), isNull(), isNull()))
                .thenReturn(IngestResult.skipped("Virtual location skipped - not recorded", warning));

        ResponseEntity<ApiResponse> response = trackingController.create(request(), null, null);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getData()).isNull();
        assertThat(response.getBody().getMessage()).isEqualTo("Virtual location skipped - not recorded");
        assertThat(response.getBody().getWarnings()).containsExactly(warning);
    }

    @Test
    @DisplayName("GET timeframe/last_week → service called with LAST_WEEK and scope filters")
    void timeframePath_resolvedToEnum() {
        TrackingReport report = TrackingReport.builder().timeframe("last_week").build();
        when(trackingAnalyticsService.getReport(USER_ID, Timeframe.LAST_WEEK, null, null, 10L, 100L)).thenReturn(report);

        ResponseEntity<ApiResponse> response =
                trackingController.getByTimeframe(USER_ID, "last_week", null, null, 10L, 100L);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getData()).isSameAs(report);
    }

    @Test
    @DisplayName("Unknown timeframe in the path → IllegalArgumentException, service not called")
    void unknownTimeframe_rejectedBeforeService() {
        assertThatThrownBy(() -> trackingController.getByTimeframe(USER_ID, "fortnight", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(trackingAnalyticsService);
    }

    @Test
    @DisplayName("Multi-user body → ids, dates and scope passed to the service")
    void multiUserBody_passedThrough() {
        LocalDate start = LocalDate.of(2024, 3, 1);
        LocalDate end = LocalDate.of(2024, 3, 5);
        MultiUserReportRequest body = MultiUserReportRequest.builder()
                .userIds(List.of(1L, 2L)).startDate(start).endDate(end).organisationId(10L).build();
        MultiUserReport report = MultiUserReport.builder().requestedUsers(2).totalUsers(2).build();
        when(trackingAnalyticsService.getMultiUserReport(List.of(1L, 2L), Timeframe.CUSTOM, start, end, 10L, null))
                .thenReturn(report);

        ResponseEntity<ApiResponse> response = trackingController.getMultiUser("custom", body);

        assertThat(response.getBody().getData()).isSameAs(report);
        assertThat(response.getBody().getMessage()).isEqualTo("Tracking reports generated for 2 of 2 users");
    }

    @Test
    @DisplayName("Backfill summary without message → counts used as the response message")
    void backfillSummary_messageFallback() {
        when(trackingAnalyticsService.bulkBackfill(USER_ID, 20))
                .thenReturn(BackfillSummary.builder().processed(20).successful(18).build());

        ResponseEntity<ApiResponse> response = trackingController.backfillAddresses(USER_ID, 20);

        assertThat(response.getBody().getMessage()).isEqualTo("Geocoded 18 of 20 tracking points");
    }
}
