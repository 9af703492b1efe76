package com.vineroute.hoscompliance.controller;

import com.vineroute.hoscompliance.dto.ApiResponse;
import com.vineroute.hoscompliance.dto.ClockInRequest;
import com.vineroute.hoscompliance.dto.ClockOutRequest;
import com.vineroute.hoscompliance.dto.WaypointRequest;
import com.vineroute.hoscompliance.entity.TimeCard;
import com.vineroute.hoscompliance.entity.TimeCardStatus;
import com.vineroute.hoscompliance.model.ClockOutResult;
import com.vineroute.hoscompliance.model.ComplianceViolation;
import com.vineroute.hoscompliance.model.Severity;
import com.vineroute.hoscompliance.model.ViolationType;
import com.vineroute.hoscompliance.service.TimeCardLedger;
import com.vineroute.hoscompliance.service.WaypointAsyncService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for TimeClockController.
 *
 * Test cases:
 *  1. clockIn_returnsCreated
 *  2. clockOutWithFindings_isStillSuccessful
 *     Violations ride along in a 200 response, they are not errors.
 *  3. emptyBatch_rejected / oversizedBatch_rejected
 *     Batch guards run before any waypoint is touched.
 *  4. batch_delegatesToAsyncService
 */
@ExtendWith(MockitoExtension.class)
class TimeClockControllerTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private TimeCardLedger       timeCardLedger;
    @Mock private WaypointAsyncService waypointAsyncService;

    @InjectMocks
    private TimeClockController controller;

    // ── Test fixtures ─────────────────────────────────────────────────────────

    private static final Long DRIVER_ID = 2L;
    private static final Instant CLOCK_IN = Instant.parse("2026-06-10T15:00:00Z");

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(controller, "maxBatchSize", 3);
    }

    private WaypointRequest waypoint(int minutes) {
        return WaypointRequest.builder()
                .driverId(DRIVER_ID)
                .latitude(46.1)
                .longitude(-118.4)
                .timestamp(CLOCK_IN.plusSeconds(minutes * 60L))
                .build();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 1 — clock-in
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Clock-in answers 201 with the new time card")
    void clockIn_returnsCreated() {
        TimeCard card = TimeCard.builder().id(50L).driverId(DRIVER_ID).vehicleId(3L)
                .clockInAt(CLOCK_IN).status(TimeCardStatus.OPEN).build();
        when(timeCardLedger.clockIn(any(ClockInRequest.class))).thenReturn(card);

        ResponseEntity<ApiResponse> response = controller.clockIn(ClockInRequest.builder()
                .driverId(DRIVER_ID).vehicleId(3L).timestamp(CLOCK_IN).build());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        assertThat(response.getBody().isSuccess()).isTrue();
        assertThat(response.getBody().getData()).isSameAs(card);
        assertThat(response.getBody().getMessage()).contains("#50");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 2 — clock-out with findings
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Clock-out with violations is still a 200 success carrying the findings")
    void clockOutWithFindings_isStillSuccessful() {
        ComplianceViolation violation = ComplianceViolation.builder()
                .type(ViolationType.DETAILED_LOGS_REQUIRED)
                .severity(Severity.CRITICAL)
                .date(LocalDate.of(2026, 6, 10))
                .message("9 exceedance days")
                .build();
        ClockOutResult result = ClockOutResult.builder()
                .hoursWorked(new BigDecimal("8.50"))
                .violations(List.of(violation))
                .build();
        when(timeCardLedger.clockOut(any(ClockOutRequest.class))).thenReturn(result);

        ResponseEntity<ApiResponse> response = controller.clockOut(ClockOutRequest.builder()
                .driverId(DRIVER_ID).timestamp(CLOCK_IN.plusSeconds(30600)).signature("sig.png").build());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().isSuccess()).isTrue();
        assertThat(response.getBody().getMessage()).contains("8.50 h").contains("1 compliance finding");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 3 — batch guards
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Empty batch → 400 EmptyBatch")
    void emptyBatch_rejected() {
        ResponseEntity<ApiResponse> response = controller.recordWaypointBatch(Collections.emptyList());

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getErrorCode()).isEqualTo("EmptyBatch");
        verifyNoInteractions(waypointAsyncService);
    }

    @Test
    @DisplayName("Batch above the configured maximum → 413 BatchTooLarge")
    void oversizedBatch_rejected() {
        List<WaypointRequest> batch = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            batch.add(waypoint(i));
        }

        ResponseEntity<ApiResponse> response = controller.recordWaypointBatch(batch);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE);
        assertThat(response.getBody().getErrorCode()).isEqualTo("BatchTooLarge");
        verifyNoInteractions(waypointAsyncService);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Test 4 — batch processing
    // ════════════════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Batch within limits is processed and summarized")
    void batch_delegatesToAsyncService() {
        List<WaypointRequest> batch = List.of(waypoint(0), waypoint(5));
        when(waypointAsyncService.processBatch(batch))
                .thenReturn(Map.of("total", 2, "recorded", 1, "discarded", 1, "failed", 0));

        ResponseEntity<ApiResponse> response = controller.recordWaypointBatch(batch);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().getMessage()).isEqualTo("Batch processed: 1/2 recorded");
    }
}
