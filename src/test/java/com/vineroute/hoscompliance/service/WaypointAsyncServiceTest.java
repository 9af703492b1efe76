package com.vineroute.hoscompliance.service;

import com.vineroute.hoscompliance.dto.WaypointRequest;
import com.vineroute.hoscompliance.exception.InvalidCoordinateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WaypointAsyncService batch sync.
 */
@ExtendWith(MockitoExtension.class)
class WaypointAsyncServiceTest {

    @Mock private TimeCardLedger timeCardLedger;

    @InjectMocks
    private WaypointAsyncService waypointAsyncService;

    private static WaypointRequest sample(String at, double latitude) {
        return WaypointRequest.builder()
                .driverId(2L)
                .latitude(latitude)
                .longitude(-118.34)
                .timestamp(Instant.parse(at))
                .build();
    }

    @Test
    @DisplayName("Buffered samples are replayed in timestamp order, not delivery order")
    void batch_sortedByTimestamp() {
        WaypointRequest late  = sample("2026-06-10T18:00:00Z", 46.5);
        WaypointRequest early = sample("2026-06-10T16:00:00Z", 46.2);
        when(timeCardLedger.recordWaypoint(any())).thenReturn(true);

        waypointAsyncService.processBatch(List.of(late, early));

        InOrder order = inOrder(timeCardLedger);
        order.verify(timeCardLedger).recordWaypoint(early);
        order.verify(timeCardLedger).recordWaypoint(late);
    }

    @Test
    @DisplayName("A rejected sample is counted as failed and the rest of the batch still runs")
    void batch_failureDoesNotAbort() {
        WaypointRequest bad       = sample("2026-06-10T16:00:00Z", 91.0);
        WaypointRequest recorded  = sample("2026-06-10T17:00:00Z", 46.3);
        WaypointRequest discarded = sample("2026-06-10T18:00:00Z", 46.4);
        when(timeCardLedger.recordWaypoint(bad)).thenThrow(new InvalidCoordinateException(91.0, -118.34));
        when(timeCardLedger.recordWaypoint(recorded)).thenReturn(true);
        when(timeCardLedger.recordWaypoint(discarded)).thenReturn(false);

        Map<String, Integer> result = waypointAsyncService.processBatch(List.of(discarded, bad, recorded));

        assertThat(result).containsEntry("total", 3)
                .containsEntry("recorded", 1)
                .containsEntry("discarded", 1)
                .containsEntry("failed", 1);
    }

    @Test
    @DisplayName("A sample without a timestamp is counted as failed; the rest are still sorted and recorded")
    void batch_missingTimestamp() {
        WaypointRequest undated = WaypointRequest.builder().driverId(2L).latitude(46.3).longitude(-118.34).build();
        WaypointRequest late    = sample("2026-06-10T18:00:00Z", 46.5);
        WaypointRequest early   = sample("2026-06-10T16:00:00Z", 46.2);
        when(timeCardLedger.recordWaypoint(any())).thenReturn(true);

        Map<String, Integer> result = waypointAsyncService.processBatch(List.of(late, undated, early));

        assertThat(result).containsEntry("total", 3)
                .containsEntry("recorded", 2)
                .containsEntry("failed", 1);
        InOrder order = inOrder(timeCardLedger);
        order.verify(timeCardLedger).recordWaypoint(early);
        order.verify(timeCardLedger).recordWaypoint(late);
        verify(timeCardLedger, never()).recordWaypoint(undated);
    }
}
