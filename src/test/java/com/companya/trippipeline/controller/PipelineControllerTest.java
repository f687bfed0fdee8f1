package com.companya.trippipeline.controller;

import com.companya.trippipeline.model.DailyKpi;
import com.companya.trippipeline.model.IngestResult;
import com.companya.trippipeline.model.ObjectNotification;
import com.companya.trippipeline.model.ObjectNotificationBatch;
import com.companya.trippipeline.service.KpiAggregationService;
import com.companya.trippipeline.service.TripIngestionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PipelineController Tests")
class PipelineControllerTest {

    @Mock
    private TripIngestionService ingestionService;

    @Mock
    private KpiAggregationService aggregationService;

    @InjectMocks
    private PipelineController controller;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("Should translate notifications and return the ingest result")
    void shouldIngestNotifications() throws Exception {
        // Given
        when(ingestionService.ingest(any())).thenReturn(IngestResult.done());

        // When
        ResponseEntity<IngestResult> response = controller.onObjectsCreated(objectMapper.readTree(
                "{\"records\":[{\"bucket\":\"raw\",\"key\":\"trips.csv\"}]}"));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(IngestResult.done());
        ArgumentCaptor<ObjectNotificationBatch> batch = ArgumentCaptor.forClass(ObjectNotificationBatch.class);
        verify(ingestionService).ingest(batch.capture());
        assertThat(batch.getValue().records()).containsExactly(new ObjectNotification("raw", "trips.csv"));
    }

    @Test
    @DisplayName("Should answer 500 when ingestion reports an error")
    void shouldReportIngestErrors() throws Exception {
        when(ingestionService.ingest(any())).thenReturn(IngestResult.error("Stream name not configured"));

        ResponseEntity<IngestResult> response = controller.onObjectsCreated(objectMapper.readTree("{}"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().message()).isEqualTo("Stream name not configured");
    }

    @Test
    @DisplayName("Should return the written KPIs")
    void shouldAggregate() {
        DailyKpi kpi = new DailyKpi(LocalDateTime.of(2025, 4, 22, 8, 30), 20.0, 1, 20.0, 20.0, 20.0);
        when(aggregationService.aggregate()).thenReturn(List.of(kpi));

        ResponseEntity<Map<String, Object>> response = controller.aggregate();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody())
                .containsEntry("status", "done")
                .containsEntry("kpis", List.of(kpi));
    }

    @Test
    @DisplayName("Should answer 500 with the failure message when aggregation fails")
    void shouldReportAggregationFailure() {
        when(aggregationService.aggregate()).thenThrow(new IllegalStateException("scan failed"));

        ResponseEntity<Map<String, Object>> response = controller.aggregate();

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody())
                .containsEntry("status", "error")
                .containsEntry("message", "scan failed");
    }
}
