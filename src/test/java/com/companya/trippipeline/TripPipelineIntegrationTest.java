package com.companya.trippipeline;

import com.companya.trippipeline.kafka.TripLogPublisher;
import com.companya.trippipeline.model.DailyKpi;
import com.companya.trippipeline.model.IngestResult;
import com.companya.trippipeline.model.LogRecord;
import com.companya.trippipeline.model.MergeResult;
import com.companya.trippipeline.model.ObjectNotification;
import com.companya.trippipeline.model.ObjectNotificationBatch;
import com.companya.trippipeline.model.TripRecord;
import com.companya.trippipeline.service.KpiAggregationService;
import com.companya.trippipeline.service.TripIngestionService;
import com.companya.trippipeline.service.TripMergeService;
import com.companya.trippipeline.store.TripRecordStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;

/**
 * Drives a file through all three stages with the stream replaced by an
 * in-memory list.
 */
@SpringBootTest
@ActiveProfiles("test")
@DisplayName("Trip Pipeline Integration Tests")
class TripPipelineIntegrationTest {

    @TempDir
    static Path buckets;

    @DynamicPropertySource
    static void objectStoreRoot(DynamicPropertyRegistry registry) {
        registry.add("pipeline.object-store.root", () -> buckets.toString());
    }

    @Autowired
    private TripIngestionService ingestionService;

    @Autowired
    private TripMergeService mergeService;

    @Autowired
    private KpiAggregationService aggregationService;

    @Autowired
    private TripRecordStore store;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private TripLogPublisher logPublisher;

    @Test
    @DisplayName("Should ingest, merge and aggregate a trip file end to end")
    void shouldRunAllStages() throws Exception {
        // Given
        List<LogRecord> stream = new ArrayList<>();
        doAnswer(invocation -> stream.add(new LogRecord(invocation.getArgument(2), invocation.getArgument(1))))
                .when(logPublisher).append(eq("trips-test"), any(byte[].class), anyString());

        Path raw = Files.createDirectories(buckets.resolve("raw"));
        Files.writeString(raw.resolve("trips.csv"), String.join("\n",
                "trip_id,pickup_datetime,fare_amount,estimated_fare_amount",
                "1,2025-04-22T08:30:00,20.0,22.0",
                "2,2025-04-22T09:00:00,25.0,27.0",
                "3,2025-04-22T10:15:00,15.0,17.0",
                "4,2025-04-22T10:15:00,,",
                ""), StandardCharsets.UTF_8);

        // When
        IngestResult ingest = ingestionService.ingest(
                ObjectNotificationBatch.of(new ObjectNotification("raw", "trips.csv")));
        MergeResult merge = mergeService.mergeBatch(stream);
        List<DailyKpi> kpis = aggregationService.aggregate();

        // Then
        assertThat(ingest).isEqualTo(IngestResult.done());
        assertThat(stream).extracting(LogRecord::partitionKey).containsExactly("1", "2", "3", "4");
        assertThat(merge).isEqualTo(MergeResult.ok(4, 0));

        assertThat(store.getItem("trips-test", "1")).get()
                .extracting(TripRecord::getItem)
                .isEqualTo(Map.of(
                        "trip_id", "1",
                        "pickup_datetime", "2025-04-22T08:30:00",
                        "fare_amount", "20.0",
                        "estimated_fare_amount", "22.0",
                        "id", "1"));

        // trip 4 has empty fare columns, present but not numeric
        assertThat(kpis).extracting(DailyKpi::countTrips).containsExactly(1L, 1L, 1L);
        assertThat(kpis.get(2).totalFare()).isEqualTo(15.0);

        // groups share a date, so the last one written wins
        Path output = buckets.resolve("kpi-test/kpis/date=2025-04-22/kpi.json");
        JsonNode written = objectMapper.readTree(Files.readAllBytes(output));
        assertThat(written.get("pickup_datetime").asText()).isEqualTo("2025-04-22T10:15:00");
        assertThat(written.get("count_trips").asLong()).isEqualTo(1);
        assertThat(written.get("min_fare").asDouble()).isEqualTo(15.0);
    }
}
