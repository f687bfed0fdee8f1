package com.companya.trippipeline.service;

import com.companya.trippipeline.kafka.TripLogPublisher;
import com.companya.trippipeline.metrics.PipelineMetrics;
import com.companya.trippipeline.model.IngestResult;
import com.companya.trippipeline.model.ObjectNotification;
import com.companya.trippipeline.model.ObjectNotificationBatch;
import com.companya.trippipeline.model.TripFields;
import com.companya.trippipeline.parse.TripCsvParser;
import com.companya.trippipeline.storage.ObjectStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Turns newly uploaded trip files into stream records, one per row, keyed by
 * trip id.
 *
 * Failure handling is layered: a missing stream name rejects the whole batch
 * before anything is read, a file that cannot be fetched or parsed is logged
 * and skipped, and a row that cannot be appended is logged while the rest of
 * its file continues.
 */
@Slf4j
@Service
public class TripIngestionService {

    static final String STREAM_NOT_CONFIGURED = "Stream name not configured";

    private final ObjectStore objectStore;
    private final TripCsvParser csvParser;
    private final TripLogPublisher logPublisher;
    private final ObjectMapper objectMapper;
    private final PipelineMetrics metrics;
    private final String streamName;
    private final String keySuffix;

    public TripIngestionService(ObjectStore objectStore,
                                TripCsvParser csvParser,
                                TripLogPublisher logPublisher,
                                ObjectMapper objectMapper,
                                PipelineMetrics metrics,
                                @Value("${pipeline.ingestor.stream-name:}") String streamName,
                                @Value("${pipeline.ingestor.key-suffix:.csv}") String keySuffix) {
        this.objectStore = objectStore;
        this.csvParser = csvParser;
        this.logPublisher = logPublisher;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.streamName = streamName;
        this.keySuffix = keySuffix;
    }

    public IngestResult ingest(ObjectNotificationBatch batch) {
        log.info("Ingestion invoked for {} notification(s)", batch.records().size());

        if (streamName == null || streamName.isBlank()) {
            log.error("Property 'pipeline.ingestor.stream-name' is not set");
            return IngestResult.error(STREAM_NOT_CONFIGURED);
        }
        log.info("Stream name: {}", streamName);

        for (ObjectNotification notification : batch.records()) {
            if (!matchesSuffix(notification.key())) {
                log.info("Skipping {}/{}: key does not end with '{}'",
                        notification.bucket(), notification.key(), keySuffix);
                continue;
            }
            log.info("New file detected: {}/{}", notification.bucket(), notification.key());
            try {
                int rows = ingestFile(notification);
                log.info("Processed {} rows from file {}", rows, notification.key());
            } catch (Exception ex) {
                metrics.fileFailed();
                log.error("Error processing file {}: {}", notification.key(), ex.getMessage(), ex);
            }
        }

        log.info("Ingestion completed");
        return IngestResult.done();
    }

    private int ingestFile(ObjectNotification notification) {
        byte[] content = objectStore.get(notification.bucket(), notification.key());
        log.debug("Fetched {} bytes from {}/{}", content.length, notification.bucket(), notification.key());

        List<Map<String, String>> rows = csvParser.parse(content);
        int rowCount = 0;
        for (Map<String, String> row : rows) {
            rowCount++;
            String tripId = partitionKey(row);
            try {
                logPublisher.append(streamName, objectMapper.writeValueAsBytes(row), tripId);
                metrics.rowPublished();
                log.debug("Sent trip_id {} (row {}) to {}", tripId, rowCount, streamName);
            } catch (JsonProcessingException | RuntimeException ex) {
                metrics.rowFailed();
                log.error("Failed to send row {} of {} (trip_id {}): {}",
                        rowCount, notification.key(), tripId, ex.getMessage(), ex);
            }
        }
        return rowCount;
    }

    private boolean matchesSuffix(String key) {
        return keySuffix == null || keySuffix.isBlank() || (key != null && key.endsWith(keySuffix));
    }

    static String partitionKey(Map<String, String> row) {
        String tripId = row.get(TripFields.TRIP_ID);
        return tripId == null || tripId.isBlank() ? TripFields.UNKNOWN_TRIP_ID : tripId;
    }
}
