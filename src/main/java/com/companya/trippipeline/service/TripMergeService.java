package com.companya.trippipeline.service;

import com.companya.trippipeline.exception.MalformedRecordException;
import com.companya.trippipeline.exception.MissingConfigurationException;
import com.companya.trippipeline.metrics.PipelineMetrics;
import com.companya.trippipeline.model.LogRecord;
import com.companya.trippipeline.model.MergeResult;
import com.companya.trippipeline.model.TripFields;
import com.companya.trippipeline.model.TripRecord;
import com.companya.trippipeline.store.TripRecordStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds trip stream records into the keyed store. Each record is handled on
 * its own: a record that cannot be decoded or lacks a trip id is logged and
 * dropped, and the rest of the batch still goes through.
 */
@Slf4j
@Service
public class TripMergeService {

    private static final TypeReference<LinkedHashMap<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final TripRecordStore store;
    private final ObjectMapper objectMapper;
    private final PipelineMetrics metrics;
    private final String tableName;

    public TripMergeService(TripRecordStore store,
                            ObjectMapper objectMapper,
                            PipelineMetrics metrics,
                            @Value("${pipeline.store.table-name:}") String tableName) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.tableName = tableName;
    }

    /**
     * @throws MissingConfigurationException if no table name is configured
     */
    public MergeResult mergeBatch(List<LogRecord> records) {
        if (tableName == null || tableName.isBlank()) {
            throw new MissingConfigurationException("pipeline.store.table-name");
        }
        log.info("Merge triggered with {} record(s)", records.size());

        int merged = 0;
        int failed = 0;
        for (LogRecord record : records) {
            try {
                TripRecord result = merge(record);
                merged++;
                metrics.recordMerged();
                log.info("Successfully merged and saved item for {}", result.getId());
            } catch (Exception ex) {
                failed++;
                metrics.recordFailed();
                log.error("Failed to process record with partition key {}: {}",
                        record.partitionKey(), ex.getMessage(), ex);
            }
        }
        return MergeResult.ok(merged, failed);
    }

    private TripRecord merge(LogRecord record) {
        Map<String, Object> payload = parse(decode(record.data()));
        log.debug("Parsed payload: {}", payload);

        Object tripIdValue = payload.get(TripFields.TRIP_ID);
        if (tripIdValue == null) {
            throw new MalformedRecordException("Payload has no " + TripFields.TRIP_ID);
        }
        String tripId = tripIdValue.toString();
        if (tripId.isBlank()) {
            throw new MalformedRecordException("Payload has a blank " + TripFields.TRIP_ID);
        }

        TripRecord existing = store.getItem(tableName, tripId).orElse(null);
        log.debug("Existing item for {}: {}", tripId, existing);

        TripRecord merged = TripRecord.merge(existing, payload, tripId);
        store.putItem(tableName, merged);
        return merged;
    }

    private static String decode(byte[] data) {
        if (data == null) {
            throw new MalformedRecordException("Record has no payload");
        }
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
        } catch (CharacterCodingException ex) {
            throw new MalformedRecordException("Payload is not valid UTF-8", ex);
        }
    }

    private Map<String, Object> parse(String text) {
        try {
            Map<String, Object> payload = objectMapper.readValue(text, PAYLOAD_TYPE);
            if (payload == null) {
                throw new MalformedRecordException("Payload is not a JSON object");
            }
            return payload;
        } catch (JsonProcessingException ex) {
            throw new MalformedRecordException("Payload is not a JSON object: " + ex.getOriginalMessage(), ex);
        }
    }
}
