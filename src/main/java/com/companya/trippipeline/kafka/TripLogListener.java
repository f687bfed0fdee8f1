package com.companya.trippipeline.kafka;

import com.companya.trippipeline.model.LogRecord;
import com.companya.trippipeline.model.MergeResult;
import com.companya.trippipeline.service.TripMergeService;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Hands each polled batch of the trip stream to the merge stage.
 */
@Component
@ConditionalOnProperty(name = "pipeline.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class TripLogListener {

    private static final Logger log = LoggerFactory.getLogger(TripLogListener.class);

    private final TripMergeService mergeService;

    public TripLogListener(TripMergeService mergeService) {
        this.mergeService = mergeService;
    }

    @KafkaListener(id = "tripMergeListener",
            topics = "${pipeline.merger.stream-name:trips}",
            containerFactory = "tripBatchContainerFactory")
    public void onBatch(List<ConsumerRecord<String, byte[]>> batch) {
        List<LogRecord> records = batch.stream()
                .map(record -> new LogRecord(record.key(), record.value()))
                .toList();
        MergeResult result = mergeService.mergeBatch(records);
        log.info("Merge batch finished: status={}, merged={}, failed={}",
                result.status(), result.merged(), result.failed());
    }
}
