package com.companya.trippipeline.kafka;

import com.companya.trippipeline.exception.LogAppendException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Component
public class KafkaTripLogPublisher implements TripLogPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaTripLogPublisher.class);

    private final KafkaTemplate<String, byte[]> kafkaTemplate;
    private final Duration sendTimeout;

    public KafkaTripLogPublisher(KafkaTemplate<String, byte[]> tripKafkaTemplate,
                                 @Value("${pipeline.ingestor.send-timeout:10s}") Duration sendTimeout) {
        this.kafkaTemplate = tripKafkaTemplate;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void append(String streamName, byte[] payload, String partitionKey) {
        ProducerRecord<String, byte[]> record = new ProducerRecord<>(streamName, partitionKey, payload);
        try {
            SendResult<String, byte[]> result = kafkaTemplate.send(record)
                    .get(sendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Appended trip {} to {}-{}@{}", partitionKey, streamName,
                    result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LogAppendException("Interrupted appending trip " + partitionKey, ex);
        } catch (ExecutionException ex) {
            throw new LogAppendException("Failed to append trip " + partitionKey + " to " + streamName, ex.getCause());
        } catch (TimeoutException ex) {
            throw new LogAppendException("Timed out appending trip " + partitionKey + " to " + streamName, ex);
        }
    }
}
