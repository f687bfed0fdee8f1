package com.companya.trippipeline.kafka;

/**
 * Appends serialized trip rows to a partitioned stream.
 */
public interface TripLogPublisher {

    /**
     * Appends one record and waits for the log to accept it.
     *
     * @throws com.companya.trippipeline.exception.LogAppendException if the append fails
     */
    void append(String streamName, byte[] payload, String partitionKey);
}
