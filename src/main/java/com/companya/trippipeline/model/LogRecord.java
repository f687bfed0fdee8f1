package com.companya.trippipeline.model;

/**
 * One entry of the trip stream: a serialized row and the key it was
 * partitioned by.
 */
public record LogRecord(String partitionKey, byte[] data) {
}
