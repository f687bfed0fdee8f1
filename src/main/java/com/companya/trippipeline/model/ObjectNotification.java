package com.companya.trippipeline.model;

/**
 * A new object landed in a bucket.
 */
public record ObjectNotification(String bucket, String key) {
}
