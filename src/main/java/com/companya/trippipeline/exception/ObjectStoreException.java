package com.companya.trippipeline.exception;

/**
 * Failure reading or writing an object in a bucket.
 */
public class ObjectStoreException extends RuntimeException {

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
