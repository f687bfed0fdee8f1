package com.companya.trippipeline.storage;

/**
 * Bucket/key object storage used for incoming trip files and KPI output.
 */
public interface ObjectStore {

    /**
     * @throws com.companya.trippipeline.exception.ObjectStoreException when the
     *         object is missing or cannot be read
     */
    byte[] get(String bucket, String key);

    /**
     * Writes the object, replacing anything already stored under the key.
     */
    void put(String bucket, String key, byte[] content, String contentType);
}
