package com.companya.trippipeline.store;

import com.companya.trippipeline.model.TripRecord;

import java.util.Optional;

/**
 * Keyed trip storage, addressed by table name and trip id.
 */
public interface TripRecordStore {

    Optional<TripRecord> getItem(String tableName, String id);

    /**
     * Unconditional overwrite of whatever is stored under the record's id.
     */
    void putItem(String tableName, TripRecord record);

    /**
     * Reads the next page of the table in id order and keeps the items the
     * filter accepts.
     *
     * @param exclusiveStartToken token from the previous page, or {@code null} to start
     */
    ScanPage scan(String tableName, ScanFilter filter, String exclusiveStartToken);
}
