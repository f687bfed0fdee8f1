package com.companya.trippipeline.store;

import com.companya.trippipeline.model.TripRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Map-backed store for service tests; pages by id like the JPA store.
 */
public class InMemoryTripRecordStore implements TripRecordStore {

    private final Map<String, TreeMap<String, TripRecord>> tables = new HashMap<>();
    private final int pageSize;
    private int putCount;
    private int scanCount;

    public InMemoryTripRecordStore(int pageSize) {
        this.pageSize = pageSize;
    }

    @Override
    public Optional<TripRecord> getItem(String tableName, String id) {
        return Optional.ofNullable(table(tableName).get(id));
    }

    @Override
    public void putItem(String tableName, TripRecord record) {
        putCount++;
        table(tableName).put(record.getId(), record);
    }

    @Override
    public ScanPage scan(String tableName, ScanFilter filter, String exclusiveStartToken) {
        scanCount++;
        TreeMap<String, TripRecord> table = table(tableName);
        Map<String, TripRecord> remaining = exclusiveStartToken == null
                ? table
                : table.tailMap(exclusiveStartToken, false);

        List<TripRecord> read = remaining.values().stream().limit(pageSize).toList();
        List<TripRecord> matches = new ArrayList<>();
        for (TripRecord record : read) {
            if (filter.matches(record)) {
                matches.add(record);
            }
        }
        String next = read.size() < pageSize ? null : read.get(read.size() - 1).getId();
        return new ScanPage(matches, next);
    }

    public int size(String tableName) {
        return table(tableName).size();
    }

    public int getPutCount() {
        return putCount;
    }

    public int getScanCount() {
        return scanCount;
    }

    private TreeMap<String, TripRecord> table(String tableName) {
        return tables.computeIfAbsent(tableName, name -> new TreeMap<>());
    }
}
