package com.companya.trippipeline.store;

import com.companya.trippipeline.model.TripRecord;

import java.util.List;

/**
 * Matches records that carry every named field, whatever its value.
 */
public class FieldPresenceFilter implements ScanFilter {

    private final List<String> fields;

    public FieldPresenceFilter(String... fields) {
        this.fields = List.of(fields);
    }

    @Override
    public boolean matches(TripRecord record) {
        return fields.stream().allMatch(record::has);
    }

    @Override
    public String toString() {
        return "FieldPresenceFilter" + fields;
    }
}
