package com.companya.trippipeline.model;

import java.io.Serializable;
import java.util.Objects;

public class TripRecordKey implements Serializable {

    private String tableName;
    private String id;

    public TripRecordKey() {
    }

    public TripRecordKey(String tableName, String id) {
        this.tableName = tableName;
        this.id = id;
    }

    public String getTableName() {
        return tableName;
    }

    public String getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TripRecordKey that = (TripRecordKey) o;
        return Objects.equals(tableName, that.tableName) && Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tableName, id);
    }
}
