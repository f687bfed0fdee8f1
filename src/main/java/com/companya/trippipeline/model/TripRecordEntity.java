package com.companya.trippipeline.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;

/**
 * Row of the trip store. The logical table name is part of the key so several
 * configured tables can share one schema; the trip fields are kept as a JSON
 * object.
 */
@Entity
@IdClass(TripRecordKey.class)
@Table(name = "trip_records")
public class TripRecordEntity {

    @Id
    @Column(name = "table_name", nullable = false)
    private String tableName;

    @Id
    @Column(name = "id", nullable = false)
    private String id;

    @Lob
    @Column(name = "attributes", nullable = false)
    private String attributes;

    protected TripRecordEntity() {
    }

    public TripRecordEntity(String tableName, String id, String attributes) {
        this.tableName = tableName;
        this.id = id;
        this.attributes = attributes;
    }

    public String getTableName() {
        return tableName;
    }

    public String getId() {
        return id;
    }

    public String getAttributes() {
        return attributes;
    }

    public void setAttributes(String attributes) {
        this.attributes = attributes;
    }
}
