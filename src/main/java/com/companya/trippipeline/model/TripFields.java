package com.companya.trippipeline.model;

/**
 * Field names the pipeline reads from otherwise free-form trip rows.
 */
public final class TripFields {

    public static final String ID = "id";
    public static final String TRIP_ID = "trip_id";
    public static final String PICKUP_DATETIME = "pickup_datetime";
    public static final String FARE_AMOUNT = "fare_amount";
    public static final String ESTIMATED_FARE_AMOUNT = "estimated_fare_amount";

    /** Partition key used when a row carries no trip id. */
    public static final String UNKNOWN_TRIP_ID = "unknown";

    private TripFields() {
    }
}
