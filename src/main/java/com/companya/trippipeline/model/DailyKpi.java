package com.companya.trippipeline.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * Fare statistics for one pickup group. Averages and extremes are {@code null}
 * when no trip in the group had a numeric fare.
 */
public record DailyKpi(
        @JsonProperty("pickup_datetime")
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        LocalDateTime pickupDatetime,
        @JsonProperty("total_fare") double totalFare,
        @JsonProperty("count_trips") long countTrips,
        @JsonProperty("average_fare") Double averageFare,
        @JsonProperty("max_fare") Double maxFare,
        @JsonProperty("min_fare") Double minFare) {
}
