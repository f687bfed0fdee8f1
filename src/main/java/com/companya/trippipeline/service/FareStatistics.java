package com.companya.trippipeline.service;

import com.companya.trippipeline.model.DailyKpi;

import java.time.LocalDateTime;

/**
 * Running sum, count and extremes of the numeric fares in one group. Missing
 * fares are skipped: they count neither as trips nor towards the total.
 */
class FareStatistics {

    private double total;
    private long count;
    private double max = Double.NEGATIVE_INFINITY;
    private double min = Double.POSITIVE_INFINITY;

    void accept(Double fare) {
        if (fare == null) {
            return;
        }
        total += fare;
        count++;
        max = Math.max(max, fare);
        min = Math.min(min, fare);
    }

    DailyKpi toKpi(LocalDateTime pickupDatetime) {
        if (count == 0) {
            return new DailyKpi(pickupDatetime, 0.0, 0, null, null, null);
        }
        return new DailyKpi(pickupDatetime, total, count, total / count, max, min);
    }
}
