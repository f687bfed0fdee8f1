package com.companya.trippipeline.service;

import com.companya.trippipeline.exception.MissingConfigurationException;
import com.companya.trippipeline.metrics.PipelineMetrics;
import com.companya.trippipeline.model.DailyKpi;
import com.companya.trippipeline.model.TripFields;
import com.companya.trippipeline.model.TripRecord;
import com.companya.trippipeline.storage.ObjectStore;
import com.companya.trippipeline.store.FieldPresenceFilter;
import com.companya.trippipeline.store.ScanPage;
import com.companya.trippipeline.store.TripRecordStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes fare KPIs over every trip that has both an actual and an estimated
 * fare and writes one JSON object per group to the output bucket.
 *
 * Nothing here is isolated per trip: a scan failure, an unparseable pickup
 * timestamp or a failed upload aborts the run, possibly after some groups were
 * already written.
 */
@Slf4j
@Service
public class KpiAggregationService {

    static final FieldPresenceFilter COMPLETED_TRIPS =
            new FieldPresenceFilter(TripFields.FARE_AMOUNT, TripFields.ESTIMATED_FARE_AMOUNT);
    static final String CONTENT_TYPE = "application/json";

    private final TripRecordStore store;
    private final ObjectStore objectStore;
    private final ObjectMapper objectMapper;
    private final PipelineMetrics metrics;
    private final String tableName;
    private final String outputBucket;
    private final GroupingMode groupingMode;

    public KpiAggregationService(TripRecordStore store,
                                 ObjectStore objectStore,
                                 ObjectMapper objectMapper,
                                 PipelineMetrics metrics,
                                 @Value("${pipeline.store.table-name:}") String tableName,
                                 @Value("${pipeline.aggregator.output-bucket:}") String outputBucket,
                                 @Value("${pipeline.aggregator.grouping:EXACT_TIMESTAMP}") GroupingMode groupingMode) {
        this.store = store;
        this.objectStore = objectStore;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.tableName = tableName;
        this.outputBucket = outputBucket;
        this.groupingMode = groupingMode;
    }

    /**
     * @return the KPIs written, in ascending pickup order; empty when no trip qualified
     * @throws MissingConfigurationException     if the table or output bucket is not configured
     * @throws java.time.format.DateTimeParseException if a pickup timestamp cannot be parsed
     */
    public List<DailyKpi> aggregate() {
        requireConfigured(tableName, "pipeline.store.table-name");
        requireConfigured(outputBucket, "pipeline.aggregator.output-bucket");
        log.info("KPI aggregation started");

        log.info("Scanning table {} for completed trips", tableName);
        List<TripRecord> trips = scanCompletedTrips();
        log.info("Retrieved {} items from table {}", trips.size(), tableName);

        if (trips.isEmpty()) {
            log.warn("No items found matching {}", COMPLETED_TRIPS);
            return List.of();
        }

        log.info("Calculating KPIs grouped by {}", groupingMode);
        List<DailyKpi> kpis = computeKpis(trips, groupingMode);

        for (DailyKpi kpi : kpis) {
            String key = objectKey(kpi.pickupDatetime().toLocalDate());
            log.info("Uploading KPI for {} to {}/{}", kpi.pickupDatetime(), outputBucket, key);
            objectStore.put(outputBucket, key, serialize(kpi), CONTENT_TYPE);
            metrics.kpiWritten();
        }
        log.info("All {} KPIs uploaded successfully", kpis.size());
        return kpis;
    }

    private List<TripRecord> scanCompletedTrips() {
        List<TripRecord> items = new ArrayList<>();
        String token = null;
        do {
            ScanPage page = store.scan(tableName, COMPLETED_TRIPS, token);
            items.addAll(page.items());
            token = page.nextToken();
        } while (token != null);
        return items;
    }

    /**
     * Groups trips by pickup and summarises their fares. Trips without a pickup
     * timestamp have no group and are left out.
     */
    static List<DailyKpi> computeKpis(List<TripRecord> trips, GroupingMode groupingMode) {
        Map<LocalDateTime, FareStatistics> groups = new TreeMap<>();
        for (TripRecord trip : trips) {
            String pickup = trip.getPickupDatetime();
            if (pickup == null) {
                log.debug("Trip {} has no pickup_datetime, not grouped", trip.getId());
                continue;
            }
            LocalDateTime key = groupingMode.groupKey(PickupTimestamps.parse(pickup));
            groups.computeIfAbsent(key, k -> new FareStatistics()).accept(trip.getFareAmount());
        }

        List<DailyKpi> kpis = new ArrayList<>(groups.size());
        groups.forEach((pickup, stats) -> kpis.add(stats.toKpi(pickup)));
        return kpis;
    }

    static String objectKey(LocalDate date) {
        return "kpis/date=" + date.format(DateTimeFormatter.ISO_LOCAL_DATE) + "/kpi.json";
    }

    private byte[] serialize(DailyKpi kpi) {
        try {
            return objectMapper.writeValueAsBytes(kpi);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cannot serialize KPI for " + kpi.pickupDatetime(), ex);
        }
    }

    private static void requireConfigured(String value, String property) {
        if (value == null || value.isBlank()) {
            throw new MissingConfigurationException(property);
        }
    }
}
