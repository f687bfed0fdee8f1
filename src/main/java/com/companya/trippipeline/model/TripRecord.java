package com.companya.trippipeline.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A trip as held in the keyed store: every field ever merged for the trip, keyed
 * by {@code id}. Unknown fields pass through untouched; the known ones get typed
 * accessors.
 */
public final class TripRecord {

    private final String id;
    private final Map<String, Object> item;

    public TripRecord(String id, Map<String, ?> fields) {
        this.id = Objects.requireNonNull(id, "id");
        this.item = new LinkedHashMap<>(fields);
        this.item.put(TripFields.ID, id);
    }

    /**
     * Shallow merge of an update over an existing record. Update values win on
     * collision and {@code id} is reset to the trip id afterwards, so a payload
     * carrying its own {@code id} cannot move the record.
     */
    public static TripRecord merge(TripRecord existing, Map<String, ?> update, String tripId) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (existing != null) {
            merged.putAll(existing.item);
        }
        merged.putAll(update);
        return new TripRecord(tripId, merged);
    }

    public String getId() {
        return id;
    }

    public Map<String, Object> getItem() {
        return Collections.unmodifiableMap(item);
    }

    public boolean has(String field) {
        return item.containsKey(field);
    }

    public Object get(String field) {
        return item.get(field);
    }

    /**
     * @return the fare as a number, or {@code null} when absent or not numeric
     */
    public Double getFareAmount() {
        return toDouble(item.get(TripFields.FARE_AMOUNT));
    }

    /**
     * @return the raw pickup timestamp text, or {@code null} when absent or blank
     */
    public String getPickupDatetime() {
        Object value = item.get(TripFields.PICKUP_DATETIME);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    static Double toDouble(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        if (value instanceof String text) {
            try {
                double d = new BigDecimal(text.trim()).doubleValue();
                return Double.isInfinite(d) ? null : d;
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TripRecord that = (TripRecord) o;
        return id.equals(that.id) && item.equals(that.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, item);
    }

    @Override
    public String toString() {
        return "TripRecord{" + item + '}';
    }
}
