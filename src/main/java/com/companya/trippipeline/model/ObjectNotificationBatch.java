package com.companya.trippipeline.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

public record ObjectNotificationBatch(List<ObjectNotification> records) {

    public ObjectNotificationBatch {
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static ObjectNotificationBatch of(ObjectNotification... notifications) {
        return new ObjectNotificationBatch(List.of(notifications));
    }

    /**
     * Reads either the plain form {@code {"records":[{"bucket":..,"key":..}]}} or
     * the storage event form {@code {"Records":[{"s3":{"bucket":{"name":..},"object":{"key":..}}}]}}.
     */
    public static ObjectNotificationBatch fromJson(JsonNode body) {
        List<ObjectNotification> notifications = new ArrayList<>();
        if (body == null) {
            return new ObjectNotificationBatch(notifications);
        }
        for (JsonNode record : body.path("Records")) {
            JsonNode s3 = record.path("s3");
            notifications.add(new ObjectNotification(
                    s3.path("bucket").path("name").asText(null),
                    s3.path("object").path("key").asText(null)));
        }
        for (JsonNode record : body.path("records")) {
            notifications.add(new ObjectNotification(
                    record.path("bucket").asText(null),
                    record.path("key").asText(null)));
        }
        return new ObjectNotificationBatch(notifications);
    }
}
