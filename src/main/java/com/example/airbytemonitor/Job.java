package com.example.airbytemonitor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A job as listed by {@code GET /jobs}. Timestamp and duration are kept raw; they are parsed
 * while aggregating so a malformed value only affects that value.
 */
public record Job(
        String jobId,
        String status,
        String jobType,
        String connectionId,
        String lastUpdatedAt,
        long bytesSynced,
        long rowsSynced,
        String duration) {

    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_FAILED = "failed";
    public static final String STATUS_SUCCEEDED = "succeeded";
    public static final String TYPE_SYNC = "sync";

    public static Job fromJson(JsonNode node) {
        return new Job(
                text(node, "jobId"),
                text(node, "status"),
                text(node, "jobType"),
                text(node, "connectionId"),
                text(node, "lastUpdatedAt"),
                node.path("bytesSynced").asLong(0),
                node.path("rowsSynced").asLong(0),
                text(node, "duration"));
    }

    public boolean isSync() {
        return TYPE_SYNC.equals(jobType);
    }

    public boolean hasStatus(String expected) {
        return expected.equals(status);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
