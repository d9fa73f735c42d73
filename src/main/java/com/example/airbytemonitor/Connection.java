package com.example.airbytemonitor;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A connection as listed by {@code GET /connections}, with every missing label field set to
 * {@value #UNKNOWN} and a missing {@code createdAt} set to 0.
 */
public record Connection(
        String connectionId,
        String name,
        String status,
        String sourceId,
        String destinationId,
        String scheduleType,
        String dataResidency,
        String nonBreakingSchemaUpdatesBehavior,
        String namespaceDefinition,
        String prefix,
        long createdAt,
        int streamsCount) {

    public static final String UNKNOWN = "unknown";
    public static final String STATUS_ACTIVE = "active";

    public static Connection fromJson(JsonNode node) {
        JsonNode streams = node.path("configurations").path("streams");
        return new Connection(
                text(node, "connectionId"),
                text(node, "name"),
                node.path("status").asText(""),
                text(node, "sourceId"),
                text(node, "destinationId"),
                text(node.path("schedule"), "scheduleType"),
                text(node, "dataResidency"),
                text(node, "nonBreakingSchemaUpdatesBehavior"),
                text(node, "namespaceDefinition"),
                text(node, "prefix"),
                node.path("createdAt").asLong(0),
                streams.isArray() ? streams.size() : 0);
    }

    public boolean isActive() {
        return STATUS_ACTIVE.equals(status);
    }

    /**
     * 1 for an active connection, 0 otherwise.
     */
    public int statusValue() {
        return isActive() ? 1 : 0;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return UNKNOWN;
        }
        return value.asText();
    }
}
