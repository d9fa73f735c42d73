package com.example.airbytemonitor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Builders for Airbyte API payloads used across tests.
 */
public final class Fixtures {

    public static final ObjectMapper MAPPER = new ObjectMapper();

    private Fixtures() {
    }

    public static ObjectNode syncJob(String connectionId, String status) {
        ObjectNode job = MAPPER.createObjectNode();
        job.put("jobId", connectionId + "-" + status);
        job.put("status", status);
        job.put("jobType", "sync");
        job.put("connectionId", connectionId);
        return job;
    }

    public static ObjectNode succeededSync(String connectionId, long bytes, long rows, String duration, String lastUpdatedAt) {
        ObjectNode job = syncJob(connectionId, "succeeded");
        job.put("bytesSynced", bytes);
        job.put("rowsSynced", rows);
        if (duration != null) {
            job.put("duration", duration);
        }
        if (lastUpdatedAt != null) {
            job.put("lastUpdatedAt", lastUpdatedAt);
        }
        return job;
    }

    public static ObjectNode job(String jobType, String status) {
        ObjectNode job = MAPPER.createObjectNode();
        job.put("jobId", jobType + "-" + status);
        job.put("status", status);
        job.put("jobType", jobType);
        return job;
    }

    public static ObjectNode connection(String connectionId, String name, String status) {
        ObjectNode connection = MAPPER.createObjectNode();
        connection.put("connectionId", connectionId);
        connection.put("name", name);
        connection.put("status", status);
        return connection;
    }

    public static ObjectNode fullConnection(String connectionId, String name, String status, int streams) {
        ObjectNode connection = connection(connectionId, name, status);
        connection.put("sourceId", "src-" + connectionId);
        connection.put("destinationId", "dst-" + connectionId);
        connection.putObject("schedule").put("scheduleType", "cron");
        connection.put("dataResidency", "us");
        connection.put("nonBreakingSchemaUpdatesBehavior", "propagate_columns");
        connection.put("namespaceDefinition", "destination");
        connection.put("prefix", "raw_");
        connection.put("createdAt", 1700000000L);
        ArrayNode streamList = connection.putObject("configurations").putArray("streams");
        for (int i = 0; i < streams; i++) {
            streamList.addObject().put("name", "stream_" + i);
        }
        return connection;
    }

    public static ObjectNode resource(String idField, String id) {
        ObjectNode resource = MAPPER.createObjectNode();
        resource.put(idField, id);
        return resource;
    }

    public static List<JsonNode> list(JsonNode... nodes) {
        List<JsonNode> list = new ArrayList<>();
        for (JsonNode node : nodes) {
            list.add(node);
        }
        return list;
    }

    public static String envelope(JsonNode... nodes) {
        ObjectNode body = MAPPER.createObjectNode();
        ArrayNode data = body.putArray("data");
        for (JsonNode node : nodes) {
            data.add(node);
        }
        return body.toString();
    }

    public static String tokenResponse(String accessToken, long expiresIn) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("access_token", accessToken);
        body.put("token_type", "Bearer");
        body.put("expires_in", expiresIn);
        return body.toString();
    }
}
