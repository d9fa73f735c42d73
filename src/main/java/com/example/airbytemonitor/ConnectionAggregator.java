package com.example.airbytemonitor;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts active connections and rebuilds the {@link ConnectionIndex} consumed by
 * {@link JobAggregator}.
 */
public class ConnectionAggregator {

    private static final Logger log = LoggerFactory.getLogger(ConnectionAggregator.class);

    public ConnectionSummary aggregate(List<JsonNode> items, ConnectionIndex index) {
        index.clear();

        int activeConnections = 0;
        List<Connection> connections = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            Connection connection = Connection.fromJson(item);
            connections.add(connection);
            index.put(connection.connectionId(), connection.name());
            if (connection.isActive()) {
                activeConnections++;
            }
        }

        log.debug("Aggregated {} connections, {} active", connections.size(), activeConnections);
        return new ConnectionSummary(activeConnections, connections);
    }
}
