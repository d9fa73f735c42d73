package com.example.airbytemonitor;

import java.util.HashMap;
import java.util.Map;

/**
 * Connection id to display name lookup for the current poll cycle. Rebuilt by
 * {@link ConnectionAggregator} before jobs are aggregated.
 */
public class ConnectionIndex {

    private final Map<String, String> names = new HashMap<>();

    public void clear() {
        names.clear();
    }

    public void put(String connectionId, String name) {
        names.put(connectionId, name);
    }

    /**
     * Name of the connection, or {@value Connection#UNKNOWN} when it was not part of this
     * cycle's connection listing.
     */
    public String nameOf(String connectionId) {
        return names.getOrDefault(connectionId, Connection.UNKNOWN);
    }

    public int size() {
        return names.size();
    }
}
