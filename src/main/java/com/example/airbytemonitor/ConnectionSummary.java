package com.example.airbytemonitor;

import java.util.List;

/**
 * Gauge values derived from one cycle's connection listing.
 */
public record ConnectionSummary(int activeConnections, List<Connection> connections) {
}
