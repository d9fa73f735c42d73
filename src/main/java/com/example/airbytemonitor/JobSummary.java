package com.example.airbytemonitor;

import java.util.Map;

/**
 * Gauge values derived from one cycle's job listing. Per-connection maps are keyed by
 * connection id.
 */
public record JobSummary(
        int runningJobs,
        int pendingJobs,
        int failedJobs,
        int successfulSyncs,
        int failedSyncs,
        long totalBytesSynced,
        long totalRowsSynced,
        double averageSyncDurationSeconds,
        Map<String, Long> lastSuccessfulSyncEpochSeconds,
        Map<String, Integer> successfulSyncsPerConnection,
        Map<String, Integer> failedSyncsPerConnection) {
}
