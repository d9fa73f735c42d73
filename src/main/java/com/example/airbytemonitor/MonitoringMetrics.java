package com.example.airbytemonitor;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import java.util.Map;

/**
 * Prometheus gauges published by the monitor. Every instance registers into its own
 * {@link CollectorRegistry}; labeled series are only ever added or overwritten, so series of
 * deleted connections stay until restart.
 */
public class MonitoringMetrics {

    private final CollectorRegistry registry;

    // Jobs
    final Gauge runningJobs;
    final Gauge pendingJobs;
    final Gauge workflowFailures;
    final Gauge successfulSyncs;
    final Gauge failedSyncs;
    final Gauge lastSuccessfulSyncTimestamp;
    final Gauge totalBytesSynced;
    final Gauge totalRowsSynced;
    final Gauge averageSuccessfulSyncDuration;
    final Gauge successfulSyncsPerConnection;
    final Gauge failedSyncsPerConnection;

    // Connections
    final Gauge activeConnections;
    final Gauge connectionStatus;
    final Gauge connectionInfo;
    final Gauge connectionStreamsCount;
    final Gauge connectionCreatedAt;

    // Destinations and sources
    final Gauge destinations;
    final Gauge sources;

    // Exporter health
    final Counter fetchErrors;
    final Counter pollCycleFailures;

    public MonitoringMetrics(CollectorRegistry registry) {
        this.registry = registry;

        runningJobs = Gauge.build()
                .name("monitoring_num_running_jobs")
                .help("Number of running jobs")
                .register(registry);

        pendingJobs = Gauge.build()
                .name("monitoring_num_pending_jobs")
                .help("Number of pending jobs")
                .register(registry);

        workflowFailures = Gauge.build()
                .name("monitoring_temporal_workflow_failure")
                .help("Number of failed jobs")
                .register(registry);

        successfulSyncs = Gauge.build()
                .name("monitoring_num_successful_syncs")
                .help("Number of successful sync jobs")
                .register(registry);

        failedSyncs = Gauge.build()
                .name("monitoring_num_failed_syncs")
                .help("Number of failed sync jobs")
                .register(registry);

        lastSuccessfulSyncTimestamp = Gauge.build()
                .name("monitoring_last_successful_sync_timestamp")
                .help("Timestamp of last successful sync per connection")
                .labelNames("connection_id", "name")
                .register(registry);

        totalBytesSynced = Gauge.build()
                .name("monitoring_total_bytes_synced")
                .help("Total bytes synced across all successful sync jobs")
                .register(registry);

        totalRowsSynced = Gauge.build()
                .name("monitoring_total_rows_synced")
                .help("Total rows synced across all successful sync jobs")
                .register(registry);

        averageSuccessfulSyncDuration = Gauge.build()
                .name("monitoring_avg_successful_sync_duration")
                .help("Average duration of successful sync jobs in seconds")
                .register(registry);

        successfulSyncsPerConnection = Gauge.build()
                .name("monitoring_successful_syncs_per_connection")
                .help("Number of successful syncs per connection")
                .labelNames("connection_id", "name")
                .register(registry);

        failedSyncsPerConnection = Gauge.build()
                .name("monitoring_failed_syncs_per_connection")
                .help("Number of failed syncs per connection")
                .labelNames("connection_id", "name")
                .register(registry);

        activeConnections = Gauge.build()
                .name("monitoring_active_connections")
                .help("Number of active connections")
                .register(registry);

        connectionStatus = Gauge.build()
                .name("monitoring_connection_status")
                .help("Status of connections (1 for active, 0 for inactive)")
                .labelNames("connection_id", "name", "source_id", "destination_id", "schedule_type")
                .register(registry);

        connectionInfo = Gauge.build()
                .name("monitoring_connection_info")
                .help("Info about connections")
                .labelNames("connection_id", "data_residency", "non_breaking_schema_updates_behavior",
                        "namespace_definition", "prefix")
                .register(registry);

        connectionStreamsCount = Gauge.build()
                .name("monitoring_connection_streams_count")
                .help("Number of streams per connection")
                .labelNames("connection_id", "name")
                .register(registry);

        connectionCreatedAt = Gauge.build()
                .name("monitoring_connection_created_at")
                .help("Creation timestamp of the connection")
                .labelNames("connection_id", "name")
                .register(registry);

        destinations = Gauge.build()
                .name("monitoring_num_destinations")
                .help("Number of destinations")
                .register(registry);

        sources = Gauge.build()
                .name("monitoring_num_sources")
                .help("Number of sources")
                .register(registry);

        fetchErrors = Counter.build()
                .name("monitoring_api_fetch_errors")
                .help("Failed listings of an Airbyte API endpoint")
                .labelNames("endpoint")
                .register(registry);

        pollCycleFailures = Counter.build()
                .name("monitoring_poll_cycle_failures")
                .help("Poll cycles abandoned because of an authentication or unexpected error")
                .register(registry);
    }

    public CollectorRegistry registry() {
        return registry;
    }

    public void recordConnections(ConnectionSummary summary) {
        for (Connection connection : summary.connections()) {
            connectionStatus.labels(
                    connection.connectionId(),
                    connection.name(),
                    connection.sourceId(),
                    connection.destinationId(),
                    connection.scheduleType()
            ).set(connection.statusValue());

            // info metrics are always 1
            connectionInfo.labels(
                    connection.connectionId(),
                    connection.dataResidency(),
                    connection.nonBreakingSchemaUpdatesBehavior(),
                    connection.namespaceDefinition(),
                    connection.prefix()
            ).set(1);

            connectionStreamsCount.labels(connection.connectionId(), connection.name())
                    .set(connection.streamsCount());
            connectionCreatedAt.labels(connection.connectionId(), connection.name())
                    .set(connection.createdAt());
        }

        activeConnections.set(summary.activeConnections());
    }

    /**
     * Publishes job statistics, naming per-connection series through {@code index}.
     */
    public void recordJobs(JobSummary summary, ConnectionIndex index) {
        runningJobs.set(summary.runningJobs());
        pendingJobs.set(summary.pendingJobs());
        workflowFailures.set(summary.failedJobs());
        successfulSyncs.set(summary.successfulSyncs());
        failedSyncs.set(summary.failedSyncs());
        totalBytesSynced.set(summary.totalBytesSynced());
        totalRowsSynced.set(summary.totalRowsSynced());
        averageSuccessfulSyncDuration.set(summary.averageSyncDurationSeconds());

        for (Map.Entry<String, Long> entry : summary.lastSuccessfulSyncEpochSeconds().entrySet()) {
            lastSuccessfulSyncTimestamp.labels(entry.getKey(), index.nameOf(entry.getKey()))
                    .set(entry.getValue());
        }
        for (Map.Entry<String, Integer> entry : summary.successfulSyncsPerConnection().entrySet()) {
            successfulSyncsPerConnection.labels(entry.getKey(), index.nameOf(entry.getKey()))
                    .set(entry.getValue());
        }
        for (Map.Entry<String, Integer> entry : summary.failedSyncsPerConnection().entrySet()) {
            failedSyncsPerConnection.labels(entry.getKey(), index.nameOf(entry.getKey()))
                    .set(entry.getValue());
        }
    }

    public void recordDestinationCount(int count) {
        destinations.set(count);
    }

    public void recordSourceCount(int count) {
        sources.set(count);
    }

    public void recordFetchError(ApiEndpoint endpoint) {
        fetchErrors.labels(endpoint.path()).inc();
    }

    public void recordPollCycleFailure() {
        pollCycleFailures.inc();
    }
}
