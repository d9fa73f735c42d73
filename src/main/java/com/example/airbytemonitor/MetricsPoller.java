package com.example.airbytemonitor;

import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls the Airbyte API on a fixed interval and republishes its state through
 * {@link MonitoringMetrics}. Cycles run strictly one after another on the calling thread.
 */
public class MetricsPoller implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MetricsPoller.class);

    private final TokenManager tokenManager;
    private final AirbyteApiClient apiClient;
    private final MonitoringMetrics metrics;
    private final Duration interval;
    private final ConnectionIndex connectionIndex = new ConnectionIndex();
    private final ConnectionAggregator connectionAggregator = new ConnectionAggregator();
    private final JobAggregator jobAggregator = new JobAggregator();

    private long pollCycles = 0;

    public MetricsPoller(TokenManager tokenManager, AirbyteApiClient apiClient,
                         MonitoringMetrics metrics, Duration interval) {
        this.tokenManager = tokenManager;
        this.apiClient = apiClient;
        this.metrics = metrics;
        this.interval = interval;
    }

    /**
     * Polls until the thread is interrupted.
     */
    @Override
    public void run() {
        log.info("Starting Airbyte metrics polling every {}s", interval.getSeconds());
        while (!Thread.currentThread().isInterrupted()) {
            pollOnce();
            try {
                Thread.sleep(interval.toMillis());
            } catch (InterruptedException e) {
                log.info("Polling interrupted, shutting down gracefully");
                Thread.currentThread().interrupt();
            }
        }
        log.info("Airbyte metrics polling stopped after {} cycles", pollCycles);
    }

    /**
     * Runs a single poll cycle. Returns {@code false} when the cycle was abandoned; gauges keep
     * the values of the last completed cycle in that case.
     */
    public boolean pollOnce() {
        pollCycles++;
        Instant cycleStart = Instant.now();
        try {
            AccessToken token = tokenManager.getValidToken();

            FetchResult jobs = fetch(ApiEndpoint.JOBS, token);
            FetchResult connections = fetch(ApiEndpoint.CONNECTIONS, token);
            FetchResult destinations = fetch(ApiEndpoint.DESTINATIONS, token);
            FetchResult sources = fetch(ApiEndpoint.SOURCES, token);

            // connections first, jobs are named through the index they rebuild
            ConnectionSummary connectionSummary = connectionAggregator.aggregate(connections.items(), connectionIndex);
            metrics.recordConnections(connectionSummary);

            JobSummary jobSummary = jobAggregator.aggregate(jobs.items());
            metrics.recordJobs(jobSummary, connectionIndex);

            metrics.recordDestinationCount(destinations.items().size());
            metrics.recordSourceCount(sources.items().size());

            log.info("Poll cycle {} completed in {}ms. Jobs: {}, connections: {}, destinations: {}, sources: {}",
                    pollCycles, Duration.between(cycleStart, Instant.now()).toMillis(),
                    jobs.items().size(), connections.items().size(),
                    destinations.items().size(), sources.items().size());
            return true;

        } catch (AuthenticationException e) {
            metrics.recordPollCycleFailure();
            log.error("Skipping poll cycle {}, could not obtain an access token: {}", pollCycles, e.getMessage());
            return false;
        } catch (Exception e) {
            metrics.recordPollCycleFailure();
            log.error("Error fetching metrics from Airbyte in poll cycle {}", pollCycles, e);
            return false;
        }
    }

    ConnectionIndex connectionIndex() {
        return connectionIndex;
    }

    private FetchResult fetch(ApiEndpoint endpoint, AccessToken token) {
        FetchResult result = apiClient.fetch(endpoint, token);
        if (!result.isSuccess()) {
            metrics.recordFetchError(endpoint);
        }
        return result;
    }
}
