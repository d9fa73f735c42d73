package com.example.airbytemonitor;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.HTTPServer;
import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import okhttp3.OkHttpClient;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.utils.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Exposes Airbyte job, connection, source and destination state as Prometheus metrics.
 *
 * <p>Configuration is read from the environment ({@code AIRBYTE_CLIENT_ID},
 * {@code AIRBYTE_CLIENT_SECRET}, {@code AIRBYTE_API_URL}, {@code PROMETHEUS_PORT},
 * {@code METRICS_UPDATE_INTERVAL}) on top of an optional properties file passed as the first
 * argument.
 */
public class AirbyteMonitor implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(AirbyteMonitor.class);

    private final AirbyteMonitorConfig config;
    private final OkHttpClient httpClient;
    private final MonitoringMetrics metrics;
    private final MetricsPoller poller;
    private HTTPServer server;

    public AirbyteMonitor(AirbyteMonitorConfig config, Clock clock) {
        this.config = config;
        this.httpClient = AirbyteApiClient.buildHttpClient(config.httpTimeoutMs());
        this.metrics = new MonitoringMetrics(new CollectorRegistry());
        TokenManager tokenManager = new TokenManager(httpClient, config, clock);
        AirbyteApiClient apiClient = new AirbyteApiClient(httpClient, config.apiUrl());
        this.poller = new MetricsPoller(tokenManager, apiClient, metrics, config.updateInterval());
    }

    /**
     * Starts the metrics endpoint. Polling is driven separately through {@link #poller()}.
     */
    public void start() throws IOException {
        server = new HTTPServer.Builder()
                .withPort(config.metricsPort())
                .withRegistry(metrics.registry())
                .withDaemonThreads(true)
                .build();
        log.info("Prometheus metrics server started on port {}", server.getPort());
    }

    public int metricsPort() {
        return server.getPort();
    }

    public MetricsPoller poller() {
        return poller;
    }

    public MonitoringMetrics metrics() {
        return metrics;
    }

    @Override
    public void close() {
        log.info("Stopping Airbyte monitor");
        if (server != null) {
            server.close();
        }
        httpClient.connectionPool().evictAll();
        try {
            httpClient.dispatcher().executorService().shutdown();
        } catch (Exception e) {
            log.warn("Error shutting down HTTP client", e);
        }
    }

    static Map<String, String> loadProperties(String[] args) throws IOException {
        if (args.length == 0) {
            return Collections.emptyMap();
        }
        log.info("Loading configuration from {}", args[0]);
        return Utils.propsToStringMap(Utils.loadProps(args[0]));
    }

    public static void main(String[] args) {
        AirbyteMonitorConfig config;
        try {
            config = AirbyteMonitorConfig.fromSources(loadProperties(args), System.getenv());
        } catch (ConfigException | IOException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        AirbyteMonitor monitor = new AirbyteMonitor(config, Clock.systemUTC());
        try {
            monitor.start();
        } catch (IOException e) {
            log.error("Could not start metrics server on port {}", config.metricsPort(), e);
            monitor.close();
            System.exit(1);
            return;
        }

        Thread pollingThread = Thread.currentThread();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            pollingThread.interrupt();
            monitor.close();
        }, "airbyte-monitor-shutdown"));

        monitor.poller().run();
    }
}
