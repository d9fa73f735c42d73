package com.example.airbytemonitor;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;
import org.apache.kafka.common.config.ConfigDef.Importance;
import org.apache.kafka.common.config.ConfigDef.Range;
import org.apache.kafka.common.config.ConfigDef.Type;
import org.apache.kafka.common.config.ConfigException;
import org.apache.kafka.common.config.types.Password;

public class AirbyteMonitorConfig extends AbstractConfig {

    // Airbyte API
    public static final String AIRBYTE_API_URL = "airbyte.api.url";
    public static final String AIRBYTE_CLIENT_ID = "airbyte.client.id";
    public static final String AIRBYTE_CLIENT_SECRET = "airbyte.client.secret";

    // Exporter
    public static final String METRICS_PORT = "metrics.port";
    public static final String METRICS_UPDATE_INTERVAL_SECONDS = "metrics.update.interval.seconds";
    public static final String HTTP_TIMEOUT_MS = "http.timeout.ms";
    public static final String TOKEN_REFRESH_MARGIN_SECONDS = "token.refresh.margin.seconds";

    public static final String DEFAULT_API_URL = "https://api.airbyte.com/v1";

    /**
     * Environment variable names, mapped onto the config keys above.
     */
    public static final Map<String, String> ENVIRONMENT_VARIABLES;

    static {
        Map<String, String> env = new LinkedHashMap<>();
        env.put("AIRBYTE_API_URL", AIRBYTE_API_URL);
        env.put("AIRBYTE_CLIENT_ID", AIRBYTE_CLIENT_ID);
        env.put("AIRBYTE_CLIENT_SECRET", AIRBYTE_CLIENT_SECRET);
        env.put("PROMETHEUS_PORT", METRICS_PORT);
        env.put("METRICS_UPDATE_INTERVAL", METRICS_UPDATE_INTERVAL_SECONDS);
        env.put("HTTP_TIMEOUT_MS", HTTP_TIMEOUT_MS);
        env.put("TOKEN_REFRESH_MARGIN_SECONDS", TOKEN_REFRESH_MARGIN_SECONDS);
        ENVIRONMENT_VARIABLES = Collections.unmodifiableMap(env);
    }

    public static final ConfigDef CONFIG_DEF = new ConfigDef()
            // Airbyte API
            .define(AIRBYTE_API_URL, Type.STRING, DEFAULT_API_URL, Importance.HIGH,
                    "Base URL of the Airbyte public API")
            .define(AIRBYTE_CLIENT_ID, Type.STRING, Importance.HIGH,
                    "Client id used for the client-credentials token exchange")
            .define(AIRBYTE_CLIENT_SECRET, Type.PASSWORD, Importance.HIGH,
                    "Client secret used for the client-credentials token exchange")

            // Exporter
            .define(METRICS_PORT, Type.INT, 8000, Range.between(0, 65535), Importance.MEDIUM,
                    "Port the Prometheus metrics endpoint listens on")
            .define(METRICS_UPDATE_INTERVAL_SECONDS, Type.LONG, 60L, Range.atLeast(1), Importance.MEDIUM,
                    "Seconds to sleep between poll cycles")
            .define(HTTP_TIMEOUT_MS, Type.LONG, 30000L, Range.atLeast(1), Importance.LOW,
                    "Connect, read and write timeout for calls to the Airbyte API in milliseconds")
            .define(TOKEN_REFRESH_MARGIN_SECONDS, Type.LONG, 60L, Range.atLeast(0), Importance.LOW,
                    "Refresh the access token when it expires within this many seconds");

    public AirbyteMonitorConfig(Map<String, ?> originals) {
        super(CONFIG_DEF, originals);
        validateCredentials();
    }

    /**
     * Builds a config from properties overlaid with the process environment.
     * Environment variables win over properties.
     */
    public static AirbyteMonitorConfig fromSources(Map<String, String> properties, Map<String, String> environment) {
        Map<String, String> props = new HashMap<>(properties);
        for (Map.Entry<String, String> entry : ENVIRONMENT_VARIABLES.entrySet()) {
            String value = environment.get(entry.getKey());
            if (value != null && !value.trim().isEmpty()) {
                props.put(entry.getValue(), value.trim());
            }
        }
        return new AirbyteMonitorConfig(props);
    }

    private void validateCredentials() {
        String clientId = getString(AIRBYTE_CLIENT_ID);
        if (clientId == null || clientId.trim().isEmpty()) {
            throw new ConfigException(AIRBYTE_CLIENT_ID, clientId, "Airbyte client id must not be blank");
        }
        Password secret = getPassword(AIRBYTE_CLIENT_SECRET);
        if (secret == null || secret.value() == null || secret.value().trim().isEmpty()) {
            // hidden value, never echo the secret
            throw new ConfigException(AIRBYTE_CLIENT_SECRET, Password.HIDDEN, "Airbyte client secret must not be blank");
        }
    }

    public String apiUrl() {
        String url = getString(AIRBYTE_API_URL).trim();
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    public String tokenUrl() {
        return apiUrl() + "/applications/token";
    }

    public String clientId() {
        return getString(AIRBYTE_CLIENT_ID).trim();
    }

    public String clientSecret() {
        return getPassword(AIRBYTE_CLIENT_SECRET).value();
    }

    public int metricsPort() {
        return getInt(METRICS_PORT);
    }

    public Duration updateInterval() {
        return Duration.ofSeconds(getLong(METRICS_UPDATE_INTERVAL_SECONDS));
    }

    public long httpTimeoutMs() {
        return getLong(HTTP_TIMEOUT_MS);
    }

    public Duration tokenRefreshMargin() {
        return Duration.ofSeconds(getLong(TOKEN_REFRESH_MARGIN_SECONDS));
    }
}
