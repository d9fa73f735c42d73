package com.example.airbytemonitor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lists Airbyte resources over the public REST API. Responses are wrapped in a
 * {@code {"data": [...], "next": "..."}} envelope; every page reachable through {@code next}
 * is collected.
 */
public class AirbyteApiClient {

    private static final Logger log = LoggerFactory.getLogger(AirbyteApiClient.class);
    static final int MAX_PAGES = 100;

    private final OkHttpClient client;
    private final HttpUrl baseUrl;
    private final ObjectMapper mapper = new ObjectMapper();

    public AirbyteApiClient(OkHttpClient client, String baseUrl) {
        this.client = client;
        this.baseUrl = HttpUrl.get(baseUrl);
    }

    public static OkHttpClient buildHttpClient(long timeoutMs) {
        ConnectionPool connectionPool = new ConnectionPool(5, 5, TimeUnit.MINUTES);

        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectionPool(connectionPool)
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .readTimeout(Duration.ofMillis(timeoutMs))
                .writeTimeout(Duration.ofMillis(timeoutMs))
                .retryOnConnectionFailure(true)
                .build();

        log.debug("HTTP client initialized with timeout: {}ms", timeoutMs);
        return httpClient;
    }

    /**
     * Lists every item of {@code endpoint}. Never throws: any failure is logged and reported
     * as a failed {@link FetchResult} with no items.
     */
    public FetchResult fetch(ApiEndpoint endpoint, AccessToken token) {
        Instant start = Instant.now();
        try {
            List<JsonNode> items = fetchAllPages(endpoint, token);
            log.debug("Fetched {} {} in {}ms", items.size(), endpoint.path(),
                    Duration.between(start, Instant.now()).toMillis());
            return FetchResult.success(endpoint, items);
        } catch (IOException | RuntimeException e) {
            log.error("Error fetching data from {}: {}", endpoint.path(), e.getMessage());
            return FetchResult.failure(endpoint, e);
        }
    }

    private List<JsonNode> fetchAllPages(ApiEndpoint endpoint, AccessToken token) throws IOException {
        List<JsonNode> items = new ArrayList<>();
        HttpUrl pageUrl = baseUrl.newBuilder().addPathSegments(endpoint.path()).build();
        int pageCount = 0;

        while (pageUrl != null && pageCount < MAX_PAGES) {
            pageCount++;
            JsonNode page = getPage(pageUrl, token);

            JsonNode data = page.get("data");
            if (data == null || !data.isArray()) {
                throw new IOException("Response from " + endpoint.path() + " has no data array");
            }
            data.forEach(items::add);

            pageUrl = nextPageUrl(page, data);
        }

        if (pageUrl != null) {
            log.warn("Reached maximum pages ({}) for {}, remaining items are ignored", MAX_PAGES, endpoint.path());
        }
        return items;
    }

    private JsonNode getPage(HttpUrl url, AccessToken token) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .get()
                .header("Authorization", "Bearer " + token.value())
                .header("Accept", "application/json")
                .build();

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException(String.format("HTTP %d: %s", response.code(), response.message()));
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Empty response body from " + url);
            }
            return mapper.readTree(body.string());
        }
    }

    private HttpUrl nextPageUrl(JsonNode page, JsonNode data) {
        JsonNode next = page.path("next");
        if (!next.isTextual() || next.asText().isEmpty() || data.isEmpty()) {
            return null;
        }
        HttpUrl nextUrl = HttpUrl.parse(next.asText());
        if (nextUrl == null) {
            log.warn("Ignoring unparseable next page link: {}", next.asText());
        }
        return nextUrl;
    }
}
