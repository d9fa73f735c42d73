package com.example.airbytemonitor;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of listing one endpoint. A failed fetch carries no items, so callers can always use
 * {@link #items()} and treat the endpoint as empty for the cycle.
 */
public final class FetchResult {

    private final ApiEndpoint endpoint;
    private final List<JsonNode> items;
    private final Exception error;

    private FetchResult(ApiEndpoint endpoint, List<JsonNode> items, Exception error) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.items = items;
        this.error = error;
    }

    public static FetchResult success(ApiEndpoint endpoint, List<JsonNode> items) {
        return new FetchResult(endpoint, Collections.unmodifiableList(items), null);
    }

    public static FetchResult failure(ApiEndpoint endpoint, Exception error) {
        return new FetchResult(endpoint, Collections.emptyList(), Objects.requireNonNull(error, "error"));
    }

    public ApiEndpoint endpoint() {
        return endpoint;
    }

    public boolean isSuccess() {
        return error == null;
    }

    public List<JsonNode> items() {
        return items;
    }

    public Exception error() {
        return error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "FetchResult{endpoint=" + endpoint + ", items=" + items.size() + "}"
                : "FetchResult{endpoint=" + endpoint + ", error=" + error.getMessage() + "}";
    }
}
