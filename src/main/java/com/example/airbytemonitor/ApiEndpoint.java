package com.example.airbytemonitor;

/**
 * Read-only listings of the Airbyte public API polled every cycle.
 */
public enum ApiEndpoint {
    JOBS("jobs"),
    CONNECTIONS("connections"),
    DESTINATIONS("destinations"),
    SOURCES("sources");

    private final String path;

    ApiEndpoint(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }
}
