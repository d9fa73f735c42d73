package com.example.airbytemonitor;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Bearer token issued by the client-credentials exchange together with its absolute expiry.
 */
public final class AccessToken {

    private final String value;
    private final Instant expiresAt;

    public AccessToken(String value, Instant expiresAt) {
        this.value = Objects.requireNonNull(value, "value");
        this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public String value() {
        return value;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    /**
     * True when {@code now} is at or past {@code expiresAt - margin}.
     */
    public boolean expiresWithin(Duration margin, Instant now) {
        return !now.isBefore(expiresAt.minus(margin));
    }

    @Override
    public String toString() {
        return "AccessToken{expiresAt=" + expiresAt + "}";
    }
}
