package com.example.airbytemonitor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches the OAuth client-credentials token for the Airbyte API and refreshes it when it is
 * missing or about to expire.
 */
public class TokenManager {

    private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

    private final OkHttpClient client;
    private final String tokenUrl;
    private final String clientId;
    private final String clientSecret;
    private final Duration refreshMargin;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();

    private AccessToken currentToken;

    public TokenManager(OkHttpClient client, AirbyteMonitorConfig config, Clock clock) {
        this(client, config.tokenUrl(), config.clientId(), config.clientSecret(), config.tokenRefreshMargin(), clock);
    }

    public TokenManager(OkHttpClient client, String tokenUrl, String clientId, String clientSecret,
                        Duration refreshMargin, Clock clock) {
        this.client = client;
        this.tokenUrl = tokenUrl;
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.refreshMargin = refreshMargin;
        this.clock = clock;
    }

    /**
     * Returns a token that stays valid for at least the refresh margin, exchanging the client
     * credentials for a new one when needed.
     */
    public synchronized AccessToken getValidToken() throws AuthenticationException {
        Instant now = clock.instant();
        if (currentToken == null || currentToken.expiresWithin(refreshMargin, now)) {
            currentToken = requestToken(now);
            log.info("New Airbyte access token fetched, expires at {}", currentToken.expiresAt());
        }
        return currentToken;
    }

    synchronized AccessToken currentToken() {
        return currentToken;
    }

    synchronized void setCurrentToken(AccessToken token) {
        this.currentToken = token;
    }

    private AccessToken requestToken(Instant now) throws AuthenticationException {
        FormBody body = new FormBody.Builder()
                .add("client_id", clientId)
                .add("client_secret", clientSecret)
                .add("grant_type", "client_credentials")
                .build();

        Request request = new Request.Builder()
                .url(tokenUrl)
                .post(body)
                .header("Accept", "application/json")
                .build();

        log.debug("Requesting access token from {}", tokenUrl);

        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new AuthenticationException(
                        String.format("Token request failed with HTTP %d: %s", response.code(), response.message()));
            }
            ResponseBody responseBody = response.body();
            if (responseBody == null) {
                throw new AuthenticationException("Token response has no body");
            }
            return parseToken(mapper.readTree(responseBody.string()), now);
        } catch (IOException | IllegalArgumentException e) {
            throw new AuthenticationException("Error fetching access token from " + tokenUrl + ": " + e.getMessage(), e);
        }
    }

    private AccessToken parseToken(JsonNode tokenNode, Instant now) throws AuthenticationException {
        JsonNode accessToken = tokenNode.path("access_token");
        JsonNode expiresIn = tokenNode.path("expires_in");
        if (!accessToken.isTextual() || accessToken.asText().isEmpty()) {
            throw new AuthenticationException("Token response is missing access_token");
        }
        if (!expiresIn.isNumber()) {
            throw new AuthenticationException("Token response is missing a numeric expires_in");
        }
        return new AccessToken(accessToken.asText(), now.plusSeconds(expiresIn.asLong()));
    }
}
