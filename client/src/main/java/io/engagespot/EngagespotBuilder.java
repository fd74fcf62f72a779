package io.engagespot;

import static io.engagespot.spec.EngagespotHeaders.APPLICATION_JSON;
import static io.engagespot.spec.EngagespotHeaders.CONTENT_TYPE;
import static io.engagespot.spec.EngagespotHeaders.DEFAULT_USER_AGENT;
import static io.engagespot.spec.EngagespotHeaders.USER_AGENT;
import static io.engagespot.spec.EngagespotHeaders.X_ENGAGESPOT_API_KEY;
import static io.engagespot.spec.EngagespotHeaders.X_ENGAGESPOT_API_SECRET;

import java.util.LinkedHashMap;
import java.util.Map;

import io.engagespot.client.http.HttpClientBuilder;
import io.engagespot.util.Assert;
import io.engagespot.util.Utils;

/**
 * Builder for the {@link Engagespot} client.
 * <p>
 * The API key and secret are checked when the builder is created: a {@code null} value or a value
 * that cannot be sent as an HTTP header makes the constructor throw, so a builder that exists is
 * always able to produce a working client.
 * <pre>{@code
 * Engagespot engagespot = new EngagespotBuilder("key", "secret")
 *     .baseUrl("https://engagespot.example.com/v3")
 *     .build();
 * }</pre>
 */
public class EngagespotBuilder {

    private final Map<String, String> headers;
    private String baseUrl = Utils.DEFAULT_BASE_URL;
    private HttpClientBuilder httpClientBuilder = HttpClientBuilder.DEFAULT_FACTORY;

    /**
     * Creates a builder with the given credentials and the default base URL.
     * API key and secret can be obtained from the Engagespot dashboard.
     *
     * @param apiKey the Engagespot API key
     * @param apiSecret the Engagespot API secret
     * @throws IllegalArgumentException if either credential is {@code null} or not a valid header value
     */
    public EngagespotBuilder(String apiKey, String apiSecret) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(CONTENT_TYPE, APPLICATION_JSON);
        headers.put(USER_AGENT, DEFAULT_USER_AGENT);
        headers.put(X_ENGAGESPOT_API_KEY, Assert.checkHeaderValue(X_ENGAGESPOT_API_KEY, apiKey));
        headers.put(X_ENGAGESPOT_API_SECRET, Assert.checkHeaderValue(X_ENGAGESPOT_API_SECRET, apiSecret));
        this.headers = Map.copyOf(headers);
    }

    /**
     * Sets the Engagespot API base URL. Defaults to {@code https://api.engagespot.co/v3};
     * only needed for self-hosted Engagespot instances.
     *
     * @param baseUrl the base URL
     * @return this builder
     */
    public EngagespotBuilder baseUrl(String baseUrl) {
        this.baseUrl = Assert.checkNotNullParam("baseUrl", baseUrl);
        return this;
    }

    /**
     * Sets the factory for the HTTP transport. Defaults to {@link HttpClientBuilder#DEFAULT_FACTORY}.
     *
     * @param httpClientBuilder the transport factory
     * @return this builder
     */
    public EngagespotBuilder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
        this.httpClientBuilder = Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        return this;
    }

    public Engagespot build() {
        return new Engagespot(baseUrl, httpClientBuilder.create(baseUrl, headers));
    }

    Map<String, String> getHeaders() {
        return headers;
    }
}
