package io.engagespot.client.http.jdk;

import io.engagespot.client.http.HttpClient;
import io.engagespot.client.http.HttpResponse;

import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

class JdkHttpClient implements HttpClient {

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;
    private final Map<String, String> defaultHeaders;

    JdkHttpClient(String baseUrl, Map<String, String> defaultHeaders) {
        this(java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                .build(), baseUrl, defaultHeaders);
    }

    JdkHttpClient(java.net.http.HttpClient httpClient, String baseUrl, Map<String, String> defaultHeaders) {
        this.httpClient = httpClient;
        this.baseUrl = normalizeBaseUrl(baseUrl);
        this.defaultHeaders = Map.copyOf(defaultHeaders);
    }

    String getBaseUrl() {
        return baseUrl;
    }

    private static String normalizeBaseUrl(String uri) {
        URI parsed;
        try {
            parsed = URI.create(uri);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid", e);
        }
        if (parsed.getScheme() == null || parsed.getHost() == null) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid");
        }

        String normalized = uri;
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    @Override
    public PutRequestBuilder put(String path) {
        return new JdkPutRequestBuilder(path);
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        protected final Map<String, String> headers = new LinkedHashMap<>(defaultHeaders);

        public JdkRequestBuilder(String path) {
            this.path = path.startsWith("/") ? path : "/" + path;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected HttpRequest.Builder createRequestBuilder() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path));
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            return builder;
        }

        protected CompletableFuture<HttpResponse> sendRequest(HttpRequest request) {
            return httpClient
                    .sendAsync(request, BodyHandlers.ofString(StandardCharsets.UTF_8))
                    .thenApply(RESPONSE_MAPPER);
        }
    }

    private abstract class JdkBodyRequestBuilder<T extends BodyRequestBuilder<T>> extends JdkRequestBuilder<T>
            implements BodyRequestBuilder<T> {
        String body = "";

        public JdkBodyRequestBuilder(String path) {
            super(path);
        }

        @Override
        public T body(@Nullable String body) {
            this.body = body == null ? "" : body;
            return self();
        }

        protected BodyPublisher bodyPublisher() {
            return HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8);
        }
    }

    private class JdkPostRequestBuilder extends JdkBodyRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {

        public JdkPostRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = super.createRequestBuilder()
                    .POST(bodyPublisher())
                    .build();
            return sendRequest(request);
        }
    }

    private class JdkPutRequestBuilder extends JdkBodyRequestBuilder<PutRequestBuilder> implements PutRequestBuilder {

        public JdkPutRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = super.createRequestBuilder()
                    .PUT(bodyPublisher())
                    .build();
            return sendRequest(request);
        }
    }

    private final static Function<java.net.http.HttpResponse<String>, HttpResponse> RESPONSE_MAPPER = JdkHttpResponse::new;

    private record JdkHttpResponse(java.net.http.HttpResponse<String> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public String body() {
            String body = response.body();
            return body == null ? "" : body;
        }
    }
}
