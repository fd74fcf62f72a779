package io.engagespot.client.http;

import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous HTTP transport bound to a base URL.
 * <p>
 * Paths passed to {@link #post(String)} and {@link #put(String)} are appended to the base URL.
 * Default headers given at creation time are sent with every request. The returned futures
 * complete with an {@link HttpResponse} whatever the status code; they complete exceptionally
 * only when no response could be obtained.
 */
public interface HttpClient {

    static HttpClient createHttpClient(String baseUrl, Map<String, String> defaultHeaders) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl, defaultHeaders);
    }

    PostRequestBuilder post(String path);

    PutRequestBuilder put(String path);

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(Map<String, String> headers);
    }

    interface BodyRequestBuilder<T extends BodyRequestBuilder<T>> extends RequestBuilder<T> {
        T body(@Nullable String body);

        default CompletableFuture<HttpResponse> send(String body) {
            return this.body(body).send();
        }
    }

    interface PostRequestBuilder extends BodyRequestBuilder<PostRequestBuilder> {

    }

    interface PutRequestBuilder extends BodyRequestBuilder<PutRequestBuilder> {

    }
}
