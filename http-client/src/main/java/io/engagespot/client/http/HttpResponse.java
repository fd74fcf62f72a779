package io.engagespot.client.http;

/**
 * HTTP response with status code and body.
 */
public interface HttpResponse {
    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /**
     * @return the response body decoded as UTF-8, may be empty but not null
     */
    String body();
}
