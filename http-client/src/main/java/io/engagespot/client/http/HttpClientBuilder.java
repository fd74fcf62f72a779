package io.engagespot.client.http;

import java.util.Map;

import io.engagespot.client.http.jdk.JdkHttpClientBuilder;

public interface HttpClientBuilder {

    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    /**
     * @param baseUrl the URL every request path is appended to
     * @param defaultHeaders headers sent with every request
     * @return a new client
     */
    HttpClient create(String baseUrl, Map<String, String> defaultHeaders);
}
