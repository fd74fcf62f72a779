package io.engagespot.client.http.jdk;

import java.util.Map;

import io.engagespot.client.http.HttpClient;
import io.engagespot.client.http.HttpClientBuilder;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    @Override
    public HttpClient create(String baseUrl, Map<String, String> defaultHeaders) {
        return new JdkHttpClient(baseUrl, defaultHeaders);
    }
}
