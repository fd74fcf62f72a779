/**
 * Pluggable HTTP transport used by the Engagespot client.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.engagespot.client.http.HttpClient} - asynchronous client bound to a base URL and default headers</li>
 *   <li>{@link io.engagespot.client.http.HttpClientBuilder} - factory for clients; {@code DEFAULT_FACTORY} uses the JDK client</li>
 *   <li>{@link io.engagespot.client.http.HttpResponse} - status code and body</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient("https://api.engagespot.co/v3",
 *         Map.of("Content-Type", "application/json"));
 *
 * client.post("/notifications")
 *     .body(json)
 *     .send()
 *     .thenAccept(response -> System.out.println(response.statusCode() + " " + response.body()));
 * }</pre>
 */
@NullMarked
package io.engagespot.client.http;

import org.jspecify.annotations.NullMarked;
