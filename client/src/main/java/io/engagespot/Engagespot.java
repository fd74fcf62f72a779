package io.engagespot;

import static io.engagespot.util.Assert.checkNotNullParam;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.engagespot.client.http.HttpClient;
import io.engagespot.client.http.HttpResponse;
import io.engagespot.spec.EngagespotClientException;
import io.engagespot.spec.EngagespotHttpException;
import io.engagespot.spec.Notification;
import io.engagespot.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the Engagespot REST API.
 * <p>
 * Every operation issues exactly one HTTP request and returns a future that either completes with
 * the raw response body, or completes exceptionally with an {@link EngagespotClientException} whose
 * message is the raw error text: the response body for a non-2xx answer
 * ({@link EngagespotHttpException}), or the method, URL and transport error when the API could
 * not be reached. Responses are not parsed.
 * <p>
 * A client is immutable and can be shared between threads.
 * <pre>{@code
 * Engagespot engagespot = new Engagespot("api_key", "api_secret");
 * Notification<Object> notification = Notification.builder("title", List.of("hello@foo.com")).build();
 * String response = engagespot.send(notification).join();
 * }</pre>
 */
public class Engagespot {

    private static final Logger LOGGER = LoggerFactory.getLogger(Engagespot.class);

    private static final String NOTIFICATIONS_PATH = "/notifications";
    private static final String USERS_PATH = "/users/";

    private final String baseUrl;
    private final HttpClient httpClient;

    /**
     * Creates a client with the default configuration. Shortcut for
     * {@code new EngagespotBuilder(apiKey, apiSecret).build()}.
     *
     * @param apiKey the Engagespot API key
     * @param apiSecret the Engagespot API secret
     * @throws IllegalArgumentException if either credential is {@code null} or not a valid header value
     */
    public Engagespot(String apiKey, String apiSecret) {
        this(new EngagespotBuilder(apiKey, apiSecret).build());
    }

    private Engagespot(Engagespot other) {
        this(other.baseUrl, other.httpClient);
    }

    Engagespot(String baseUrl, HttpClient httpClient) {
        this.baseUrl = checkNotNullParam("baseUrl", baseUrl);
        this.httpClient = checkNotNullParam("httpClient", httpClient);
    }

    public static EngagespotBuilder builder(String apiKey, String apiSecret) {
        return new EngagespotBuilder(apiKey, apiSecret);
    }

    /**
     * @return the API base URL, as configured
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Sends a notification.
     * <p>
     * Issues {@code POST {baseUrl}/notifications} with the notification as JSON body.
     *
     * @param notification the notification, usually created with a {@link io.engagespot.spec.NotificationBuilder}
     * @return a future completing with the response body, or exceptionally with an {@link EngagespotClientException}
     */
    public CompletableFuture<String> send(Notification<?> notification) {
        checkNotNullParam("notification", notification);
        return execute("POST", NOTIFICATIONS_PATH, notification,
                body -> httpClient.post(NOTIFICATIONS_PATH).body(body).send());
    }

    /**
     * Creates the user with the given identifier, or updates its attributes if it already exists.
     * <p>
     * Issues {@code PUT {baseUrl}/users/{identifier}}. The identifier is used as a path segment as is,
     * without any encoding.
     *
     * @param identifier the user identifier
     * @param attrs the attributes, any value Jackson can serialize
     * @return a future completing with the response body, or exceptionally with an {@link EngagespotClientException}
     */
    public CompletableFuture<String> createOrUpdateUserAttrs(String identifier, Object attrs) {
        checkNotNullParam("identifier", identifier);
        checkNotNullParam("attrs", attrs);
        String path = USERS_PATH + identifier;
        return execute("PUT", path, attrs,
                body -> httpClient.put(path).body(body).send());
    }

    private CompletableFuture<String> execute(String method, String path, Object payload,
                                              Function<String, CompletableFuture<HttpResponse>> call) {
        String body;
        try {
            body = Utils.marshalToString(payload);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Error writing {} {} payload as JSON: {}", method, path, e.getMessage(), e);
            return CompletableFuture.failedFuture(new EngagespotClientException(describe(e), e));
        }

        CompletableFuture<HttpResponse> response;
        try {
            response = call.apply(body);
        } catch (IllegalArgumentException e) {
            // Identifiers are not encoded, so an illegal path character is only caught here
            LOGGER.debug("Could not create {} request to {}{}: {}", method, baseUrl, path, e.getMessage(), e);
            return CompletableFuture.failedFuture(new EngagespotClientException(describe(e), e));
        }

        CompletableFuture<String> result = new CompletableFuture<>();
        response.whenComplete((httpResponse, throwable) -> {
            if (throwable != null) {
                Throwable cause = unwrap(throwable);
                String description = describeTransportFailure(method, path, cause);
                LOGGER.debug("{}", description, cause);
                result.completeExceptionally(new EngagespotClientException(description, cause));
                return;
            }

            int status = httpResponse.statusCode();
            LOGGER.debug("{} {}{} returned status {}", method, baseUrl, path, status);
            if (httpResponse.success()) {
                result.complete(httpResponse.body());
            } else {
                result.completeExceptionally(new EngagespotHttpException(status, httpResponse.body()));
            }
        });
        return result;
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable cause = throwable;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private String describeTransportFailure(String method, String path, Throwable cause) {
        return "error sending " + method + " request to " + baseUrl + path + ": " + cause;
    }

    private static String describe(Throwable throwable) {
        if (throwable instanceof JsonProcessingException) {
            String message = ((JsonProcessingException) throwable).getOriginalMessage();
            if (message != null) {
                return message;
            }
        }
        return throwable.toString();
    }
}
