/**
 * Java client for the Engagespot REST API.
 *
 * <p>Send multi-channel notifications and manage user attributes from a Java application. An API
 * key and secret from the Engagespot dashboard are needed to get started.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Engagespot engagespot = new Engagespot("api_key", "api_secret");
 *
 * Notification<Object> notification = Notification.builder("title", List.of("foo@bar.com")).build();
 * engagespot.send(notification)
 *     .thenAccept(response -> System.out.println("Response is " + response))
 *     .exceptionally(error -> {
 *         System.err.println("Error: " + error.getCause().getMessage());
 *         return null;
 *     });
 * }</pre>
 *
 * @see io.engagespot.Engagespot
 * @see io.engagespot.EngagespotBuilder
 * @see io.engagespot.spec.NotificationBuilder
 */
@NullMarked
package io.engagespot;

import org.jspecify.annotations.NullMarked;
