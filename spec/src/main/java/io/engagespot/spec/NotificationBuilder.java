package io.engagespot.spec;

import java.util.List;

import io.engagespot.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Fluent builder for {@link Notification}.
 * <p>
 * The recipients list handed to the builder is only referenced until {@link #build()}, which
 * copies it; changes the caller makes to the list afterwards do not reach built notifications.
 * A builder is not thread-safe.
 *
 * @param <T> the payload type
 */
public class NotificationBuilder<T> {

    private NotificationItem notification;
    private List<String> recipients;
    private @Nullable T data;
    private @Nullable String category;

    /**
     * Creates a builder with the notification title and recipients.
     * Other fields can be set by chaining the builder methods.
     *
     * @param title the notification title
     * @param recipients email addresses or user identifiers to notify
     */
    public NotificationBuilder(String title, List<String> recipients) {
        this.notification = new NotificationItem(title);
        this.recipients = Assert.checkNotNullParam("recipients", recipients);
    }

    /**
     * Replaces the whole notification item, including the title.
     *
     * @param notification the notification item
     * @return this builder
     */
    public NotificationBuilder<T> notificationItem(NotificationItem notification) {
        this.notification = Assert.checkNotNullParam("notification", notification);
        return this;
    }

    public NotificationBuilder<T> title(String title) {
        this.notification = notification.title(title);
        return this;
    }

    public NotificationBuilder<T> message(String message) {
        this.notification = notification.message(message);
        return this;
    }

    public NotificationBuilder<T> url(String url) {
        this.notification = notification.url(url);
        return this;
    }

    public NotificationBuilder<T> icon(String icon) {
        this.notification = notification.icon(icon);
        return this;
    }

    public NotificationBuilder<T> recipients(List<String> recipients) {
        this.recipients = Assert.checkNotNullParam("recipients", recipients);
        return this;
    }

    /**
     * Sets the payload delivered with the notification. Must be serializable by Jackson.
     *
     * @param data the payload
     * @return this builder
     */
    public NotificationBuilder<T> data(T data) {
        this.data = data;
        return this;
    }

    /**
     * Sets the category. Without one the notification is sent to every subscriber.
     *
     * @param category the category identifier
     * @return this builder
     */
    public NotificationBuilder<T> category(String category) {
        this.category = category;
        return this;
    }

    public Notification<T> build() {
        return new Notification<>(notification, recipients, data, category);
    }
}
