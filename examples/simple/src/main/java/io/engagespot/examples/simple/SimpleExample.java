package io.engagespot.examples.simple;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import io.engagespot.Engagespot;
import io.engagespot.EngagespotBuilder;
import io.engagespot.spec.Notification;
import io.engagespot.spec.NotificationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends a notification and updates a user's attributes.
 * <p>
 * Reads {@code ENGAGESPOT_API_KEY} and {@code ENGAGESPOT_API_SECRET} from the environment, and
 * optionally {@code ENGAGESPOT_BASE_URL} for self-hosted instances. The recipient defaults to
 * {@code foo@bar.com} and can be passed as first argument.
 * <p>
 * No {@code .env} file is loaded: export the variables in the shell first, for example with
 * {@code set -a; . ./.env; set +a}.
 */
public class SimpleExample {

    private static final Logger LOGGER = LoggerFactory.getLogger(SimpleExample.class);

    public record Data(String foo) {
    }

    public static void main(String[] args) {
        String apiKey = requireEnv("ENGAGESPOT_API_KEY");
        String apiSecret = requireEnv("ENGAGESPOT_API_SECRET");
        String recipient = args.length > 0 ? args[0] : "foo@bar.com";

        EngagespotBuilder builder = new EngagespotBuilder(apiKey, apiSecret);
        String baseUrl = System.getenv("ENGAGESPOT_BASE_URL");
        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        Engagespot client = builder.build();

        Notification<Data> notification = new NotificationBuilder<Data>("Test", List.of(recipient))
                .title("Message received")
                .message("New message received")
                .icon("favicon.png")
                .url("https://google.com")
                .data(new Data("bar"))
                .build();

        LOGGER.info("Response is {}", awaitText(client.send(notification)));
        LOGGER.info("Response is {}", awaitText(client.createOrUpdateUserAttrs(recipient, new Data("bar"))));
    }

    private static String awaitText(CompletableFuture<String> response) {
        try {
            return response.join();
        } catch (CompletionException e) {
            return "Error: " + e.getCause().getMessage();
        }
    }

    private static String requireEnv(String name) {
        String value = System.getenv(name);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(name + " must be set.");
        }
        return value;
    }
}
