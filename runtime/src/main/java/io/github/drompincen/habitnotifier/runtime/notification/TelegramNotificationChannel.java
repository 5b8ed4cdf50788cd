package io.github.drompincen.habitnotifier.runtime.notification;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends reminders through the Telegram Bot API {@code sendMessage} method.
 * 403 (bot blocked, user deactivated) and 400 (chat not found, invalid peer) are
 * permanent; rate limits, server errors and transport failures are transient.
 */
@Service
public class TelegramNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(TelegramNotificationChannel.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String botToken;
    private final Duration requestTimeout;

    @Autowired
    public TelegramNotificationChannel(ObjectMapper objectMapper,
                                       @Value("${habitnotifier.telegram.base-url:https://api.telegram.org}") String baseUrl,
                                       @Value("${habitnotifier.telegram.bot-token:}") String botToken,
                                       @Value("${habitnotifier.delivery.timeout-ms:10000}") long timeoutMs) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofMillis(timeoutMs)).build(),
                objectMapper, baseUrl, botToken, Duration.ofMillis(timeoutMs));
    }

    TelegramNotificationChannel(HttpClient httpClient, ObjectMapper objectMapper,
                                String baseUrl, String botToken, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.botToken = botToken;
        this.requestTimeout = requestTimeout;
        if (botToken == null || botToken.isBlank()) {
            log.warn("habitnotifier.telegram.bot-token is not set, reminders cannot be delivered");
        }
    }

    @Override
    public DeliveryResult send(long userId, String text) {
        if (botToken == null || botToken.isBlank()) {
            return DeliveryResult.transientFailure("bot token not configured");
        }
        try {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("chat_id", userId);
            body.put("text", text);

            HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/bot" + botToken + "/sendMessage"))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return classify(response.statusCode(), response.body());
        } catch (JsonProcessingException e) {
            return DeliveryResult.transientFailure("could not encode message: " + e.getOriginalMessage());
        } catch (IOException e) {
            return DeliveryResult.transientFailure("transport error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DeliveryResult.transientFailure("interrupted");
        }
    }

    DeliveryResult classify(int status, String body) {
        if (status == 200) return DeliveryResult.success();
        String description = description(body);
        return switch (status) {
            case 400, 403 -> DeliveryResult.permanentFailure(status + " " + description);
            default -> DeliveryResult.transientFailure(status + " " + description);
        };
    }

    private String description(String body) {
        if (body == null || body.isBlank()) return "";
        try {
            return objectMapper.readTree(body).path("description").asText("");
        } catch (JsonProcessingException e) {
            return body;
        }
    }
}
