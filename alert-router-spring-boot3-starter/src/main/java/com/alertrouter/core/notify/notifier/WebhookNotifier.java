package com.alertrouter.core.notify.notifier;

import com.alertrouter.core.spi.notify.Notifier;
import com.alertrouter.model.Destination;
import com.alertrouter.model.enums.DestinationType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * chat webhook 通知
 * POST {"text": ...}, 非 2xx 视为失败
 */
public class WebhookNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(WebhookNotifier.class);

    private final HttpClient httpClient;

    private final ObjectMapper objectMapper;

    private final Duration timeout;

    public WebhookNotifier(HttpClient httpClient, ObjectMapper objectMapper, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    public WebhookNotifier(Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), new ObjectMapper(), timeout);
    }

    @Override
    public String name() {
        return "webhook";
    }

    @Override
    public boolean supports(Destination destination) {
        return destination.getType() == DestinationType.CHAT
                && destination.getWebhook() != null
                && !destination.getWebhook().isBlank();
    }

    @Override
    public void send(Destination destination, String text) throws IOException, InterruptedException {
        String body = objectMapper.writeValueAsString(Map.of("text", text));
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(destination.getWebhook()))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new IOException("webhook returned status " + status + ": " + abbreviate(response.body()));
        }
        log.debug("[Notify-webhook] sent channel={}, status={}", destination.getChannel(), status);
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 200 ? s.substring(0, 200) : s;
    }
}
