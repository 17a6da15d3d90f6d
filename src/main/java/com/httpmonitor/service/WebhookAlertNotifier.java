package com.httpmonitor.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.httpmonitor.model.AlertRule;
import com.httpmonitor.model.HealthCheck;
import com.httpmonitor.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class WebhookAlertNotifier implements AlertNotifier {
    private static final Logger logger = LoggerFactory.getLogger(WebhookAlertNotifier.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WebhookAlertNotifier(ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
            .connectTimeout(REQUEST_TIMEOUT)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build(), objectMapper);
    }

    public WebhookAlertNotifier(HttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public void dispatch(AlertRule rule, Target target, HealthCheck check) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                .uri(URI.create(rule.getWebhookUrl()))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(buildPayload(rule, target, check)))
                .build();
        } catch (JsonProcessingException | IllegalArgumentException ex) {
            logger.debug("Could not build webhook request for alert {} on {}", rule.getName(), target.getName(), ex);
            return;
        }

        httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
            .whenComplete((response, ex) -> {
                if (ex != null) {
                    logger.debug("Webhook delivery failed for alert {} on {}: {}", rule.getName(),
                        target.getName(), ex.toString());
                } else if (response.statusCode() < 200 || response.statusCode() >= 300) {
                    logger.debug("Webhook for alert {} on {} answered {}", rule.getName(), target.getName(),
                        response.statusCode());
                }
            });
    }

    String buildPayload(AlertRule rule, Target target, HealthCheck check) throws JsonProcessingException {
        String status = check.getStatusCode() == null ? "Error" : String.valueOf(check.getStatusCode());
        String error = check.getError() == null ? "N/A" : check.getError();

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", "danger");
        attachment.put("fields", List.of(
            field("Target", target.getName(), true),
            field("URL", target.getUrl(), true),
            field("Status", status, true),
            field("Response Time", check.getResponseTimeMs() + "ms", true),
            field("Error", error, false)
        ));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", "Alert: " + rule.getName() + " - " + target.getName());
        payload.put("attachments", List.of(attachment));
        return objectMapper.writeValueAsString(payload);
    }

    private static Map<String, Object> field(String title, String value, boolean isShort) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", isShort);
        return field;
    }
}
