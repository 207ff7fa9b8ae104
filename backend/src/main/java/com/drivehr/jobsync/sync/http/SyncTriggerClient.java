package com.drivehr.jobsync.sync.http;

import com.drivehr.jobsync.config.JobSyncProperties;
import com.drivehr.jobsync.sync.model.SyncTriggerResult;
import com.drivehr.jobsync.sync.security.WebhookSignatureVerifier;
import com.drivehr.jobsync.sync.util.JobUrlUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;

/**
 * Asks the upstream scraper to run a sync now. The request is signed the same way the scraper
 * signs its webhook calls.
 */
@Service
public class SyncTriggerClient {
    private static final Logger log = LoggerFactory.getLogger(SyncTriggerClient.class);
    static final String TRIGGER_REASON = "Manual sync from admin API";
    static final String TRIGGER_SOURCE = "job-sync-api";
    static final String SUCCESS_MESSAGE = "Sync triggered successfully! Jobs will update in 1-2 minutes.";

    private final JobSyncProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final HttpClient client;

    public SyncTriggerClient(JobSyncProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getTrigger().getTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    public SyncTriggerResult trigger(boolean forceSync) {
        JobSyncProperties.Trigger trigger = properties.getTrigger();
        if (!trigger.isConfigured()) {
            throw new SyncTriggerException(HttpStatus.SERVICE_UNAVAILABLE, "Sync trigger URL not configured");
        }
        if (!properties.isSecretConfigured()) {
            throw new SyncTriggerException(HttpStatus.SERVICE_UNAVAILABLE, "Webhook secret not configured");
        }
        URI uri = JobUrlUtils.safeUri(JobUrlUtils.sanitizeUrl(trigger.getUrl()));
        if (uri == null) {
            throw new SyncTriggerException(HttpStatus.SERVICE_UNAVAILABLE, "Sync trigger URL is not a valid http(s) URL");
        }

        byte[] body = requestBody(forceSync);
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(trigger.getTimeoutSeconds()))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .header(WebhookSignatureVerifier.SIGNATURE_HEADER, WebhookSignatureVerifier.sign(body, properties.getWebhookSecret()))
            .header(WebhookSignatureVerifier.TIMESTAMP_HEADER, Long.toString(clock.instant().getEpochSecond()))
            .POST(HttpRequest.BodyPublishers.ofByteArray(body))
            .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            log.warn("Sync trigger timed out after {}s", trigger.getTimeoutSeconds());
            throw new SyncTriggerException(HttpStatus.BAD_GATEWAY, "Failed to connect: request timed out", e);
        } catch (IOException e) {
            log.warn("Sync trigger connection failed: {}", e.getMessage());
            throw new SyncTriggerException(HttpStatus.BAD_GATEWAY, "Failed to connect: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncTriggerException(HttpStatus.BAD_GATEWAY, "Failed to connect: interrupted", e);
        }

        JsonNode data = parse(response.body());
        if (response.statusCode() == 200 && data != null && data.path("success").asBoolean(false)) {
            String requestId = textOrNull(data, "requestId");
            log.info("Sync trigger accepted upstream, requestId={}", requestId);
            return new SyncTriggerResult(true, SUCCESS_MESSAGE, requestId);
        }

        String upstreamError = data == null ? null : textOrNull(data, "error");
        if (upstreamError == null && data != null) {
            upstreamError = textOrNull(data, "message");
        }
        String message = "Sync trigger failed: " + (upstreamError == null ? "Unknown error" : upstreamError);
        log.warn("{} (status {})", message, response.statusCode());
        throw new SyncTriggerException(HttpStatus.BAD_GATEWAY, message);
    }

    private byte[] requestBody(boolean forceSync) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("force_sync", forceSync);
        payload.put("reason", TRIGGER_REASON);
        payload.put("source", TRIGGER_SOURCE);
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize sync trigger payload", e);
        }
    }

    private JsonNode parse(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Sync trigger response is not JSON: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
