package com.drivehr.jobsync.sync.api;

import com.drivehr.jobsync.config.JobSyncProperties;
import com.drivehr.jobsync.sync.model.ReconciliationResult;
import com.drivehr.jobsync.sync.ratelimit.WebhookRateLimiter;
import com.drivehr.jobsync.sync.security.ClientIpResolver;
import com.drivehr.jobsync.sync.security.WebhookSignatureVerifier;
import com.drivehr.jobsync.sync.service.ListingReconciliationService;
import com.drivehr.jobsync.sync.service.ListingSyncException;
import com.drivehr.jobsync.sync.validation.ValidationOutcome;
import com.drivehr.jobsync.sync.validation.WebhookPayloadValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Receives signed job snapshots from the upstream scraper. Every check short-circuits into a JSON
 * error body; only a fully authenticated, well-formed payload reaches the reconciliation engine.
 */
@RestController
public class ListingWebhookController {
    private static final Logger log = LoggerFactory.getLogger(ListingWebhookController.class);

    static final String MSG_DISABLED = "Service temporarily unavailable";
    static final String MSG_METHOD = "Method not allowed";
    static final String MSG_RATE_LIMITED = "Rate limit exceeded";
    static final String MSG_UNAUTHORIZED = "Unauthorized - Invalid signature";
    static final String MSG_INVALID_JSON = "Invalid JSON format";
    static final String MSG_INVALID_STRUCTURE = "Invalid webhook data structure";
    static final String MSG_INTERNAL = "Internal server error";

    private final JobSyncProperties properties;
    private final WebhookRateLimiter rateLimiter;
    private final ClientIpResolver clientIpResolver;
    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookPayloadValidator payloadValidator;
    private final ListingReconciliationService reconciliationService;
    private final ObjectReader jsonReader;
    private final Clock clock;

    public ListingWebhookController(
        JobSyncProperties properties,
        WebhookRateLimiter rateLimiter,
        ClientIpResolver clientIpResolver,
        WebhookSignatureVerifier signatureVerifier,
        WebhookPayloadValidator payloadValidator,
        ListingReconciliationService reconciliationService,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.properties = properties;
        this.rateLimiter = rateLimiter;
        this.clientIpResolver = clientIpResolver;
        this.signatureVerifier = signatureVerifier;
        this.payloadValidator = payloadValidator;
        this.reconciliationService = reconciliationService;
        this.jsonReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.clock = clock;
    }

    @RequestMapping("${job-sync.webhook-path:" + JobSyncProperties.DEFAULT_WEBHOOK_PATH + "}")
    public ResponseEntity<Map<String, Object>> receive(
        HttpServletRequest request,
        @RequestBody(required = false) byte[] body
    ) {
        if (!properties.isEnabled()) {
            return respond(HttpStatus.SERVICE_UNAVAILABLE, error(MSG_DISABLED));
        }

        if (!"POST".equalsIgnoreCase(request.getMethod())) {
            Map<String, Object> payload = error(MSG_METHOD);
            payload.put("allowed_methods", List.of("POST"));
            return respond(HttpStatus.METHOD_NOT_ALLOWED, payload);
        }

        String clientIp = clientIpResolver.resolve(request::getHeader, request.getRemoteAddr());
        JobSyncProperties.RateLimit rateLimit = properties.getRateLimit();
        if (!rateLimiter.allow(clientIp, rateLimit.getMaxRequests(), rateLimit.getWindowSeconds())) {
            log.warn("Webhook rate limit exceeded for {}", clientIp);
            Map<String, Object> payload = error(MSG_RATE_LIMITED);
            payload.put("retry_after", rateLimit.getWindowSeconds());
            return respond(HttpStatus.TOO_MANY_REQUESTS, payload);
        }

        byte[] rawBody = body == null ? new byte[0] : body;
        boolean verified = signatureVerifier.verify(
            rawBody,
            request.getHeader(WebhookSignatureVerifier.SIGNATURE_HEADER),
            request.getHeader(WebhookSignatureVerifier.TIMESTAMP_HEADER),
            properties.getWebhookSecret(),
            clock.instant()
        );
        if (!verified) {
            log.warn("Webhook signature rejected for {}", clientIp);
            return respond(HttpStatus.UNAUTHORIZED, error(MSG_UNAUTHORIZED));
        }

        JsonNode decoded = decode(rawBody);
        if (decoded == null) {
            return respond(HttpStatus.BAD_REQUEST, error(MSG_INVALID_JSON));
        }

        ValidationOutcome outcome = payloadValidator.validate(decoded);
        if (!outcome.valid()) {
            log.warn("Webhook payload rejected: {}", outcome.failedCheck());
            Map<String, Object> payload = error(MSG_INVALID_STRUCTURE);
            payload.put("expected", Map.of(WebhookPayloadValidator.JOBS_FIELD, "array"));
            return respond(HttpStatus.BAD_REQUEST, payload);
        }

        List<JsonNode> jobs = new ArrayList<>();
        decoded.get(WebhookPayloadValidator.JOBS_FIELD).forEach(jobs::add);
        activity("Webhook accepted from {} with {} job(s)", clientIp, jobs.size());
        try {
            ReconciliationResult result = reconciliationService.reconcile(jobs);
            activity("Webhook from {} completed", clientIp);
            return respond(HttpStatus.OK, result.toResponseBody());
        } catch (ListingSyncException e) {
            log.warn("Webhook from {} failed during {}: {}", clientIp, e.getPhase(), e.getMessage());
            return respond(HttpStatus.INTERNAL_SERVER_ERROR, error(MSG_INTERNAL));
        } catch (RuntimeException e) {
            log.error("Webhook processing failed unexpectedly", e);
            return respond(HttpStatus.INTERNAL_SERVER_ERROR, error(MSG_INTERNAL));
        }
    }

    private JsonNode decode(byte[] rawBody) {
        if (rawBody.length == 0) {
            return null;
        }
        try {
            JsonNode node = jsonReader.readTree(rawBody);
            return node == null || node.isMissingNode() ? null : node;
        } catch (JsonProcessingException e) {
            log.debug("Webhook body is not valid JSON: {}", e.getOriginalMessage());
            return null;
        } catch (IOException e) {
            log.debug("Webhook body could not be read: {}", e.getMessage());
            return null;
        }
    }

    private Map<String, Object> error(String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("error", message);
        return payload;
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>(payload);
        body.putIfAbsent("timestamp", OffsetDateTime.now(clock).toString());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("X-Content-Type-Options", "nosniff");
        headers.set("X-Frame-Options", "DENY");
        headers.set("X-Robots-Tag", "noindex, nofollow, noarchive, nosnippet");
        if (status.value() >= 400) {
            headers.setCacheControl("no-cache, no-store, must-revalidate");
            headers.setPragma("no-cache");
            headers.set(HttpHeaders.EXPIRES, "0");
        }
        if (status == HttpStatus.METHOD_NOT_ALLOWED) {
            headers.set(HttpHeaders.ALLOW, "POST");
        }
        return ResponseEntity.status(status).headers(headers).body(body);
    }

    private void activity(String format, Object... args) {
        if (properties.isDebugLogging()) {
            log.info(format, args);
        } else {
            log.debug(format, args);
        }
    }
}
