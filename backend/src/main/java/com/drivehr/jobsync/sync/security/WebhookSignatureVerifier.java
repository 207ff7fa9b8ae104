package com.drivehr.jobsync.sync.security;

import com.drivehr.jobsync.config.JobSyncProperties;
import com.drivehr.jobsync.sync.util.HashUtils;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;

/**
 * HMAC-SHA256 verification of signed webhook bodies.
 *
 * <p>Expected headers: {@code X-Webhook-Signature: sha256=<hex>} computed over the raw body, and
 * {@code X-Webhook-Timestamp: <unix seconds>} which must lie within the configured drift of the
 * server clock. An empty secret never verifies.
 */
@Component
public class WebhookSignatureVerifier {
    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";
    public static final String SIGNATURE_PREFIX = "sha256=";
    private static final BigDecimal MAX_TIMESTAMP = BigDecimal.valueOf(1_000_000_000_000L);

    private final JobSyncProperties properties;

    public WebhookSignatureVerifier(JobSyncProperties properties) {
        this.properties = properties;
    }

    public boolean verify(byte[] rawBody, String signatureHeader, String timestampHeader, String secret, Instant now) {
        Long timestamp = parseTimestamp(timestampHeader);
        if (timestamp == null || now == null) {
            return false;
        }
        long drift = Math.abs(now.getEpochSecond() - timestamp);
        if (drift > properties.getMaxTimestampDriftSeconds()) {
            return false;
        }
        if (secret == null || secret.isEmpty()) {
            return false;
        }
        if (signatureHeader == null || !signatureHeader.startsWith(SIGNATURE_PREFIX)) {
            return false;
        }
        String expected = sign(rawBody, secret);
        return MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            signatureHeader.getBytes(StandardCharsets.UTF_8)
        );
    }

    public static String sign(byte[] body, String secret) {
        return SIGNATURE_PREFIX + HashUtils.hmacSha256Hex(body, secret);
    }

    static Long parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            // whole seconds; fractional or exponent forms are truncated
            BigDecimal value = new BigDecimal(raw.trim());
            if (value.abs().compareTo(MAX_TIMESTAMP) > 0) {
                return null;
            }
            return value.longValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
