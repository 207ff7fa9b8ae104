package com.drivehr.jobsync.sync.ratelimit;

import com.drivehr.jobsync.sync.util.HashUtils;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
public class WebhookRateLimiter {
    static final String KEY_PREFIX = "webhook-rate:";

    private final RateWindowStore store;

    public WebhookRateLimiter(RateWindowStore store) {
        this.store = store;
    }

    public boolean allow(String clientKey, int maxRequests, int windowSeconds) {
        String safeKey = clientKey == null ? "" : clientKey.trim();
        return store.incrementIfBelow(
            storeKey(safeKey),
            Math.max(1, maxRequests),
            Duration.ofSeconds(Math.max(1, windowSeconds))
        );
    }

    static String storeKey(String clientKey) {
        return KEY_PREFIX + HashUtils.sha256Hex(clientKey);
    }
}
