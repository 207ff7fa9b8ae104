package com.drivehr.jobsync.sync.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryRateWindowStore implements RateWindowStore {
    private static final int PURGE_THRESHOLD = 10_000;

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryRateWindowStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean incrementIfBelow(String key, int limit, Duration ttl) {
        Instant now = clock.instant();
        if (windows.size() > PURGE_THRESHOLD) {
            purgeExpired(now);
        }
        boolean[] counted = new boolean[1];
        windows.compute(key, (ignored, window) -> {
            if (window == null || !window.expiresAt().isAfter(now)) {
                counted[0] = true;
                return new Window(1, now.plus(ttl));
            }
            if (window.count() >= limit) {
                return window;
            }
            counted[0] = true;
            return new Window(window.count() + 1, window.expiresAt());
        });
        return counted[0];
    }

    @Override
    public int currentCount(String key) {
        Window window = windows.get(key);
        if (window == null || !window.expiresAt().isAfter(clock.instant())) {
            return 0;
        }
        return window.count();
    }

    private void purgeExpired(Instant now) {
        windows.entrySet().removeIf(entry -> !entry.getValue().expiresAt().isAfter(now));
    }

    private record Window(int count, Instant expiresAt) {
    }
}
