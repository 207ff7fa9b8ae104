package com.drivehr.jobsync.sync.ratelimit;

import java.time.Duration;

/**
 * Expiring per-key request counters.
 */
public interface RateWindowStore {

    /**
     * Atomically counts a request against the window held under {@code key}. A missing or expired
     * window is started with a count of one and the given time to live. An open window whose count
     * has reached {@code limit} is left untouched.
     *
     * @return {@code true} when the request was counted, {@code false} when the limit was reached
     */
    boolean incrementIfBelow(String key, int limit, Duration ttl);

    /**
     * Current count of the open window, or zero when there is none.
     */
    int currentCount(String key);
}
