package com.verityngn.orchestrator.service;

import java.time.Duration;

/**
 * Exponential backoff between attempts on the same provider:
 * base × 2^retry, capped at max. A rate-limited call waits at least as long
 * as the provider asked.
 */
public record BackoffPolicy(Duration base, Duration max) {

    public BackoffPolicy {
        if (base == null || base.isNegative()) {
            throw new IllegalArgumentException("backoff-base must be >= 0");
        }
        if (max == null || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("backoff-max must be >= backoff-base");
        }
    }

    public static BackoffPolicy none() {
        return new BackoffPolicy(Duration.ZERO, Duration.ZERO);
    }

    /**
     * @param retry      0 for the wait before the first retry
     * @param retryAfter server-suggested delay, may be null
     */
    public Duration delayFor(int retry, Duration retryAfter) {
        Duration delay = max;
        if (retry < 30) {
            long millis = base.toMillis() << retry;
            if (millis >= 0 && millis < max.toMillis()) {
                delay = Duration.ofMillis(millis);
            }
        }
        if (retryAfter != null && retryAfter.compareTo(delay) > 0) {
            return retryAfter;
        }
        return delay;
    }
}
