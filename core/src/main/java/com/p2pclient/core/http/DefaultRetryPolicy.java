package com.p2pclient.core.http;

import com.p2pclient.core.error.P2PException;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** retryable 종류(FORBIDDEN/TIMEOUT)에서만 재시도. 250ms → 500ms → 1000ms (±10% Jitter) */
public final class DefaultRetryPolicy implements RetryPolicy {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_MILLIS = 250;

    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_MILLIS); }
    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
    }

    @Override public boolean shouldRetry(P2PException failure, int attempt) {
        if (attempt >= maxAttempts) return false;
        return failure != null && failure.isRetryable();
    }

    @Override public Duration nextDelay(int attempt) {
        long pow = 1L << Math.min(Math.max(attempt, 1) - 1, 20); // 1,2,4...
        long raw = baseMillis * pow;                                // 250, 500, 1000...
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2); // ±10%
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }

    public long baseMillis() { return baseMillis; }

    @Override public String toString() {
        return "DefaultRetryPolicy{maxAttempts=" + maxAttempts + ", baseMillis=" + baseMillis + "}";
    }
}
