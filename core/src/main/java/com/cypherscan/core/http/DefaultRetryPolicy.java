package com.cypherscan.core.http;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** 429/5xx/-1 만 재시도. 250ms → 500ms → 1s ... 에 ±10% 지터, 최대 3회 시도 */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;

    public DefaultRetryPolicy() { this(3, 250); }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
    }

    @Override public boolean isRetryable(int statusCode) {
        return statusCode == -1 || statusCode == 429 || statusCode >= 500;
    }

    @Override public Duration backoff(int attempt) {
        int shift = Math.min(Math.max(attempt, 1) - 1, 16);
        long raw = baseMillis << shift;
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2);
        return Duration.ofMillis((long) (raw * jitter));
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
