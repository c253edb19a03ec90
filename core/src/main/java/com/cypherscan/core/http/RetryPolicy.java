package com.cypherscan.core.http;

import java.time.Duration;

/** 원격 호출 재시도 정책 */
public interface RetryPolicy {

    /** 일시적 실패로 보는 status 인지 (-1 = 네트워크 오류) */
    boolean isRetryable(int statusCode);

    /** attempt(1부터) 실패 후 다음 시도까지 대기 */
    Duration backoff(int attempt);

    /** 첫 시도 포함 최대 시도 횟수 */
    int maxAttempts();

    default boolean shouldRetry(int statusCode, int attempt) {
        return attempt < maxAttempts() && isRetryable(statusCode);
    }

    RetryPolicy NEVER = new RetryPolicy() {
        @Override public boolean isRetryable(int statusCode) { return false; }
        @Override public Duration backoff(int attempt) { return Duration.ZERO; }
        @Override public int maxAttempts() { return 1; }
    };
}
