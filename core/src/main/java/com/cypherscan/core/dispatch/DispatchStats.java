package com.cypherscan.core.dispatch;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** dispatcher 누적 텔레메트리 (스레드 세이프) */
public final class DispatchStats {
    private final AtomicLong calls = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong batches = new AtomicLong();
    private final AtomicLong sumElapsedMs = new AtomicLong();
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger();

    void recordCall(long elapsedMs, boolean failed) {
        calls.incrementAndGet();
        sumElapsedMs.addAndGet(elapsedMs);
        if (failed) failures.incrementAndGet();
    }
    void recordTimeout() { timeouts.incrementAndGet(); }
    void recordBatch() { batches.incrementAndGet(); }

    /** run 호출 1건 안의 동시 실행 수를 관측하여 최대값 갱신 (여러 스캔이 겹쳐도 합산하지 않음) */
    void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long c = calls.get();
        long avg = c == 0 ? 0 : sumElapsedMs.get() / c;
        return new Snapshot(c, failures.get(), timeouts.get(), batches.get(), maxObservedConcurrency.get(), avg);
    }

    public record Snapshot(long calls, long failures, long timeouts, long batches,
                           int maxObservedConcurrency, long avgElapsedMs) {}
}
