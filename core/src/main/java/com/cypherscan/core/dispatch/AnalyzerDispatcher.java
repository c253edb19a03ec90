package com.cypherscan.core.dispatch;

import com.cypherscan.core.api.IAnalyzer;
import com.cypherscan.core.exception.AnalyzerException;
import com.cypherscan.core.model.AnalyzerRun;
import com.cypherscan.core.model.Finding;
import com.cypherscan.core.model.SourceFile;
import com.cypherscan.core.util.NamedThreadFactory;
import com.cypherscan.core.util.ProgressListener;
import com.cypherscan.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * analyzer 들을 concurrencyLimit 크기의 고정 배치로 실행한다.
 *  - 한 배치가 전부 끝나야 다음 배치 시작 (sliding window 아님)
 *  - 호출 1건당 deadline 초과 시 취소 후 실패로 기록
 *  - 예외를 던진 analyzer 는 빈 결과로 처리, 형제/다음 배치에 영향 없음
 */
public final class AnalyzerDispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyzerDispatcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(AnalyzerDispatcher.class);

    private final ExecutorService workers;
    private final Duration callTimeout;
    private final DispatchStats stats = new DispatchStats();

    public AnalyzerDispatcher(Duration callTimeout) {
        if (callTimeout == null || callTimeout.isZero() || callTimeout.isNegative())
            throw new IllegalArgumentException("callTimeout must be > 0");
        this.callTimeout = callTimeout;
        // 배치 크기만큼 스레드가 필요하므로 상한 없는 풀. 배치 경계가 동시성을 제한한다.
        this.workers = Executors.newCachedThreadPool(new NamedThreadFactory("analyzer-worker"));
    }

    public List<AnalyzerRun> run(List<SourceFile> files, List<? extends IAnalyzer> analyzers, int concurrencyLimit) {
        return run(files, analyzers, concurrencyLimit, ProgressListener.NONE);
    }

    /** 결과는 analyzers 순서와 같다. */
    public List<AnalyzerRun> run(List<SourceFile> files,
                                 List<? extends IAnalyzer> analyzers,
                                 int concurrencyLimit,
                                 ProgressListener listener) {
        Objects.requireNonNull(files, "files");
        Objects.requireNonNull(analyzers, "analyzers");
        if (concurrencyLimit < 1) throw new IllegalArgumentException("concurrencyLimit must be >= 1");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;

        final List<SourceFile> input = List.copyOf(files); // analyzer 가 입력을 바꿀 수 없게
        final int total = analyzers.size();
        final List<AnalyzerRun> results = new ArrayList<>(total);
        final AtomicInteger inFlight = new AtomicInteger(); // run 호출 단위. 동시 스캔끼리 섞이지 않는다
        pl.onProgress(0.0, "analyze", 0, total);

        for (int from = 0; from < total; from += concurrencyLimit) {
            List<? extends IAnalyzer> batch = analyzers.subList(from, Math.min(total, from + concurrencyLimit));
            results.addAll(runBatch(input, batch, inFlight));
            stats.recordBatch();

            int done = results.size();
            pl.onProgress(total == 0 ? 1.0 : (double) done / total, "analyze", done, total);
        }
        return results;
    }

    private List<AnalyzerRun> runBatch(List<SourceFile> input, List<? extends IAnalyzer> batch, AtomicInteger inFlight) {
        long batchStart = System.nanoTime();
        List<Future<List<Finding>>> futures = new ArrayList<>(batch.size());
        for (IAnalyzer a : batch) {
            futures.add(workers.submit(() -> invoke(a, input, inFlight)));
        }

        long deadline = batchStart + callTimeout.toNanos();
        List<AnalyzerRun> out = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            IAnalyzer a = batch.get(i);
            Future<List<Finding>> f = futures.get(i);
            out.add(await(a, f, deadline, batchStart));
        }
        return out;
    }

    private List<Finding> invoke(IAnalyzer a, List<SourceFile> input, AtomicInteger inFlight) throws Exception {
        int cur = inFlight.incrementAndGet();
        stats.observeConcurrency(cur);
        try {
            List<Finding> found = a.analyze(input);
            return (found == null ? List.of() : found);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private AnalyzerRun await(IAnalyzer a, Future<List<Finding>> f, long deadline, long batchStart) {
        String id = a.id();
        try {
            long waitNs = Math.max(0, deadline - System.nanoTime());
            List<Finding> found = f.get(waitNs, TimeUnit.NANOSECONDS);
            long ms = elapsedMs(batchStart);
            stats.recordCall(ms, false);
            return AnalyzerRun.ok(id, stamp(id, found), ms);
        } catch (TimeoutException e) {
            f.cancel(true);
            stats.recordTimeout();
            return failure(id, new AnalyzerException(id, "timed out after " + callTimeout.toMillis() + "ms", e), batchStart);
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            return failure(id, new AnalyzerException(id, String.valueOf(cause.getMessage()), cause), batchStart);
        } catch (CancellationException e) {
            return failure(id, new AnalyzerException(id, "cancelled", e), batchStart);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            return failure(id, new AnalyzerException(id, "interrupted", e), batchStart);
        }
    }

    private AnalyzerRun failure(String id, AnalyzerException err, long batchStart) {
        long ms = elapsedMs(batchStart);
        stats.recordCall(ms, true);
        LOG.warn("Analyzer {} failed, contributing no findings: {}", id, err.getMessage());
        SLOG.warn("analyzer-failed", "analyzer", id, "error", err.getCause() == null
                ? "unknown" : err.getCause().getClass().getSimpleName(), "elapsedMs", ms);
        return AnalyzerRun.failed(id, err.getMessage(), ms);
    }

    /** finding 의 analyzerId 는 항상 실제로 실행한 analyzer id 로 덮어쓴다 */
    private static List<Finding> stamp(String id, List<Finding> found) {
        List<Finding> out = new ArrayList<>(found.size());
        for (Finding f : found) {
            if (f == null) continue;
            out.add(id.equals(f.getAnalyzerId()) ? f : f.toBuilder().analyzerId(id).build());
        }
        return out;
    }

    private static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000;
    }

    public DispatchStats.Snapshot stats() { return stats.snapshot(); }

    @Override public void close() {
        workers.shutdownNow();
    }
}
