package com.cypherscan.core.service;

import com.cypherscan.core.api.IAnalyzer;
import com.cypherscan.core.api.IContractSourceProvider;
import com.cypherscan.core.api.ISourceClient;
import com.cypherscan.core.cache.ArtifactCache;
import com.cypherscan.core.cache.CacheClock;
import com.cypherscan.core.consensus.ConsensusConfig;
import com.cypherscan.core.consensus.ConsensusEngine;
import com.cypherscan.core.consensus.ConsensusResult;
import com.cypherscan.core.consensus.FindingGroup;
import com.cypherscan.core.consensus.FindingGroupKey;
import com.cypherscan.core.consensus.FindingGrouper;
import com.cypherscan.core.dispatch.AnalyzerDispatcher;
import com.cypherscan.core.dispatch.DispatchStats;
import com.cypherscan.core.exception.UpstreamException;
import com.cypherscan.core.exception.ValidationException;
import com.cypherscan.core.fetch.ArtifactFetcher;
import com.cypherscan.core.fetch.SourceFileFilter;
import com.cypherscan.core.model.AnalyzerRun;
import com.cypherscan.core.model.Finding;
import com.cypherscan.core.model.Scan;
import com.cypherscan.core.model.ScanConfig;
import com.cypherscan.core.model.ScanRequest;
import com.cypherscan.core.model.ScanSnapshot;
import com.cypherscan.core.model.ScanStatus;
import com.cypherscan.core.model.SourceFile;
import com.cypherscan.core.model.Vote;
import com.cypherscan.core.util.NamedThreadFactory;
import com.cypherscan.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 스캔 오케스트레이터:
 *  - submit → fetch(캐시) → analyzer 배치 실행 → 그룹별 투표/합의 → 결과 기록
 *  - 상태 머신 PENDING → SCANNING → VOTING → COMPLETED, 어디서든 FAILED
 *  - submit 은 검증만 동기, 나머지는 파이프라인 스레드에서 실행
 *
 * 진행률 체크포인트: SCANNING 5, fetch 완료 15, analyzer 진행 15~85, VOTING 88~90, 종료 100.
 */
public final class ScanOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ScanOrchestrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanOrchestrator.class);

    private static final int P_SCANNING = 5;
    private static final int P_FETCHED = 15;
    private static final int P_ANALYZED = 85;
    private static final int P_VOTING = 88;
    private static final int P_VOTES_CAST = 90;

    private static final char[] ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    private final ScanConfig config;
    private final ArtifactFetcher fetcher;
    private final List<IAnalyzer> analyzers;
    private final Map<String, IAnalyzer> analyzersById;
    private final AnalyzerDispatcher dispatcher;
    private final FindingGrouper grouper;
    private final Clock clock;

    private final ExecutorService pipeline;
    private final ScheduledExecutorService timers;
    private final AutoCloseable ownedCache; // nullable

    private final Map<String, Scan> scans = new ConcurrentHashMap<>();
    private final Map<String, VotingSession> voting = new ConcurrentHashMap<>();

    /** 기본 구성: GitHub 클라이언트 + 프로세스 공유 캐시 */
    public static ScanOrchestrator create(ScanConfig config,
                                          ISourceClient sourceClient,
                                          IContractSourceProvider contractProvider,
                                          List<? extends IAnalyzer> analyzers) {
        config.validate();
        ScanConfig.CacheCfg cc = config.getCache();
        Duration ttl = Duration.ofMinutes(sysInt("cs.cache.ttlMinutes", (int) cc.getTtl().toMinutes()));
        if (ttl.isZero() || ttl.isNegative()) ttl = cc.getTtl();

        ArtifactCache<List<SourceFile>> cache =
                new ArtifactCache<>("artifact-cache", cc.getCapacity(), ttl, cc.getSweepInterval(), CacheClock.SYSTEM);
        ArtifactFetcher fetcher = new ArtifactFetcher(sourceClient, cache,
                new SourceFileFilter(config.getSourceExtensions()), ttl, contractProvider);
        return new ScanOrchestrator(config, fetcher, analyzers, Clock.systemUTC(), cache);
    }

    public ScanOrchestrator(ScanConfig config, ArtifactFetcher fetcher, List<? extends IAnalyzer> analyzers) {
        this(config, fetcher, analyzers, Clock.systemUTC(), null);
    }

    public ScanOrchestrator(ScanConfig config, ArtifactFetcher fetcher, List<? extends IAnalyzer> analyzers, Clock clock) {
        this(config, fetcher, analyzers, clock, null);
    }

    private ScanOrchestrator(ScanConfig config,
                             ArtifactFetcher fetcher,
                             List<? extends IAnalyzer> analyzers,
                             Clock clock,
                             AutoCloseable ownedCache) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.analyzers = List.copyOf(Objects.requireNonNull(analyzers, "analyzers"));
        if (this.analyzers.isEmpty()) throw new IllegalArgumentException("at least one analyzer is required");

        Map<String, IAnalyzer> byId = new LinkedHashMap<>();
        for (IAnalyzer a : this.analyzers) {
            if (byId.put(a.id(), a) != null) throw new IllegalArgumentException("duplicate analyzer id: " + a.id());
        }
        this.analyzersById = Map.copyOf(byId);

        this.clock = Objects.requireNonNull(clock, "clock");
        this.dispatcher = new AnalyzerDispatcher(config.getAnalyzerTimeout());
        this.grouper = new FindingGrouper(config.getRejectVoteConfidence());
        this.ownedCache = ownedCache;

        int n = config.getPipelineThreads();
        this.pipeline = new ThreadPoolExecutor(n, n, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(), new NamedThreadFactory("scan-pipeline"));
        this.timers = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("scan-timer"));

        Duration retention = config.getRetention();
        if (!retention.isZero()) {
            long every = Math.max(1_000, retention.toMillis());
            timers.scheduleAtFixedRate(() -> {
                int removed = evictFinished(retention);
                if (removed > 0) LOG.info("Evicted {} finished scans older than {}", removed, retention);
            }, every, every, TimeUnit.MILLISECONDS);
        }
    }

    /* =========================
       공개 API
       ========================= */

    /**
     * 요청을 검증하고 PENDING 스캔을 만든 뒤 즉시 반환한다.
     * @throws ValidationException 잘못된 요청 (스캔은 생성되지 않음)
     */
    public String submit(ScanRequest request) {
        if (request == null) throw new ValidationException("request is required");
        request.validate();

        Scan scan;
        String id;
        do {
            id = newScanId();
            scan = new Scan(id, request, clock.instant());
        } while (scans.putIfAbsent(id, scan) != null);

        LOG.info("Scan {} submitted: {} {}", id, request.getType(), request.locator());
        SLOG.info("scan-submitted", "scanId", id, "type", request.getType(), "locator", request.locator(),
                "requestedBy", request.getRequestedBy());

        final Scan s = scan;
        try {
            pipeline.execute(() -> runPipeline(s));
        } catch (RejectedExecutionException e) {
            scans.remove(id, s);
            throw new IllegalStateException("orchestrator is closed", e);
        }
        return id;
    }

    public Optional<ScanSnapshot> getStatus(String scanId) {
        Scan s = (scanId == null ? null : scans.get(scanId));
        return s == null ? Optional.empty() : Optional.of(s.snapshot());
    }

    /** 생성 시각 순 */
    public List<ScanSnapshot> listScans() {
        List<ScanSnapshot> out = new ArrayList<>();
        for (Scan s : scans.values()) out.add(s.snapshot());
        out.sort(Comparator.comparing(ScanSnapshot::createdAt).thenComparing(ScanSnapshot::scanId));
        return out;
    }

    /**
     * VOTING 중인 스캔에 외부 표를 추가한다. 같은 analyzer 의 같은 그룹 표는 대체.
     * @throws NoSuchElementException 스캔 없음
     * @throws IllegalStateException  VOTING 상태가 아님
     * @throws IllegalArgumentException 스캔에 없는 그룹
     */
    public void submitVote(String scanId, Vote vote) {
        Objects.requireNonNull(vote, "vote");
        Scan scan = scans.get(scanId);
        if (scan == null) throw new NoSuchElementException("scan not found: " + scanId);
        VotingSession session = voting.get(scanId);
        if (session == null) {
            throw new IllegalStateException("scan " + scanId + " is not accepting votes (status=" + scan.getStatus() + ")");
        }
        session.accept(vote);
    }

    /** 종료 후 olderThan 이상 지난 스캔 제거 */
    public int evictFinished(Duration olderThan) {
        Instant cutoff = clock.instant().minus(olderThan);
        int removed = 0;
        for (Map.Entry<String, Scan> e : scans.entrySet()) {
            Scan s = e.getValue();
            Instant done = s.getCompletedAt();
            if (s.getStatus().isTerminal() && done != null && !done.isAfter(cutoff)
                    && scans.remove(e.getKey(), s)) {
                removed++;
            }
        }
        return removed;
    }

    public DispatchStats.Snapshot dispatchStats() { return dispatcher.stats(); }

    @Override public void close() {
        pipeline.shutdownNow();
        for (VotingSession vs : voting.values()) vs.engine.close();
        voting.clear();
        timers.shutdownNow();
        dispatcher.close();
        if (ownedCache != null) {
            try {
                ownedCache.close();
            } catch (Exception e) {
                LOG.warn("Failed to close artifact cache: {}", e.toString());
            }
        }
    }

    /* =========================
       파이프라인
       ========================= */

    private void runPipeline(Scan scan) {
        String id = scan.getScanId();
        try {
            // ---- 1) fetch ----
            transition(scan, ScanStatus.SCANNING, P_SCANNING);
            List<SourceFile> files = fetch(scan.getRequest());
            scan.advanceProgress(P_FETCHED);
            LOG.info("Scan {} fetched {} files", id, files.size());

            // ---- 2) analyzers (배치) ----
            List<AnalyzerRun> runs = dispatcher.run(files, analyzers, config.getConcurrency(),
                    (p, phase, done, total) -> scan.advanceProgress(P_FETCHED + (int) Math.round((P_ANALYZED - P_FETCHED) * p)));
            scan.advanceProgress(P_ANALYZED);
            long failed = runs.stream().filter(AnalyzerRun::failed).count();
            LOG.info("Scan {} analyzers done: {} ok, {} failed", id, runs.size() - failed, failed);

            // ---- 3) 그룹핑 → 투표 ----
            Map<FindingGroupKey, FindingGroup> groups = grouper.group(runs);
            transition(scan, ScanStatus.VOTING, P_VOTING);
            startVoting(scan, groups, runs);

        } catch (UpstreamException e) {
            fail(scan, "upstream error (status " + e.getStatus() + "): " + e.getMessage(), e);
        } catch (RuntimeException e) {
            fail(scan, "internal error: " + e, e);
        }
    }

    private List<SourceFile> fetch(ScanRequest req) {
        return switch (req.getType()) {
            case GITHUB -> fetcher.fetchTree(req.getRepository(), req.getPath(), req.getAccessToken());
            case ONCHAIN -> fetcher.fetchContract(req.getContractAddress(), req.getChain());
        };
    }

    private void startVoting(Scan scan, Map<FindingGroupKey, FindingGroup> groups, List<AnalyzerRun> runs) {
        ConsensusEngine engine = new ConsensusEngine(ConsensusConfig.from(config, analyzers.size()), timers);
        VotingSession session = new VotingSession(scan, groups, engine);
        voting.put(scan.getScanId(), session);

        if (groups.isEmpty()) {
            session.finalizeOnce("no findings");
            return;
        }

        for (FindingGroupKey key : groups.keySet()) {
            String k = key.asString();
            engine.startTimeout(k, () -> session.onTimeout(k));
        }
        for (FindingGroup g : groups.values()) {
            // 그룹의 파생 표는 한꺼번에 기록해야 부분 집계로 결정되지 않는다
            session.acceptAll(grouper.deriveVotes(g, runs, analyzersById));
        }
        scan.advanceProgress(P_VOTES_CAST);
        session.finalizeIfSettled();
    }

    private void transition(Scan scan, ScanStatus next, int progress) {
        if (!scan.moveTo(next, progress)) {
            throw new IllegalStateException("illegal transition " + scan.getStatus() + " -> " + next);
        }
        LOG.info("Scan {} -> {} ({}%)", scan.getScanId(), next, scan.getProgress());
        SLOG.info("scan-phase", "scanId", scan.getScanId(), "status", next, "progress", scan.getProgress());
    }

    private void fail(Scan scan, String reason, Throwable t) {
        VotingSession vs = voting.remove(scan.getScanId());
        if (vs != null) vs.engine.close();
        if (scan.fail(reason, clock.instant())) {
            LOG.warn("Scan {} FAILED: {}", scan.getScanId(), reason);
            SLOG.error("scan-failed", t, "scanId", scan.getScanId(), "reason", reason);
        }
    }

    private String newScanId() {
        ThreadLocalRandom r = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder("scan_").append(clock.millis()).append('_');
        for (int i = 0; i < 9; i++) sb.append(ID_ALPHABET[r.nextInt(ID_ALPHABET.length)]);
        return sb.toString();
    }

    private static int sysInt(String key, int def) {
        String v = System.getProperty(key);
        if (v == null || v.isBlank()) return def;
        try { return Integer.parseInt(v.trim()); } catch (NumberFormatException e) { return def; }
    }

    /* =========================
       투표 세션 (스캔 1건)
       ========================= */

    private final class VotingSession {
        private final Scan scan;
        private final Map<FindingGroupKey, FindingGroup> groups;
        private final Map<String, FindingGroupKey> keysByString = new LinkedHashMap<>();
        private final Set<String> outstanding = ConcurrentHashMap.newKeySet(); // 미결 & 타임아웃 전
        private final ConsensusEngine engine;
        private final AtomicBoolean finalized = new AtomicBoolean(false);

        VotingSession(Scan scan, Map<FindingGroupKey, FindingGroup> groups, ConsensusEngine engine) {
            this.scan = scan;
            this.groups = groups;
            this.engine = engine;
            for (FindingGroupKey k : groups.keySet()) {
                keysByString.put(k.asString(), k);
                outstanding.add(k.asString());
            }
        }

        void accept(Vote vote) {
            acceptAll(List.of(vote));
        }

        /** 한 그룹의 표들. 합의가 철회되면 그룹을 다시 미결로 돌리고 타이머를 건다. */
        void acceptAll(List<Vote> votes) {
            if (votes.isEmpty()) return;
            String k = votes.get(0).groupKey();
            if (!keysByString.containsKey(k)) {
                throw new IllegalArgumentException("unknown finding group for scan "
                        + scan.getScanId() + ": " + k);
            }
            if (finalized.get()) {
                throw new IllegalStateException("scan " + scan.getScanId() + " voting already finalized");
            }
            scan.recordVotes(votes);
            boolean wasDecided = engine.isDecided(k);
            Optional<ConsensusResult> r = engine.submitVotes(votes);
            if (r.isPresent()) {
                outstanding.remove(k);
                finalizeIfSettled();
            } else if (wasDecided && outstanding.add(k)) {
                LOG.info("Scan {} consensus on {} withdrawn, voting reopened", scan.getScanId(), k);
                engine.startTimeout(k, () -> onTimeout(k));
            }
        }

        void onTimeout(String groupKey) {
            outstanding.remove(groupKey);
            LOG.info("Scan {} voting timeout on {} with {} vote(s)",
                    scan.getScanId(), groupKey, engine.getVotes(groupKey).size());
            finalizeIfSettled();
        }

        /** 모든 그룹이 결정됐거나 타임아웃이 지났으면 종결. 최초 VOTING 진입 전에는 호출되지 않는다. */
        void finalizeIfSettled() {
            if (outstanding.isEmpty() && scan.getProgress() >= P_VOTES_CAST) {
                finalizeOnce(null);
            }
        }

        void finalizeOnce(String note) {
            if (!finalized.compareAndSet(false, true)) return;
            try {
                List<Finding> confirmed = new ArrayList<>();
                Set<String> forced = new LinkedHashSet<>();
                for (FindingGroup g : groups.values()) {
                    String k = g.key().asString();
                    // 결정 여부와 무관하게 기록된 표 전체로 판정
                    ConsensusResult r = engine.finalResult(k);
                    if (!engine.isDecided(k)) forced.add(k);
                    if (r.isConfirmed()) {
                        confirmed.add(g.representative().withConfidence(r.confidenceScore()));
                    }
                }

                confirmed.sort(Comparator.comparing((Finding f) -> -f.getSeverity().rank())
                        .thenComparing(Comparator.comparingDouble(Finding::getConfidence).reversed())
                        .thenComparing(Finding::getCategory));
                List<Finding> numbered = new ArrayList<>(confirmed.size());
                for (int i = 0; i < confirmed.size(); i++) {
                    Finding f = confirmed.get(i);
                    numbered.add(f.confirmedAs(scan.getScanId() + "-F" + (i + 1), f.getConfidence()));
                }

                if (scan.complete(numbered, clock.instant())) {
                    ScanSnapshot snap = scan.snapshot();
                    LOG.info("Scan {} COMPLETED: {} confirmed of {} groups, {} votes, avgConfidence={}{}",
                            scan.getScanId(), numbered.size(), groups.size(), snap.totalVotes(),
                            String.format("%.1f", snap.finalConfidenceScore()),
                            forced.isEmpty() ? "" : ", forced=" + forced);
                    SLOG.info("scan-completed", "scanId", scan.getScanId(), "confirmed", numbered.size(),
                            "groups", groups.size(), "totalVotes", snap.totalVotes(),
                            "finalConfidence", snap.finalConfidenceScore(), "forcedGroups", forced.size(),
                            "note", note);
                }
            } catch (RuntimeException e) {
                fail(scan, "internal error during finalization: " + e, e);
            } finally {
                voting.remove(scan.getScanId(), this);
                engine.close();
            }
        }
    }
}
