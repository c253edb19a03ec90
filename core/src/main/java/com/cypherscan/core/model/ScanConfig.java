package com.cypherscan.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 스캔 엔진 설정 (scan.yml 매핑 대상).
 * 요청 단위 값(저장소, 토큰 등)은 ScanRequest 쪽, 여기에는 프로세스 단위 튜닝 값만 둔다.
 */
public final class ScanConfig {

    /** YAML `cache:` 섹션 */
    public static final class CacheCfg {
        /** 원격 소스 트리 캐시 TTL. 기본 10분 */
        private Duration ttl = Duration.ofMinutes(10);
        /** 최대 엔트리 수. 초과 시 접근 횟수가 가장 적은 엔트리 축출 */
        private int capacity = 10_000;
        /** 만료 엔트리 백그라운드 정리 주기. 기본 5분 */
        private Duration sweepInterval = Duration.ofMinutes(5);

        public Duration getTtl() { return ttl; }
        public CacheCfg setTtl(Duration ttl) { this.ttl = ttl; return this; }

        public int getCapacity() { return capacity; }
        public CacheCfg setCapacity(int capacity) { this.capacity = capacity; return this; }

        public Duration getSweepInterval() { return sweepInterval; }
        public CacheCfg setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; return this; }
    }

    // ---------- dispatch ----------
    private int concurrency = 4;                                 // 배치 크기 = 동시 analyzer 수
    private Duration analyzerTimeout = Duration.ofMinutes(2);    // analyzer 호출 1건 deadline
    private int pipelineThreads = 2;                             // 동시에 진행 가능한 스캔 파이프라인 수

    // ---------- consensus ----------
    private double quorumThreshold = 0.6;
    private int minimumVotes = 0;                                // 0 = analyzer 수로부터 유도
    private Duration votingTimeout = Duration.ofMinutes(5);
    private boolean weightingEnabled = false;
    private Map<String, Double> analyzerWeights = Map.of();
    private double rejectVoteConfidence = 50;                    // 커버하지만 보고 안 한 analyzer 의 REJECTED 신뢰도

    // ---------- fetch ----------
    private List<String> sourceExtensions = List.of(".sol");
    private String githubApiBase = "https://api.github.com";
    private Duration httpTimeout = Duration.ofSeconds(10);

    // ---------- retention ----------
    private Duration retention = Duration.ZERO;                  // 0 = 종료 스캔 자동 정리 안 함

    private CacheCfg cache = new CacheCfg();

    // ---------- getters ----------
    public int getConcurrency() { return concurrency; }
    public Duration getAnalyzerTimeout() { return analyzerTimeout; }
    public int getPipelineThreads() { return pipelineThreads; }
    public double getQuorumThreshold() { return quorumThreshold; }
    public int getMinimumVotes() { return minimumVotes; }
    public Duration getVotingTimeout() { return votingTimeout; }
    public boolean isWeightingEnabled() { return weightingEnabled; }
    public Map<String, Double> getAnalyzerWeights() { return analyzerWeights; }
    public double getRejectVoteConfidence() { return rejectVoteConfidence; }
    public List<String> getSourceExtensions() { return sourceExtensions; }
    public String getGithubApiBase() { return githubApiBase; }
    public Duration getHttpTimeout() { return httpTimeout; }
    public Duration getRetention() { return retention; }
    public CacheCfg getCache() { return cache; }

    // ---------- fluent setters ----------
    public ScanConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public ScanConfig setAnalyzerTimeout(Duration d) { this.analyzerTimeout = d; return this; }
    public ScanConfig setPipelineThreads(int n) { this.pipelineThreads = Math.max(1, n); return this; }
    public ScanConfig setQuorumThreshold(double q) { this.quorumThreshold = q; return this; }
    public ScanConfig setMinimumVotes(int n) { this.minimumVotes = n; return this; }
    public ScanConfig setVotingTimeout(Duration d) { this.votingTimeout = d; return this; }
    public ScanConfig setWeightingEnabled(boolean v) { this.weightingEnabled = v; return this; }
    public ScanConfig setAnalyzerWeights(Map<String, Double> weights) {
        this.analyzerWeights = (weights == null ? Map.of() : Map.copyOf(weights));
        return this;
    }
    public ScanConfig setRejectVoteConfidence(double c) { this.rejectVoteConfidence = c; return this; }

    /** 확장자는 소문자, 점(.) 접두로 정규화 */
    public ScanConfig setSourceExtensions(List<String> exts) {
        if (exts != null && !exts.isEmpty()) {
            this.sourceExtensions = exts.stream()
                    .map(e -> e.trim().toLowerCase(Locale.ROOT))
                    .filter(e -> !e.isEmpty())
                    .map(e -> e.startsWith(".") ? e : "." + e)
                    .distinct()
                    .toList();
        }
        return this;
    }
    public ScanConfig setGithubApiBase(String base) { this.githubApiBase = base; return this; }
    public ScanConfig setHttpTimeout(Duration d) { this.httpTimeout = d; return this; }
    public ScanConfig setRetention(Duration d) { this.retention = (d == null ? Duration.ZERO : d); return this; }
    public ScanConfig setCache(CacheCfg cache) { this.cache = (cache != null ? cache : new CacheCfg()); return this; }

    /** minimumVotes 가 0 이면 max(1, floor(analyzerCount/2)) */
    public int effectiveMinimumVotes(int analyzerCount) {
        if (minimumVotes > 0) return minimumVotes;
        return Math.max(1, analyzerCount / 2);
    }

    // ---------- validate ----------
    public void validate() {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        requirePositive(analyzerTimeout, "analyzerTimeout");
        if (pipelineThreads < 1) throw new IllegalArgumentException("pipelineThreads must be >= 1");

        if (!(quorumThreshold > 0 && quorumThreshold <= 1))
            throw new IllegalArgumentException("quorumThreshold must be in (0, 1]");
        if (minimumVotes < 0) throw new IllegalArgumentException("minimumVotes must be >= 0");
        requirePositive(votingTimeout, "votingTimeout");
        Objects.requireNonNull(analyzerWeights, "analyzerWeights");
        for (Map.Entry<String, Double> e : analyzerWeights.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0)
                throw new IllegalArgumentException("analyzerWeights." + e.getKey() + " must be >= 0");
        }
        if (rejectVoteConfidence < 0 || rejectVoteConfidence > 100)
            throw new IllegalArgumentException("rejectVoteConfidence must be in [0, 100]");

        Objects.requireNonNull(sourceExtensions, "sourceExtensions");
        if (sourceExtensions.isEmpty()) throw new IllegalArgumentException("sourceExtensions must not be empty");
        Objects.requireNonNull(githubApiBase, "githubApiBase");
        if (!githubApiBase.startsWith("http://") && !githubApiBase.startsWith("https://"))
            throw new IllegalArgumentException("githubApiBase must be an http(s) URL");
        requirePositive(httpTimeout, "httpTimeout");

        Objects.requireNonNull(retention, "retention");
        if (retention.isNegative()) throw new IllegalArgumentException("retention must be >= 0");

        Objects.requireNonNull(cache, "cache");
        requirePositive(cache.getTtl(), "cache.ttl");
        if (cache.getCapacity() < 1) throw new IllegalArgumentException("cache.capacity must be >= 1");
        requirePositive(cache.getSweepInterval(), "cache.sweepInterval");
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero())
            throw new IllegalArgumentException(name + " must be > 0");
    }

    public static ScanConfig defaults() { return new ScanConfig(); }
}
