package com.cypherscan.core.consensus;

import com.cypherscan.core.model.Vote;
import com.cypherscan.core.model.VoteDecision;
import com.cypherscan.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 그룹 단위 투표 집계 + quorum 판정 + 타임아웃 강제 종결.
 * 합의 계산 자체는 순수 함수({@link #computeConsensus})이고, 상태는 그룹별 표/결정/타이머뿐이다.
 */
public final class ConsensusEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ConsensusEngine.class);

    private final ConsensusConfig config;
    private final ScheduledExecutorService timer;
    private final boolean ownsTimer;

    private final Map<String, Map<String, Vote>> votesByGroup = new ConcurrentHashMap<>();
    private final Map<String, ConsensusResult> decisions = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> timeouts = new ConcurrentHashMap<>();

    public ConsensusEngine(ConsensusConfig config) {
        this(config, Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("consensus-timer")), true);
    }

    public ConsensusEngine(ConsensusConfig config, ScheduledExecutorService timer) {
        this(config, timer, false);
    }

    private ConsensusEngine(ConsensusConfig config, ScheduledExecutorService timer, boolean ownsTimer) {
        this.config = Objects.requireNonNull(config, "config");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.ownsTimer = ownsTimer;
    }

    public ConsensusConfig config() { return config; }

    /* ===== 투표 ===== */

    /**
     * 같은 analyzer 의 이전 표는 대체. 표 수가 minimumVotes 이상이면 그룹의 전체 표로 합의 검사.
     * @return 현재 표 전체가 합의에 도달했으면 그 결과
     */
    public Optional<ConsensusResult> submitVote(Vote vote) {
        Objects.requireNonNull(vote, "vote");
        return submitVotes(List.of(vote));
    }

    /**
     * 한 그룹의 표를 모두 기록한 뒤 검사는 한 번만 한다.
     * 결정은 항상 기록된 표 전체로 다시 계산되므로, 도달하지 못하면 이전 결정도 철회된다.
     */
    public Optional<ConsensusResult> submitVotes(Collection<Vote> votes) {
        Objects.requireNonNull(votes, "votes");
        if (votes.isEmpty()) return Optional.empty();
        String group = votes.iterator().next().groupKey();
        for (Vote v : votes) {
            Objects.requireNonNull(v, "vote");
            if (!group.equals(v.groupKey())) {
                throw new IllegalArgumentException("votes span several groups: " + group + ", " + v.groupKey());
            }
        }
        Map<String, Vote> bucket = votesByGroup.computeIfAbsent(group, g -> new LinkedHashMap<>());

        ConsensusResult r;
        synchronized (bucket) {
            for (Vote v : votes) bucket.put(v.analyzerId(), v);
            if (bucket.size() < config.minimumVotes()) return Optional.empty();
            r = computeConsensus(bucket.values());
            if (!r.reached()) {
                if (decisions.remove(group) != null) {
                    LOG.debug("Consensus withdrawn for {} ({} votes)", group, r.totalVotes());
                }
                return Optional.empty();
            }
            decisions.put(group, r);
        }

        cancelTimeout(group);
        LOG.debug("Consensus reached for {}: {} (score={}, votes={})", group, r.decision(), r.confidenceScore(), r.totalVotes());
        return Optional.of(r);
    }

    /**
     * 순수 합의 계산. 입력 순서와 무관하게 같은 결과.
     *  - 표 0개: UNCERTAIN / 미도달
     *  - confirmed 비율 ≥ quorum → CONFIRMED, 아니면 rejected 비율 ≥ quorum → REJECTED, 아니면 UNCERTAIN
     *  - 점수 = round(일치 표 평균 신뢰도 × 일치 표 / 전체 표)
     */
    public ConsensusResult computeConsensus(Collection<Vote> votes) {
        Map<VoteDecision, Integer> breakdown = new EnumMap<>(VoteDecision.class);
        for (VoteDecision d : VoteDecision.values()) breakdown.put(d, 0);

        if (votes == null || votes.isEmpty()) {
            return new ConsensusResult(false, VoteDecision.UNCERTAIN, 0, breakdown, 0);
        }

        // 합산 순서 고정 (부동소수 합의 순서 의존 제거)
        List<Vote> sorted = new ArrayList<>(votes);
        sorted.sort(Comparator.comparing(Vote::analyzerId).thenComparing(Vote::groupKey));

        Map<VoteDecision, Double> confidenceSum = new EnumMap<>(VoteDecision.class);
        for (Vote v : sorted) {
            breakdown.merge(v.decision(), 1, Integer::sum);
            confidenceSum.merge(v.decision(), effectiveConfidence(v), Double::sum);
        }

        int total = sorted.size();
        double confirmedFraction = (double) breakdown.get(VoteDecision.CONFIRMED) / total;
        double rejectedFraction = (double) breakdown.get(VoteDecision.REJECTED) / total;

        VoteDecision decision;
        boolean reached;
        if (confirmedFraction >= config.quorumThreshold()) {
            decision = VoteDecision.CONFIRMED;
            reached = true;
        } else if (rejectedFraction >= config.quorumThreshold()) {
            decision = VoteDecision.REJECTED;
            reached = true;
        } else {
            decision = VoteDecision.UNCERTAIN;
            reached = false;
        }

        int matching = breakdown.get(decision);
        int score = 0;
        if (matching > 0) {
            double mean = confidenceSum.getOrDefault(decision, 0.0) / matching;
            score = (int) Math.round(mean * matching / total);
        }
        return new ConsensusResult(reached, decision, Math.max(0, Math.min(100, score)), breakdown, total);
    }

    private double effectiveConfidence(Vote v) {
        if (!config.weightingEnabled()) return v.confidence();
        return Math.max(0, Math.min(100, v.confidence() * config.weightOf(v.analyzerId())));
    }

    /* ===== 타임아웃 ===== */

    /**
     * 그룹에 일회성 타이머를 건다. 기존 타이머는 교체, 합의 도달 시 취소된다.
     * onTimeout 은 최대 한 번 호출된다.
     */
    public void startTimeout(String groupKey, Runnable onTimeout) {
        Objects.requireNonNull(groupKey, "groupKey");
        Objects.requireNonNull(onTimeout, "onTimeout");
        AtomicBoolean fired = new AtomicBoolean(false);
        ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
        Runnable task = () -> {
            if (!fired.compareAndSet(false, true)) return;
            synchronized (timeouts) {
                timeouts.remove(groupKey, self[0]);
            }
            LOG.info("Voting timeout for group {} ({} votes recorded)", groupKey, getVotes(groupKey).size());
            onTimeout.run();
        };
        synchronized (timeouts) {
            ScheduledFuture<?> f = timer.schedule(task, config.votingTimeout().toMillis(), TimeUnit.MILLISECONDS);
            self[0] = f;
            ScheduledFuture<?> prev = timeouts.put(groupKey, f);
            if (prev != null) prev.cancel(false);
        }
    }

    public boolean cancelTimeout(String groupKey) {
        ScheduledFuture<?> f = timeouts.remove(groupKey);
        return f != null && f.cancel(false);
    }

    /* ===== 조회 ===== */

    public List<Vote> getVotes(String groupKey) {
        Map<String, Vote> bucket = votesByGroup.get(groupKey);
        if (bucket == null) return List.of();
        synchronized (bucket) {
            return List.copyOf(bucket.values());
        }
    }

    /** 기록된 표 전체 기준의 현재 결정. 표 도착 순서와 무관하다. */
    public Optional<ConsensusResult> decision(String groupKey) {
        return Optional.ofNullable(decisions.get(groupKey));
    }

    public boolean isDecided(String groupKey) {
        return decisions.containsKey(groupKey);
    }

    /** 현재 표로 강제 판정 (도달하지 않았을 수 있음) */
    public ConsensusResult finalResult(String groupKey) {
        return computeConsensus(getVotes(groupKey));
    }

    public void clear(String groupKey) {
        cancelTimeout(groupKey);
        votesByGroup.remove(groupKey);
        decisions.remove(groupKey);
    }

    public Stats stats() {
        int pending = 0;
        int total = 0;
        for (Map.Entry<String, Map<String, Vote>> e : votesByGroup.entrySet()) {
            if (!decisions.containsKey(e.getKey())) pending++;
            synchronized (e.getValue()) {
                total += e.getValue().size();
            }
        }
        return new Stats(pending, total, timeouts.size());
    }

    public record Stats(int pendingGroups, int totalVotes, int activeTimeouts) {}

    @Override public void close() {
        for (ScheduledFuture<?> f : timeouts.values()) f.cancel(false);
        timeouts.clear();
        if (ownsTimer) timer.shutdownNow();
    }
}
