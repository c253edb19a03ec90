package com.cypherscan.core.consensus;

import com.cypherscan.core.model.ScanConfig;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * 합의 파라미터.
 * minimumVotes 는 합의 검사를 시도할지 여부만 가른다. 도달 여부는 quorum 으로만 결정.
 */
public record ConsensusConfig(double quorumThreshold,
                              int minimumVotes,
                              Duration votingTimeout,
                              boolean weightingEnabled,
                              Map<String, Double> analyzerWeights) {

    public static final double DEFAULT_QUORUM = 0.6;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(5);

    public ConsensusConfig {
        if (!(quorumThreshold > 0 && quorumThreshold <= 1))
            throw new IllegalArgumentException("quorumThreshold must be in (0, 1]");
        if (minimumVotes < 1) throw new IllegalArgumentException("minimumVotes must be >= 1");
        Objects.requireNonNull(votingTimeout, "votingTimeout");
        if (votingTimeout.isZero() || votingTimeout.isNegative())
            throw new IllegalArgumentException("votingTimeout must be > 0");
        analyzerWeights = (analyzerWeights == null ? Map.of() : Map.copyOf(analyzerWeights));
    }

    /** 기본값 + minimumVotes = max(1, floor(n/2)) */
    public static ConsensusConfig forAnalyzerCount(int analyzerCount) {
        return new ConsensusConfig(DEFAULT_QUORUM, Math.max(1, analyzerCount / 2), DEFAULT_TIMEOUT, false, Map.of());
    }

    public static ConsensusConfig from(ScanConfig cfg, int analyzerCount) {
        return new ConsensusConfig(
                cfg.getQuorumThreshold(),
                cfg.effectiveMinimumVotes(analyzerCount),
                cfg.getVotingTimeout(),
                cfg.isWeightingEnabled(),
                cfg.getAnalyzerWeights());
    }

    public double weightOf(String analyzerId) {
        Double w = analyzerWeights.get(analyzerId);
        return w == null ? 1.0 : w;
    }

    public ConsensusConfig withVotingTimeout(Duration timeout) {
        return new ConsensusConfig(quorumThreshold, minimumVotes, timeout, weightingEnabled, analyzerWeights);
    }
}
