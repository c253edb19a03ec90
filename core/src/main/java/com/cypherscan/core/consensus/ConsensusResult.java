package com.cypherscan.core.consensus;

import com.cypherscan.core.model.VoteDecision;

import java.util.Map;

/**
 * @param confidenceScore 승리한 결정 표들의 평균 신뢰도 × (일치 표 / 전체 표), 반올림 0..100
 * @param breakdown       결정별 표 수 (세 결정 모두 키로 존재)
 */
public record ConsensusResult(boolean reached,
                              VoteDecision decision,
                              int confidenceScore,
                              Map<VoteDecision, Integer> breakdown,
                              int totalVotes) {

    public ConsensusResult {
        breakdown = Map.copyOf(breakdown);
    }

    public boolean isConfirmed() {
        return reached && decision == VoteDecision.CONFIRMED;
    }
}
