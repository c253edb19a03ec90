package com.cypherscan.core.model;

import java.time.Instant;
import java.util.List;

/** getStatus 가 돌려주는 불변 스냅샷. 진행 중인 스캔과 동시에 읽어도 안전하다. */
public record ScanSnapshot(String scanId,
                           ScanRequest.SourceType sourceType,
                           String locator,
                           ScanStatus status,
                           int progress,
                           List<Finding> findings,
                           List<Vote> votes,
                           double finalConfidenceScore,
                           int totalVotes,
                           boolean consensusReached,
                           Instant createdAt,
                           Instant completedAt,
                           String failureReason) {

    public ScanSnapshot {
        findings = List.copyOf(findings);
        votes = List.copyOf(votes);
    }

    public boolean isTerminal() { return status.isTerminal(); }
}
