package com.cypherscan.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * 한 analyzer 가 하나의 finding 그룹에 던지는 표.
 * 같은 analyzer 가 같은 그룹에 다시 투표하면 이전 표를 대체한다.
 */
public record Vote(String analyzerId,
                   String groupKey,
                   VoteDecision decision,
                   double confidence,
                   String rationale,
                   Instant timestamp) {

    public Vote {
        Objects.requireNonNull(analyzerId, "analyzerId");
        Objects.requireNonNull(groupKey, "groupKey");
        Objects.requireNonNull(decision, "decision");
        confidence = Finding.clamp(confidence);
        timestamp = (timestamp == null ? Instant.now() : timestamp);
    }

    public static Vote of(String analyzerId, String groupKey, VoteDecision decision, double confidence) {
        return new Vote(analyzerId, groupKey, decision, confidence, null, null);
    }
}
