package com.cypherscan.core.consensus;

import com.cypherscan.core.model.Finding;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/** 같은 (category, severity) 로 묶인 raw finding 들 */
public record FindingGroup(FindingGroupKey key, List<Finding> members) {

    /** 신뢰도 내림차순, 동률이면 파일/라인/analyzer 순 */
    static final Comparator<Finding> REPRESENTATIVE_ORDER =
            Comparator.comparingDouble(Finding::getConfidence).reversed()
                    .thenComparing(f -> nullToEmpty(f.getFile()))
                    .thenComparingInt(Finding::getLine)
                    .thenComparing(f -> nullToEmpty(f.getAnalyzerId()))
                    .thenComparing(f -> nullToEmpty(f.getId()));

    public FindingGroup {
        Objects.requireNonNull(key, "key");
        members = List.copyOf(members);
        if (members.isEmpty()) throw new IllegalArgumentException("group must have at least one finding");
    }

    public Finding representative() {
        return members.stream().min(REPRESENTATIVE_ORDER).orElseThrow();
    }

    public boolean reportedBy(String analyzerId) {
        return members.stream().anyMatch(f -> analyzerId.equals(f.getAnalyzerId()));
    }

    public double bestConfidenceOf(String analyzerId) {
        return members.stream()
                .filter(f -> analyzerId.equals(f.getAnalyzerId()))
                .mapToDouble(Finding::getConfidence)
                .max().orElse(0);
    }

    private static String nullToEmpty(String s) { return s == null ? "" : s; }
}
