package com.cypherscan.core.consensus;

import com.cypherscan.core.api.IAnalyzer;
import com.cypherscan.core.model.AnalyzerRun;
import com.cypherscan.core.model.Finding;
import com.cypherscan.core.model.Vote;
import com.cypherscan.core.model.VoteDecision;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * raw finding 을 (category, severity) 그룹으로 묶고, 그룹마다 analyzer 의 표를 만든다.
 *  - 그룹을 보고한 analyzer → CONFIRMED (그 그룹에서의 최고 신뢰도)
 *  - 카테고리를 다루지만 보고하지 않은 analyzer → REJECTED (rejectVoteConfidence)
 *  - 카테고리를 다루지 않는 analyzer → 기권
 *  - 실패한 analyzer → 투표 제외
 */
public final class FindingGrouper {

    private final double rejectVoteConfidence;

    public FindingGrouper(double rejectVoteConfidence) {
        if (rejectVoteConfidence < 0 || rejectVoteConfidence > 100)
            throw new IllegalArgumentException("rejectVoteConfidence must be in [0, 100]");
        this.rejectVoteConfidence = rejectVoteConfidence;
    }

    /** 그룹 순서: 심각도 높은 순 → 카테고리. 입력 순서와 무관. */
    public Map<FindingGroupKey, FindingGroup> group(List<AnalyzerRun> runs) {
        Map<FindingGroupKey, List<Finding>> acc = new TreeMap<>(FindingGroupKey.ORDER);
        for (AnalyzerRun run : runs) {
            if (run.failed()) continue;
            for (Finding f : run.findings()) {
                acc.computeIfAbsent(FindingGroupKey.of(f), k -> new ArrayList<>()).add(f);
            }
        }
        Map<FindingGroupKey, FindingGroup> out = new LinkedHashMap<>();
        acc.forEach((k, v) -> out.put(k, new FindingGroup(k, v)));
        return out;
    }

    public List<Vote> deriveVotes(FindingGroup group, List<AnalyzerRun> runs, Map<String, ? extends IAnalyzer> analyzers) {
        String key = group.key().asString();
        List<Vote> votes = new ArrayList<>();
        for (AnalyzerRun run : runs) {
            if (run.failed()) continue;
            String id = run.analyzerId();
            if (group.reportedBy(id)) {
                votes.add(new Vote(id, key, VoteDecision.CONFIRMED, group.bestConfidenceOf(id),
                        "reported " + group.key().category(), null));
            } else if (covers(analyzers.get(id), group.key().category())) {
                votes.add(new Vote(id, key, VoteDecision.REJECTED, rejectVoteConfidence,
                        "covers " + group.key().category() + " but reported nothing", null));
            }
        }
        return votes;
    }

    private static boolean covers(IAnalyzer a, String category) {
        return a == null || a.covers(category);
    }
}
