package com.cypherscan.app.report;

import com.cypherscan.core.model.Finding;
import com.cypherscan.core.model.ScanSnapshot;

import java.time.Instant;
import java.util.List;

/** JSON 리포트 v1 스키마 */
public record ScanReport(String v,
                         String scanId,
                         String sourceType,
                         String locator,
                         String status,
                         int progress,
                         boolean consensusReached,
                         int totalVotes,
                         double finalConfidenceScore,
                         Instant createdAt,
                         Instant completedAt,
                         String failureReason,
                         List<FindingView> findings) {

    public static final String VERSION = "1";

    public record FindingView(String id, String category, String severity, String title, String description,
                              String file, int line, String recommendation, double confidence, String codeSnippet) {

        static FindingView of(Finding f) {
            return new FindingView(f.getId(), f.getCategory(), f.getSeverity().name(), f.getTitle(),
                    f.getDescription(), f.getFile(), f.getLine(), f.getRecommendation(),
                    f.getConfidence(), f.getCodeSnippet());
        }
    }

    public static ScanReport of(ScanSnapshot s) {
        return new ScanReport(VERSION, s.scanId(), s.sourceType().name(), s.locator(), s.status().name(),
                s.progress(), s.consensusReached(), s.totalVotes(), s.finalConfidenceScore(),
                s.createdAt(), s.completedAt(), s.failureReason(),
                s.findings().stream().map(FindingView::of).toList());
    }
}
