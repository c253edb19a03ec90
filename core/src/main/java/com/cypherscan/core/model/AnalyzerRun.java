package com.cypherscan.core.model;

import java.util.List;
import java.util.Objects;

/** analyzer 한 번 실행 결과. 실패 시 findings 는 비어 있고 error 에 사유. */
public record AnalyzerRun(String analyzerId, List<Finding> findings, boolean failed, String error, long elapsedMs) {

    public AnalyzerRun {
        Objects.requireNonNull(analyzerId, "analyzerId");
        findings = (findings == null ? List.of() : List.copyOf(findings));
    }

    public static AnalyzerRun ok(String analyzerId, List<Finding> findings, long elapsedMs) {
        return new AnalyzerRun(analyzerId, findings, false, null, elapsedMs);
    }

    public static AnalyzerRun failed(String analyzerId, String error, long elapsedMs) {
        return new AnalyzerRun(analyzerId, List.of(), true, error, elapsedMs);
    }
}
