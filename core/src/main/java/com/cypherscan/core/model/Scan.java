package com.cypherscan.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 스캔 1건의 가변 aggregate root. ScanOrchestrator 만 변경하고, 외부에는 {@link #snapshot()} 만 노출한다.
 * 모든 변경은 synchronized. 종료(COMPLETED/FAILED) 이후 변경 요청은 무시된다(false 반환).
 */
public final class Scan {
    private final String scanId;
    private final ScanRequest request;
    private final Instant createdAt;

    private ScanStatus status = ScanStatus.PENDING;
    private int progress = 0;
    private final List<Finding> findings = new ArrayList<>();
    private final Map<String, Vote> votes = new LinkedHashMap<>(); // analyzerId|groupKey → vote
    private double finalConfidenceScore;
    private boolean consensusReached;
    private Instant completedAt;
    private String failureReason;

    public Scan(String scanId, ScanRequest request, Instant createdAt) {
        this.scanId = Objects.requireNonNull(scanId, "scanId");
        this.request = Objects.requireNonNull(request, "request");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public String getScanId() { return scanId; }
    public ScanRequest getRequest() { return request; }

    public synchronized ScanStatus getStatus() { return status; }
    public synchronized int getProgress() { return progress; }
    public synchronized Instant getCompletedAt() { return completedAt; }

    /** 상태 전이 + 진행률 체크포인트. 허용되지 않는 전이면 false. */
    public synchronized boolean moveTo(ScanStatus next, int progressCheckpoint) {
        if (!status.canMoveTo(next)) return false;
        status = next;
        raiseProgress(progressCheckpoint);
        return true;
    }

    /** 진행률은 단조 증가. 낮은 값은 무시. */
    public synchronized void advanceProgress(int value) {
        if (status.isTerminal()) return;
        raiseProgress(value);
    }

    private void raiseProgress(int value) {
        int v = Math.max(0, Math.min(100, value));
        if (v > progress) progress = v;
    }

    /** 같은 analyzer 의 같은 그룹 표는 대체 */
    public synchronized boolean recordVote(Vote vote) {
        if (status.isTerminal()) return false;
        votes.put(vote.analyzerId() + "|" + vote.groupKey(), vote);
        return true;
    }

    public synchronized boolean recordVotes(Collection<Vote> vs) {
        if (status.isTerminal()) return false;
        for (Vote v : vs) votes.put(v.analyzerId() + "|" + v.groupKey(), v);
        return true;
    }

    public synchronized boolean complete(List<Finding> confirmed, Instant at) {
        if (!status.canMoveTo(ScanStatus.COMPLETED)) return false;
        findings.clear();
        findings.addAll(confirmed);
        finalConfidenceScore = confirmed.stream().mapToDouble(Finding::getConfidence).average().orElse(0);
        consensusReached = !confirmed.isEmpty();
        status = ScanStatus.COMPLETED;
        progress = 100;
        completedAt = at;
        return true;
    }

    /** FAILED 로 종료. 확정 finding 은 노출하지 않는다. */
    public synchronized boolean fail(String reason, Instant at) {
        if (!status.canMoveTo(ScanStatus.FAILED)) return false;
        findings.clear();
        consensusReached = false;
        finalConfidenceScore = 0;
        failureReason = (reason == null ? "unknown error" : reason);
        status = ScanStatus.FAILED;
        progress = 100;
        completedAt = at;
        return true;
    }

    public synchronized ScanSnapshot snapshot() {
        return new ScanSnapshot(
                scanId, request.getType(), request.locator(),
                status, progress,
                List.copyOf(findings), List.copyOf(votes.values()),
                finalConfidenceScore, votes.size(), consensusReached,
                createdAt, completedAt, failureReason);
    }
}
