package com.cypherscan.core.model;

/** 스캔 상태 머신: PENDING → SCANNING → VOTING → COMPLETED, 어디서든 FAILED. */
public enum ScanStatus {
    PENDING, SCANNING, VOTING, COMPLETED, FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** 허용된 전이인지. 같은 상태로의 재진입은 허용하지 않는다. */
    public boolean canMoveTo(ScanStatus next) {
        if (next == null || isTerminal()) return false;
        if (next == FAILED) return true;
        return switch (this) {
            case PENDING -> next == SCANNING;
            case SCANNING -> next == VOTING;
            case VOTING -> next == COMPLETED;
            default -> false;
        };
    }
}
