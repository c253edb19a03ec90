package com.cypherscan.core.model;

import java.util.Locale;

/** 심각도. 선언 순서가 곧 우선순위(CRITICAL 이 가장 높음). */
public enum Severity {
    CRITICAL(5), HIGH(4), MEDIUM(3), LOW(2), INFO(1);

    private final int rank;

    Severity(int rank) { this.rank = rank; }

    public int rank() { return rank; }

    public boolean isAtLeast(Severity other) {
        return other == null || this.rank >= other.rank;
    }

    /** 대소문자 무시. 모르는 값이면 INFO. */
    public static Severity parse(String s) {
        if (s == null || s.isBlank()) return INFO;
        try {
            return Severity.valueOf(s.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return INFO;
        }
    }
}
