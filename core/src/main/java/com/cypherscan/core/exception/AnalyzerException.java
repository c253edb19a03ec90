package com.cypherscan.core.exception;

/** 단일 analyzer 실패. dispatcher 가 흡수하고 빈 기여로 처리한다. */
public class AnalyzerException extends ScanException {
    private final String analyzerId;

    public AnalyzerException(String analyzerId, String message, Throwable cause) {
        super("[" + analyzerId + "] " + message, cause);
        this.analyzerId = analyzerId;
    }

    public String getAnalyzerId() { return analyzerId; }
}
