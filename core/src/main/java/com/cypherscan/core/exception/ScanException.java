package com.cypherscan.core.exception;

/** 스캔 코어 예외 루트 (unchecked). */
public class ScanException extends RuntimeException {
    public ScanException(String message) { super(message); }
    public ScanException(String message, Throwable cause) { super(message, cause); }
}
