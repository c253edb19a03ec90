package com.cypherscan.core.exception;

/** 잘못된 요청/설정. submit 시점에 동기적으로 던져지며 스캔은 생성되지 않는다. */
public class ValidationException extends ScanException {
    public ValidationException(String message) { super(message); }
}
