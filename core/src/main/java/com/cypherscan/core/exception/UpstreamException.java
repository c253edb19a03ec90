package com.cypherscan.core.exception;

/** 원격 소스 조회 실패. 가능하면 provider 의 HTTP status 를 함께 싣는다(-1 = 네트워크 오류/알 수 없음). */
public class UpstreamException extends ScanException {
    private final int status;

    public UpstreamException(String message, int status) {
        super(message);
        this.status = status;
    }

    public UpstreamException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() { return status; }
}
