package com.p2pclient.core.error;

/**
 * P2P 오류 분류(닫힌 집합).
 * P2P_EXCEPTION 은 "알 수 없음" 폴백이고, retryable=true 인 FORBIDDEN/TIMEOUT 만 재시도 대상이다.
 */
public enum ErrorKind {
    P2P_EXCEPTION("P2P request failed", false),
    SLUG_TAKEN("Slug has already been taken", false),
    NOT_FOUND("Resource not found", false),
    UNIQUE_CONSTRAINT_VIOLATED("Unique constraint violated", false),
    ENCODING_MISMATCH("Payload is not representable in the service character set", false),
    UNKNOWN_ATTRIBUTE("Unknown attribute", false),
    INVALID_ACCESS_DEFINITION("Invalid access definition", false),
    SEARCH_ERROR("Search backend error", false),
    /** 스로틀 또는 인증 거부 */
    FORBIDDEN("Credentials refused or request throttled", true),
    /** 원격 측 타임아웃(또는 전송 타임아웃/취소) */
    TIMEOUT("Remote service timed out", true);

    private final String message;
    private final boolean retryable;

    ErrorKind(String message, boolean retryable) {
        this.message = message;
        this.retryable = retryable;
    }

    public String message() { return message; }

    public boolean isRetryable() { return retryable; }
}
