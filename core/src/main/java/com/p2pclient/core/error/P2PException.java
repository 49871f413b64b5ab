package com.p2pclient.core.error;

import com.p2pclient.core.model.HttpMethod;

import java.time.Duration;
import java.util.Objects;

/**
 * 모든 P2P 실패의 단일 예외 타입. 구체 종류는 {@link #getKind()} 태그로 구분한다.
 *
 * <pre>{@code
 * try {
 *     client.getContentItem("chi-na-lorem-a", null, false);
 * } catch (P2PException e) {
 *     if (e.getKind() == ErrorKind.NOT_FOUND) { ... }
 *     else throw e;
 * }
 * }</pre>
 *
 * 상태 코드/본문은 진단용으로 그대로 보존된다(전송 실패면 status=-1, body="").
 */
public class P2PException extends RuntimeException {
    private final ErrorKind kind;
    private final int statusCode;
    private final String body;
    private final HttpMethod method;
    private final String path;
    private final Duration retryAfter;

    public P2PException(ErrorKind kind, String message) {
        this(kind, message, null, -1, "", null, null, null);
    }

    public P2PException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, -1, "", null, null, null);
    }

    P2PException(ErrorKind kind, String message, Throwable cause, int statusCode, String body,
                 HttpMethod method, String path, Duration retryAfter) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.statusCode = statusCode;
        this.body = (body == null) ? "" : body;
        this.method = method;
        this.path = path;
        this.retryAfter = retryAfter;
    }

    public ErrorKind getKind() { return kind; }
    public boolean isRetryable() { return kind.isRetryable(); }
    public boolean is(ErrorKind k) { return kind == k; }

    /** HTTP 상태. 전송 실패/사전 검사 실패면 -1 */
    public int getStatusCode() { return statusCode; }
    public String getBody() { return body; }
    public HttpMethod getMethod() { return method; }
    public String getPath() { return path; }

    /** 서버가 Retry-After 를 줬으면 그 값(초 단위 헤더만), 아니면 null */
    public Duration getRetryAfter() { return retryAfter; }
}
