package com.p2pclient.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 한 번의 전송 시도 결과(분류 전 원본).
 * 전송 자체가 실패하면 statusCode=-1, transportError 에 원인을 담는다.
 */
public final class RawResponse {
    public static final int NO_STATUS = -1;

    private final URI url;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final long responseTimeMs;
    private final Throwable transportError;
    private final boolean timedOut;

    private RawResponse(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.responseTimeMs = b.responseTimeMs;
        this.transportError = b.transportError;
        this.timedOut = b.timedOut;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public long getResponseTimeMs() { return responseTimeMs; }
    public Throwable getTransportError() { return transportError; }
    public boolean isTimedOut() { return timedOut; }

    public boolean isTransportFailure() { return transportError != null || statusCode == NO_STATUS; }
    public boolean isSuccess() { return statusCode >= 200 && statusCode < 300; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                final List<String> vs = e.getValue();
                return (vs == null || vs.isEmpty()) ? null : vs.get(0);
            }
        }
        return null;
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private int statusCode = NO_STATUS;
        private Map<String, List<String>> headers;
        private String body;
        private long responseTimeMs;
        private Throwable transportError;
        private boolean timedOut;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder transportError(Throwable t) { this.transportError = t; return this; }
        public Builder timedOut(boolean timedOut) { this.timedOut = timedOut; return this; }

        public RawResponse build() {
            Objects.requireNonNull(url, "url");
            return new RawResponse(this);
        }
    }
}
