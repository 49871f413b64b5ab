package com.p2pclient.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.p2pclient.core.util.JsonSupport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 디스패처 입력 한 건: 동사 + 경로 + 쿼리 + (선택) 본문.
 *
 * read 여부는 기본적으로 동사에서 결정되지만(GET 만 읽기), multi 조회처럼
 * POST 로 보내는 읽기는 read(true) 로 명시한다. 읽기만 캐시를 거친다.
 */
public final class RequestSpec {
    private final HttpMethod method;
    private final String path;
    private final Map<String, Object> query;
    private final JsonNode body;
    private final boolean read;
    private final boolean forceUpdate;
    private final boolean skipCache;
    private final boolean secondary;

    private RequestSpec(Builder b) {
        this.method = b.method;
        this.path = normalizePath(b.path);
        this.query = Collections.unmodifiableMap(new LinkedHashMap<>(b.query));
        this.body = b.body;
        this.read = (b.read != null) ? b.read : b.method.isReadByDefault();
        this.forceUpdate = b.forceUpdate;
        this.skipCache = b.skipCache;
        this.secondary = b.secondary;
    }

    public HttpMethod getMethod() { return method; }
    public String getPath() { return path; }
    public Map<String, Object> getQuery() { return query; }
    public JsonNode getBody() { return body; }
    public boolean isRead() { return read; }
    public boolean isForceUpdate() { return forceUpdate; }
    public boolean isSkipCache() { return skipCache; }
    /** true 면 보조 서비스 URL 로 보낸다 */
    public boolean isSecondary() { return secondary; }

    /** 캐시 조회/저장 대상인가 */
    public boolean isCacheable() { return read && !skipCache; }

    /** 로그/에러 메시지용 "GET /path" */
    public String describe() { return method + " " + path; }

    @Override public String toString() { return "RequestSpec{" + describe() + ", query=" + query + "}"; }

    /** 중복 슬래시와 끝 슬래시(루트 제외) 제거. 전송 URL 과 캐시 키가 같은 경로를 쓴다. */
    public static String normalizePath(String path) {
        String p = path.trim().replaceAll("/{2,}", "/");
        if (!p.startsWith("/")) p = "/" + p;
        if (p.length() > 1 && p.endsWith("/")) p = p.substring(0, p.length() - 1);
        return p;
    }

    // ----- 빌더 -----
    public static Builder get(String path) { return new Builder(HttpMethod.GET, path); }
    public static Builder post(String path) { return new Builder(HttpMethod.POST, path); }
    public static Builder put(String path) { return new Builder(HttpMethod.PUT, path); }
    public static Builder delete(String path) { return new Builder(HttpMethod.DELETE, path); }
    public static Builder of(HttpMethod method, String path) { return new Builder(method, path); }

    public static final class Builder {
        private final HttpMethod method;
        private final String path;
        private final Map<String, Object> query = new LinkedHashMap<>();
        private JsonNode body;
        private Boolean read;
        private boolean forceUpdate;
        private boolean skipCache;
        private boolean secondary;

        private Builder(HttpMethod method, String path) {
            this.method = Objects.requireNonNull(method, "method");
            this.path = Objects.requireNonNull(path, "path");
        }

        public Builder query(Map<String, ?> q) { if (q != null) this.query.putAll(q); return this; }
        public Builder param(String name, Object value) { this.query.put(name, value); return this; }
        public Builder body(Object body) { this.body = (body == null) ? null : JsonSupport.toTree(body); return this; }
        public Builder read(boolean read) { this.read = read; return this; }
        public Builder forceUpdate(boolean forceUpdate) { this.forceUpdate = forceUpdate; return this; }
        public Builder skipCache(boolean skipCache) { this.skipCache = skipCache; return this; }
        public Builder secondary(boolean secondary) { this.secondary = secondary; return this; }

        public RequestSpec build() {
            if (!path.startsWith("/")) throw new IllegalArgumentException("path must start with '/': " + path);
            return new RequestSpec(this);
        }
    }
}
