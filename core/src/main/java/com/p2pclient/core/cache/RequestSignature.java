package com.p2pclient.core.cache;

import com.p2pclient.core.model.HttpMethod;
import com.p2pclient.core.model.RequestSpec;
import com.p2pclient.core.util.JsonSupport;
import com.p2pclient.core.util.QueryStrings;

import java.util.Map;
import java.util.Objects;

/**
 * 캐시 키: 동사 + 정규화된 경로 + 정렬된 쿼리(+ 읽기용 본문의 키 정렬 직렬화).
 * 파라미터 순서만 다른 두 요청은 같은 서명을 갖는다.
 * 쿼리 이름/값은 URL 인코딩된 채로 들어가므로 값 안의 '&', '=', ' #' 이 구분자와 섞이지 않는다.
 */
public final class RequestSignature {
    private final HttpMethod method;
    private final String path;
    private final String key;

    private RequestSignature(HttpMethod method, String path, String key) {
        this.method = method;
        this.path = path;
        this.key = key;
    }

    public static RequestSignature of(RequestSpec spec) {
        Objects.requireNonNull(spec, "spec");
        String body = (spec.getBody() == null) ? null : JsonSupport.canonical(spec.getBody());
        return of(spec.getMethod(), spec.getPath(), spec.getQuery(), body, spec.isSecondary());
    }

    public static RequestSignature of(HttpMethod method, String path, Map<String, ?> query) {
        return of(method, path, query, null, false);
    }

    private static RequestSignature of(HttpMethod method, String path, Map<String, ?> query,
                                       String canonicalBody, boolean secondary) {
        Objects.requireNonNull(method, "method");
        String p = RequestSpec.normalizePath(Objects.requireNonNull(path, "path"));
        StringBuilder sb = new StringBuilder(64);
        if (secondary) sb.append('~');
        sb.append(method.name()).append(' ').append(p);
        String qs = QueryStrings.canonical(query);
        if (!qs.isEmpty()) sb.append('?').append(qs);
        if (canonicalBody != null) sb.append(" #").append(canonicalBody);
        return new RequestSignature(method, p, sb.toString());
    }

    public HttpMethod method() { return method; }
    public String path() { return path; }
    public String key() { return key; }

    @Override public boolean equals(Object o) {
        return this == o || (o instanceof RequestSignature other && key.equals(other.key));
    }

    @Override public int hashCode() { return key.hashCode(); }

    @Override public String toString() { return key; }
}
