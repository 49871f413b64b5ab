package com.p2pclient.core.model;

import com.p2pclient.core.cache.NoCache;
import com.p2pclient.core.cache.ResponseCache;
import com.p2pclient.core.error.ErrorRuleTable;
import com.p2pclient.core.http.DefaultRetryPolicy;
import com.p2pclient.core.http.RetryPolicy;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * P2P 연결 설정. 생성 후 불변이며 여러 스레드가 읽기 전용으로 공유한다.
 * 캐시 인스턴스만은 공유 가변 객체다(동시 접근은 캐시 구현이 책임).
 */
public final class ConnectionConfig {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
    public static final String DEFAULT_USER_AGENT = "p2p-java";

    private final String baseUrl;
    private final String authToken;
    private final boolean debug;
    private final String secondaryUrl;
    private final ResponseCache cache;
    private final boolean preserveEmbeddedTags;
    private final Duration timeout;
    private final RetryPolicy retryPolicy;
    private final Charset charset;
    private final boolean encodingCheck;
    private final ErrorRuleTable errorRules;
    private final String userAgent;
    private final Map<String, Object> defaultContentItemQuery;

    private ConnectionConfig(Builder b) {
        this.baseUrl = stripSlash(b.baseUrl);
        this.authToken = b.authToken;
        this.debug = b.debug;
        this.secondaryUrl = (b.secondaryUrl == null || b.secondaryUrl.isBlank()) ? null : stripSlash(b.secondaryUrl);
        this.cache = b.cache;
        this.preserveEmbeddedTags = b.preserveEmbeddedTags;
        this.timeout = b.timeout;
        this.retryPolicy = b.retryPolicy;
        this.charset = b.charset;
        this.encodingCheck = b.encodingCheck;
        this.errorRules = b.errorRules;
        this.userAgent = b.userAgent;
        this.defaultContentItemQuery = Collections.unmodifiableMap(new LinkedHashMap<>(b.defaultContentItemQuery));
    }

    // ---------- getters ----------
    public String getBaseUrl() { return baseUrl; }
    public String getAuthToken() { return authToken; }
    public boolean isDebug() { return debug; }
    /** 보조(Storyreport 계열) 서비스 URL. 없으면 null */
    public String getSecondaryUrl() { return secondaryUrl; }
    public ResponseCache getCache() { return cache; }
    public boolean isPreserveEmbeddedTags() { return preserveEmbeddedTags; }
    public Duration getTimeout() { return timeout; }
    public RetryPolicy getRetryPolicy() { return retryPolicy; }
    public Charset getCharset() { return charset; }
    public boolean isEncodingCheck() { return encodingCheck; }
    public ErrorRuleTable getErrorRules() { return errorRules; }
    public String getUserAgent() { return userAgent; }
    public Map<String, Object> getDefaultContentItemQuery() { return defaultContentItemQuery; }

    /** 토큰은 마스킹 */
    @Override public String toString() {
        return "ConnectionConfig{url=" + baseUrl + ", debug=" + debug + ", secondaryUrl=" + secondaryUrl
                + ", cache=" + cache.getClass().getSimpleName() + ", timeout=" + timeout
                + ", retry=" + retryPolicy + ", charset=" + charset.name() + "}";
    }

    public Builder toBuilder() {
        return new Builder()
                .baseUrl(baseUrl).authToken(authToken).debug(debug).secondaryUrl(secondaryUrl)
                .cache(cache).preserveEmbeddedTags(preserveEmbeddedTags).timeout(timeout)
                .retryPolicy(retryPolicy).charset(charset).encodingCheck(encodingCheck)
                .errorRules(errorRules).userAgent(userAgent).defaultContentItemQuery(defaultContentItemQuery);
    }

    public static Builder builder() { return new Builder(); }

    public static Builder builder(String baseUrl, String authToken) {
        return new Builder().baseUrl(baseUrl).authToken(authToken);
    }

    public static final class Builder {
        private String baseUrl;
        private String authToken;
        private boolean debug;
        private String secondaryUrl;
        private ResponseCache cache = NoCache.INSTANCE;
        private boolean preserveEmbeddedTags = true;
        private Duration timeout = DEFAULT_TIMEOUT;
        private RetryPolicy retryPolicy = new DefaultRetryPolicy();
        private Charset charset = StandardCharsets.UTF_8;
        private boolean encodingCheck = true;
        private ErrorRuleTable errorRules = ErrorRuleTable.defaults();
        private String userAgent = DEFAULT_USER_AGENT;
        private Map<String, Object> defaultContentItemQuery = Map.of("include", List.of("web_url"));

        private Builder() {}

        public Builder baseUrl(String v) { this.baseUrl = v; return this; }
        public Builder authToken(String v) { this.authToken = v; return this; }
        public Builder debug(boolean v) { this.debug = v; return this; }
        public Builder secondaryUrl(String v) { this.secondaryUrl = v; return this; }
        public Builder cache(ResponseCache v) { this.cache = (v == null) ? NoCache.INSTANCE : v; return this; }
        public Builder preserveEmbeddedTags(boolean v) { this.preserveEmbeddedTags = v; return this; }
        public Builder timeout(Duration v) { this.timeout = v; return this; }
        public Builder retryPolicy(RetryPolicy v) { this.retryPolicy = v; return this; }
        public Builder charset(Charset v) { this.charset = v; return this; }
        public Builder encodingCheck(boolean v) { this.encodingCheck = v; return this; }
        public Builder errorRules(ErrorRuleTable v) { this.errorRules = v; return this; }
        public Builder userAgent(String v) { this.userAgent = v; return this; }
        public Builder defaultContentItemQuery(Map<String, ?> v) {
            this.defaultContentItemQuery = (v == null) ? Map.of() : new LinkedHashMap<>(v);
            return this;
        }

        public ConnectionConfig build() {
            validate();
            return new ConnectionConfig(this);
        }

        /** 필수값/형식 검증 */
        private void validate() {
            if (baseUrl == null || baseUrl.isBlank()) {
                throw new IllegalArgumentException("baseUrl must be set");
            }
            requireHttpUrl("baseUrl", baseUrl);
            if (secondaryUrl != null && !secondaryUrl.isBlank()) requireHttpUrl("secondaryUrl", secondaryUrl);
            if (authToken == null || authToken.isBlank()) {
                throw new IllegalArgumentException("authToken must be set");
            }
            Objects.requireNonNull(retryPolicy, "retryPolicy");
            Objects.requireNonNull(charset, "charset");
            Objects.requireNonNull(errorRules, "errorRules");
            Objects.requireNonNull(userAgent, "userAgent");
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
        }

        private static void requireHttpUrl(String name, String v) {
            try {
                URI u = URI.create(v.trim());
                String scheme = (u.getScheme() == null) ? "" : u.getScheme().toLowerCase();
                if (!scheme.equals("http") && !scheme.equals("https")) {
                    throw new IllegalArgumentException(name + " must be http/https: " + v);
                }
                if (u.getHost() == null) throw new IllegalArgumentException(name + " must have a host: " + v);
            } catch (IllegalArgumentException e) {
                if (e.getMessage() != null && e.getMessage().startsWith(name)) throw e;
                throw new IllegalArgumentException(name + " is not a valid URI: " + v, e);
            }
        }
    }

    private static String stripSlash(String url) {
        String t = url.trim();
        while (t.endsWith("/")) t = t.substring(0, t.length() - 1);
        return t;
    }
}
