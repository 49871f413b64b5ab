package com.p2pclient.core.util;

import com.p2pclient.core.cache.ExpiringCache;
import com.p2pclient.core.cache.MapCache;
import com.p2pclient.core.cache.NoCache;
import com.p2pclient.core.cache.RedisCache;
import com.p2pclient.core.cache.ResponseCache;
import com.p2pclient.core.cache.CacheClock;
import com.p2pclient.core.error.ErrorKind;
import com.p2pclient.core.error.ErrorRule;
import com.p2pclient.core.error.ErrorRuleTable;
import com.p2pclient.core.error.P2PException;
import com.p2pclient.core.http.DefaultRetryPolicy;
import com.p2pclient.core.model.ConnectionConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * 연결 설정 로더. 전역 싱글턴 없이 ConnectionConfig 를 만들어 돌려준다.
 *
 * 환경 변수: P2P_API_URL, P2P_API_KEY, P2P_API_DEBUG, P2P_SECONDARY_URL
 *
 * 예상 YAML 키(p2p.yml):
 * url: "https://content-api.p2p.tribuneinteractive.com"
 * authToken: "..."
 * debug: false
 * secondaryUrl: "https://storyreport.example.com"
 * preserveEmbeddedTags: true
 * timeoutMs: 30000
 * retry:
 *   maxAttempts: 3
 *   baseDelayMs: 250
 * encoding:
 *   charset: "UTF-8"
 *   check: true
 * cache:
 *   type: none | map | expiring | redis
 *   ttlMinutes: 30            # expiring: 기본 30, redis: 없으면 만료 없음
 *   host: localhost           # redis 전용
 *   port: 6379
 *   prefix: p2p
 * errorRules:                 # 기본 규칙표 앞에 붙는다(먼저 검사)
 *   - status: 500             # 또는 "500-599"
 *     contains: "Deadlock found"
 *     kind: TIMEOUT
 *   - status: 422
 *     pattern: "title .* blank"
 *     kind: UNKNOWN_ATTRIBUTE
 *   - status: 418             # 단일 상태는 본문 조건 생략 가능, 범위는 contains/pattern 필수
 *     kind: FORBIDDEN
 */
public final class P2PConfigLoader {

    public static final String ENV_URL = "P2P_API_URL";
    public static final String ENV_KEY = "P2P_API_KEY";
    public static final String ENV_DEBUG = "P2P_API_DEBUG";
    public static final String ENV_SECONDARY_URL = "P2P_SECONDARY_URL";

    private P2PConfigLoader() {}

    /** 환경 변수에서 연결 설정. URL/키가 없으면 P2P_EXCEPTION */
    public static ConnectionConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        String url = env.get(ENV_URL);
        String key = env.get(ENV_KEY);
        if (url == null || url.isBlank() || key == null || key.isBlank()) {
            throw new P2PException(ErrorKind.P2P_EXCEPTION,
                    "No connection settings available. Please put settings in your environment variables "
                            + "(" + ENV_URL + ", " + ENV_KEY + ").");
        }
        return ConnectionConfig.builder(url, key)
                .debug(truthy(env.get(ENV_DEBUG)))
                .secondaryUrl(env.get(ENV_SECONDARY_URL))
                .build();
    }

    public static ConnectionConfig loadDefault() throws IOException {
        return load(Path.of("p2p.yml"));
    }

    public static ConnectionConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("p2p.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            LoaderOptions opts = new LoaderOptions();
            Yaml yaml = new Yaml(new SafeConstructor(opts));
            Object root = yaml.load(in);

            if (!(root instanceof Map<?, ?> map)) {
                throw new IllegalArgumentException("p2p.yml must be a mapping: " + yamlPath);
            }

            ConnectionConfig.Builder b = ConnectionConfig.builder();

            // 1) 평면 키
            setString(map, "url", b::baseUrl);
            setString(map, "authToken", b::authToken);
            setBoolean(map, "debug", b::debug);
            setString(map, "secondaryUrl", b::secondaryUrl);
            setBoolean(map, "preserveEmbeddedTags", b::preserveEmbeddedTags);
            setLongAsDurationMs(map, "timeoutMs", b::timeout);

            // 2) retry.*
            Map<String, Object> retry = getMap(map, "retry");
            if (retry != null) {
                int attempts = intOr(retry, "maxAttempts", DefaultRetryPolicy.DEFAULT_MAX_ATTEMPTS);
                long base = longOr(retry, "baseDelayMs", DefaultRetryPolicy.DEFAULT_BASE_MILLIS);
                b.retryPolicy(new DefaultRetryPolicy(attempts, base));
            }

            // 3) encoding.*
            Map<String, Object> enc = getMap(map, "encoding");
            if (enc != null) {
                setString(enc, "charset", s -> b.charset(Charset.forName(s.trim())));
                setBoolean(enc, "check", b::encodingCheck);
            }

            // 4) cache.*
            Map<String, Object> cache = getMap(map, "cache");
            if (cache != null) {
                b.cache(cacheOf(cache));
            }

            // 5) errorRules[]
            Object rules = map.get("errorRules");
            if (rules instanceof List<?> list) {
                ErrorRuleTable table = ErrorRuleTable.defaults();
                for (int i = list.size() - 1; i >= 0; i--) {
                    table = table.withFirst(ruleOf(list.get(i), i));
                }
                b.errorRules(table);
            }

            // 필수값 확인은 build() 안의 validate()
            return b.build();
        }
    }

    // ------------ helpers ------------
    static ResponseCache cacheOf(Map<String, Object> cache) {
        String type = String.valueOf(cache.getOrDefault("type", "none")).trim().toLowerCase(Locale.ROOT);
        switch (type) {
            case "none":
                return NoCache.INSTANCE;
            case "map":
                return new MapCache();
            case "expiring":
                long minutes = longOr(cache, "ttlMinutes", ExpiringCache.DEFAULT_TTL.toMinutes());
                return new ExpiringCache(Duration.ofMinutes(minutes), CacheClock.SYSTEM);
            case "redis":
                String host = String.valueOf(cache.getOrDefault("host", "localhost")).trim();
                int port = intOr(cache, "port", 6379);
                String prefix = String.valueOf(cache.getOrDefault("prefix", RedisCache.DEFAULT_PREFIX)).trim();
                long ttlMinutes = longOr(cache, "ttlMinutes", 0);
                return RedisCache.connect(host, port, prefix, Duration.ofMinutes(ttlMinutes));
            default:
                throw new IllegalArgumentException("unknown cache.type: " + type + " (none|map|expiring|redis)");
        }
    }

    static ErrorRule ruleOf(Object raw, int index) {
        if (!(raw instanceof Map<?, ?> m)) {
            throw new IllegalArgumentException("errorRules[" + index + "] must be a mapping");
        }
        Object kindRaw = m.get("kind");
        if (kindRaw == null) throw new IllegalArgumentException("errorRules[" + index + "].kind is required");
        ErrorKind kind;
        try {
            kind = ErrorKind.valueOf(String.valueOf(kindRaw).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("errorRules[" + index + "].kind unknown: " + kindRaw, e);
        }

        int[] range = statusRange(m.get("status"), index);
        Object contains = m.get("contains");
        Object pattern = m.get("pattern");
        if (contains != null) {
            return ErrorRule.contains(range[0], range[1], String.valueOf(contains), kind);
        }
        if (pattern != null) {
            return ErrorRule.pattern(range[0], range[1], Pattern.compile(String.valueOf(pattern)), kind);
        }
        if (range[0] == range[1]) return ErrorRule.status(range[0], kind);
        throw new IllegalArgumentException("errorRules[" + index + "] with a status range needs contains or pattern");
    }

    /** 500 | "500" | "500-599" | "5xx" */
    private static int[] statusRange(Object v, int index) {
        if (v == null) throw new IllegalArgumentException("errorRules[" + index + "].status is required");
        if (v instanceof Number n) return new int[]{n.intValue(), n.intValue()};
        String s = String.valueOf(v).trim().toLowerCase(Locale.ROOT);
        try {
            if (s.matches("[1-5]xx")) {
                int base = (s.charAt(0) - '0') * 100;
                return new int[]{base, base + 99};
            }
            int dash = s.indexOf('-');
            if (dash > 0) {
                return new int[]{Integer.parseInt(s.substring(0, dash).trim()), Integer.parseInt(s.substring(dash + 1).trim())};
            }
            int code = Integer.parseInt(s);
            return new int[]{code, code};
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("errorRules[" + index + "].status invalid: " + v, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(truthy(String.valueOf(v)));
    }

    private static void setLongAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        if (ms > 0) setter.accept(Duration.ofMillis(ms));
    }

    private static int intOr(Map<?, ?> map, String key, int dflt) {
        Object v = map.get(key);
        if (v instanceof Number n) return n.intValue();
        return (v == null) ? dflt : Integer.parseInt(String.valueOf(v).trim());
    }

    private static long longOr(Map<?, ?> map, String key, long dflt) {
        Object v = map.get(key);
        if (v instanceof Number n) return n.longValue();
        return (v == null) ? dflt : Long.parseLong(String.valueOf(v).trim());
    }

    /** "1", "true", "yes", "on" */
    static boolean truthy(String v) {
        if (v == null) return false;
        String s = v.trim().toLowerCase(Locale.ROOT);
        return s.equals("1") || s.equals("true") || s.equals("yes") || s.equals("on");
    }
}
