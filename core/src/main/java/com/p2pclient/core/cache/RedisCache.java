package com.p2pclient.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.p2pclient.core.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Redis 백엔드. 값은 Jackson 직렬화 문자열로 "prefix:서명키" 에 저장한다.
 * clear() 는 prefix 아래 키만 지운다(같은 Redis 를 쓰는 다른 앱은 건드리지 않음).
 *
 * 조회/저장 중 Redis 오류는 miss/미저장으로 낮추고 경고만 남긴다. 캐시 장애로 API 호출이 실패하지 않는다.
 */
public final class RedisCache implements ResponseCache, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RedisCache.class);

    public static final String DEFAULT_PREFIX = "p2p";

    /** 캐시가 쓰는 Redis 명령만 모은 창구. 운영은 JedisCommands, 테스트는 메모리 구현. */
    public interface Commands extends AutoCloseable {
        String get(String key);

        /** seconds <= 0 이면 만료 없음 */
        void set(String key, String value, long seconds);

        void del(List<String> keys);

        /** glob 패턴에 맞는 키 전부(SCAN) */
        List<String> keys(String pattern);

        @Override
        default void close() {}
    }

    private final Commands redis;
    private final String prefix;
    private final Duration ttl;

    /** ttl 이 null 이거나 0 이면 만료 없음 */
    public RedisCache(Commands redis, String prefix, Duration ttl) {
        this.redis = Objects.requireNonNull(redis, "redis");
        Objects.requireNonNull(prefix, "prefix");
        if (prefix.isBlank()) throw new IllegalArgumentException("prefix must not be blank");
        this.prefix = prefix;
        this.ttl = (ttl == null || ttl.isNegative()) ? Duration.ZERO : ttl;
    }

    public static RedisCache connect(String host, int port, String prefix, Duration ttl) {
        return new RedisCache(new JedisCommands(host, port), prefix, ttl);
    }

    @Override
    public Optional<JsonNode> get(RequestSignature signature) {
        String raw;
        try {
            raw = redis.get(keyOf(signature));
        } catch (RuntimeException e) {
            LOG.warn("Redis get failed for {}, treating as miss: {}", signature, e.toString());
            return Optional.empty();
        }
        if (raw == null) return Optional.empty();
        JsonNode v = JsonSupport.tryParse(raw);
        if (v == null) {
            LOG.warn("Unreadable cache value under {}, ignoring", keyOf(signature));
            return Optional.empty();
        }
        return Optional.of(v);
    }

    @Override
    public void set(RequestSignature signature, JsonNode value) {
        Objects.requireNonNull(value, "value");
        try {
            redis.set(keyOf(signature), JsonSupport.write(value), ttl.getSeconds());
        } catch (RuntimeException e) {
            LOG.warn("Redis set failed for {}, value not cached: {}", signature, e.toString());
        }
    }

    @Override
    public void invalidate(RequestSignature signature) {
        redis.del(List.of(keyOf(signature)));
    }

    @Override
    public void clear() {
        List<String> keys = redis.keys(globEscape(prefix) + ":*");
        if (!keys.isEmpty()) redis.del(keys);
    }

    @Override
    public void close() {
        redis.close();
    }

    public String prefix() { return prefix; }

    public Duration ttl() { return ttl; }

    String keyOf(RequestSignature signature) {
        return prefix + ":" + signature.key();
    }

    /** SCAN MATCH 특수문자 이스케이프 */
    static String globEscape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') sb.append('\\');
            sb.append(c);
        }
        return sb.toString();
    }
}
