package com.p2pclient.core.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * TTL 이 있는 맵 캐시.
 * - 기본 TTL 30분
 * - TTL <= 0 이면 캐시 미사용(저장하지 않음)
 * - 만료된 항목은 조회 시점에 제거(별도 청소 스레드 없음)
 */
public final class ExpiringCache implements ResponseCache {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    private final Map<RequestSignature, Entry> entries = new ConcurrentHashMap<>();
    private final CacheClock clock;
    private final Duration ttl;

    public ExpiringCache() {
        this(DEFAULT_TTL, CacheClock.SYSTEM);
    }

    public ExpiringCache(Duration ttl, CacheClock clock) {
        this.ttl = (ttl == null) ? DEFAULT_TTL : ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<JsonNode> get(RequestSignature signature) {
        Entry e = entries.get(signature);
        if (e == null) return Optional.empty();
        if (e.expiresAt <= clock.nowMillis()) {
            entries.remove(signature, e);
            return Optional.empty();
        }
        return Optional.of(e.value.deepCopy());
    }

    @Override
    public void set(RequestSignature signature, JsonNode value) {
        Objects.requireNonNull(value, "value");
        if (ttl.isZero() || ttl.isNegative()) return;
        entries.put(signature, new Entry(value.deepCopy(), clock.nowMillis() + ttl.toMillis()));
    }

    @Override
    public void invalidate(RequestSignature signature) {
        entries.remove(signature);
    }

    @Override
    public void clear() { entries.clear(); }

    public Duration effectiveTtl() { return ttl; }

    private static final class Entry {
        final JsonNode value;
        final long expiresAt;
        Entry(JsonNode value, long expiresAt) { this.value = value; this.expiresAt = expiresAt; }
    }
}
