package com.p2pclient.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.p2pclient.core.model.RequestSpec;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 내 맵 캐시. 만료 없음.
 * - 저장/조회 모두 깊은 복사: 호출자가 돌려받은 트리를 고쳐도 캐시는 그대로
 * - ConcurrentHashMap: 동시 읽기 허용, 같은 키는 마지막 쓰기 우선
 */
public class MapCache implements ResponseCache {

    private final Map<RequestSignature, CacheEntry> entries = new ConcurrentHashMap<>();
    private final CacheClock clock;

    public MapCache() {
        this(CacheClock.SYSTEM);
    }

    public MapCache(CacheClock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Optional<JsonNode> get(RequestSignature signature) {
        CacheEntry e = entries.get(signature);
        return (e == null) ? Optional.empty() : Optional.of(e.value().deepCopy());
    }

    @Override
    public void set(RequestSignature signature, JsonNode value) {
        Objects.requireNonNull(signature, "signature");
        Objects.requireNonNull(value, "value");
        entries.put(signature, new CacheEntry(signature, value.deepCopy(), Instant.ofEpochMilli(clock.nowMillis())));
    }

    @Override
    public void invalidate(RequestSignature signature) {
        entries.remove(signature);
    }

    /** 경로가 같은 모든 항목(쿼리/동사 무관)을 지운다. 지운 개수 반환. */
    public int invalidatePath(String path) {
        String p = RequestSpec.normalizePath(Objects.requireNonNull(path, "path"));
        int before = entries.size();
        entries.keySet().removeIf(sig -> sig.path().equals(p));
        return Math.max(0, before - entries.size());
    }

    /** 디버그/테스트용: 저장 시각 포함 원본 항목 */
    public Optional<CacheEntry> entry(RequestSignature signature) {
        return Optional.ofNullable(entries.get(signature));
    }

    public int size() { return entries.size(); }

    @Override
    public void clear() { entries.clear(); }
}
