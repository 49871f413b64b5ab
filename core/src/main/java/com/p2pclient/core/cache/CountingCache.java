package com.p2pclient.core.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/** ResponseCache 를 감싸 조회/적중 횟수를 집계하는 얇은 데코레이터. */
public final class CountingCache implements ResponseCache {
    private final ResponseCache delegate;
    private final AtomicLong gets = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();

    public CountingCache(ResponseCache delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public Optional<JsonNode> get(RequestSignature signature) {
        gets.incrementAndGet();
        Optional<JsonNode> v = delegate.get(signature);
        if (v.isPresent()) hits.incrementAndGet();
        return v;
    }

    @Override
    public void set(RequestSignature signature, JsonNode value) {
        sets.incrementAndGet();
        delegate.set(signature, value);
    }

    @Override
    public void invalidate(RequestSignature signature) { delegate.invalidate(signature); }

    @Override
    public void clear() { delegate.clear(); }

    public CacheStats stats() { return new CacheStats(gets.get(), hits.get(), sets.get()); }

    /** 스냅샷 */
    public record CacheStats(long gets, long hits, long sets) {
        public long misses() { return gets - hits; }
        public double hitRatio() { return gets == 0 ? 0.0 : (double) hits / gets; }
    }
}
