package com.p2pclient.core.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/** 아무것도 저장하지 않는 캐시(기본값, 개발/테스트용). */
public final class NoCache implements ResponseCache {
    public static final NoCache INSTANCE = new NoCache();

    private NoCache() {}

    @Override public Optional<JsonNode> get(RequestSignature signature) { return Optional.empty(); }
    @Override public void set(RequestSignature signature, JsonNode value) {}
    @Override public void clear() {}
}
