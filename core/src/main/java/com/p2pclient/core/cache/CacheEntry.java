package com.p2pclient.core.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/** 저장 단위: 서명 + 값 + 삽입 시각 */
public record CacheEntry(RequestSignature signature, JsonNode value, Instant insertedAt) {}
