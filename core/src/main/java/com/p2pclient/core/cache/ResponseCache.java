package com.p2pclient.core.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * 응답 캐시 계약. 백엔드(메모리/무캐시/원격)는 이 세 가지 연산만 맞추면 된다.
 *
 * <ul>
 *   <li>miss 는 실패가 아니다: get 은 절대 예외를 던지지 않고 Optional.empty() 를 돌려준다.</li>
 *   <li>동시 읽기를 허용해야 하고, 같은 키 동시 쓰기는 마지막 쓰기가 이긴다.</li>
 *   <li>쓰기 요청이 같은 자원을 건드려도 자동 무효화하지 않는다(호출자가 forceUpdate 로 갱신).</li>
 * </ul>
 */
public interface ResponseCache {

    Optional<JsonNode> get(RequestSignature signature);

    void set(RequestSignature signature, JsonNode value);

    /** 선택 연산: 기본은 아무것도 하지 않는다. */
    default void invalidate(RequestSignature signature) {}

    void clear();
}
