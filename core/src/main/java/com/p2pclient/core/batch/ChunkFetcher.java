package com.p2pclient.core.batch;

import java.util.List;
import java.util.Map;

/**
 * 청크 하나(최대 25개 id)를 한 번의 디스패처 호출로 가져온다.
 * 결과 맵에 없는 id 는 병합 시 null 자리로 남는다.
 */
@FunctionalInterface
public interface ChunkFetcher<I, R> {
    Map<I, R> fetch(List<I> chunk);
}
