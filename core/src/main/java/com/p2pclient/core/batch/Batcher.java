package com.p2pclient.core.batch;

import com.p2pclient.core.error.ErrorClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 서비스의 요청당 항목 상한(25)을 넘는 대량 조회를 청크로 나눠 보내고,
 * 입력 순서 그대로 합친다.
 *
 * <ul>
 *   <li>청크마다 디스패처 호출 1회(각자 캐시/재시도/분류를 거친다).</li>
 *   <li>청크 결과에 없는 id 는 그 위치에 null.</li>
 *   <li>어느 청크든 실패하면 배치 전체가 그 오류로 실패한다(부분 결과 없음).</li>
 *   <li>executor 가 있으면 청크를 동시에 보내지만 병합 순서와 전파되는 오류(청크 순서상 첫 실패)는 같다.</li>
 * </ul>
 */
public final class Batcher {

    private static final Logger LOG = LoggerFactory.getLogger(Batcher.class);

    /** 서비스가 한 번에 받는 최대 항목 수 */
    public static final int MAX_CHUNK = 25;

    private final int chunkSize;
    private final ExecutorService executor; // null 이면 순차

    public Batcher() { this(MAX_CHUNK, null); }

    public Batcher(int chunkSize) { this(chunkSize, null); }

    public Batcher(int chunkSize, ExecutorService executor) {
        if (chunkSize < 1 || chunkSize > MAX_CHUNK) {
            throw new IllegalArgumentException("chunkSize must be in [1," + MAX_CHUNK + "]: " + chunkSize);
        }
        this.chunkSize = chunkSize;
        this.executor = executor;
    }

    public int chunkSize() { return chunkSize; }

    /** 연속 청크로 분할(마지막 청크만 짧을 수 있음) */
    public static <T> List<List<T>> chunk(List<T> items, int size) {
        Objects.requireNonNull(items, "items");
        if (size < 1) throw new IllegalArgumentException("size must be >= 1: " + size);
        List<List<T>> out = new ArrayList<>((items.size() + size - 1) / size);
        for (int i = 0; i < items.size(); i += size) {
            out.add(Collections.unmodifiableList(new ArrayList<>(items.subList(i, Math.min(items.size(), i + size)))));
        }
        return out;
    }

    /** ids 와 같은 길이/순서의 결과. 빈 입력이면 호출 없이 빈 리스트. */
    public <I, R> List<R> fetchAll(List<I> ids, ChunkFetcher<I, R> fetcher) {
        Objects.requireNonNull(ids, "ids");
        Objects.requireNonNull(fetcher, "fetcher");
        if (ids.isEmpty()) return List.of();

        List<List<I>> chunks = chunk(ids, chunkSize);
        LOG.debug("Fetching {} id(s) in {} chunk(s) of <= {}", ids.size(), chunks.size(), chunkSize);

        List<Map<I, R>> results = (executor == null || chunks.size() == 1)
                ? fetchSequential(chunks, fetcher)
                : fetchConcurrent(chunks, fetcher);

        List<R> merged = new ArrayList<>(ids.size());
        for (int c = 0; c < chunks.size(); c++) {
            Map<I, R> got = results.get(c);
            for (I id : chunks.get(c)) {
                merged.add(got == null ? null : got.get(id));
            }
        }
        return merged;
    }

    private <I, R> List<Map<I, R>> fetchSequential(List<List<I>> chunks, ChunkFetcher<I, R> fetcher) {
        List<Map<I, R>> out = new ArrayList<>(chunks.size());
        for (List<I> c : chunks) out.add(fetcher.fetch(c));
        return out;
    }

    private <I, R> List<Map<I, R>> fetchConcurrent(List<List<I>> chunks, ChunkFetcher<I, R> fetcher) {
        List<Future<Map<I, R>>> futures = new ArrayList<>(chunks.size());
        for (List<I> c : chunks) futures.add(executor.submit(() -> fetcher.fetch(c)));

        List<Map<I, R>> out = new ArrayList<>(chunks.size());
        try {
            // 청크 순서대로 합류: 첫 실패가 곧 전파되는 오류
            for (Future<Map<I, R>> f : futures) out.add(f.get());
            return out;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw ErrorClassifier.interrupted("batch of " + chunks.size() + " chunk(s)", ie);
        } catch (ExecutionException ee) {
            throw unwrap(ee);
        } finally {
            for (Future<Map<I, R>> f : futures) f.cancel(true);
        }
    }

    private static RuntimeException unwrap(ExecutionException ee) {
        Throwable cause = ee.getCause();
        if (cause instanceof RuntimeException re) return re;
        if (cause instanceof Error err) throw err;
        return new IllegalStateException("chunk fetch failed", cause);
    }
}
