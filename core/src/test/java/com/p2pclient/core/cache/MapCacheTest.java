package com.p2pclient.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p2pclient.core.model.HttpMethod;
import com.p2pclient.core.util.JsonSupport;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MapCacheTest {

    private static RequestSignature sig(String path, Map<String, ?> q) {
        return RequestSignature.of(HttpMethod.GET, path, q);
    }

    @Test
    void set_then_get_returns_equal_value() {
        MapCache cache = new MapCache(new FrozenClock(1_000));
        ObjectNode v = JsonSupport.object().put("slug", "chi-na-lorem-a");

        cache.set(sig("/content_items/chi-na-lorem-a.json", Map.of()), v);

        assertThat(cache.get(sig("/content_items/chi-na-lorem-a.json", Map.of()))).contains(v);
        assertThat(cache.entry(sig("/content_items/chi-na-lorem-a.json", Map.of())))
                .hasValueSatisfying(e -> assertThat(e.insertedAt().toEpochMilli()).isEqualTo(1_000));
    }

    @Test
    void miss_is_empty_not_an_error() {
        assertThat(new MapCache().get(sig("/nope.json", Map.of()))).isEmpty();
        assertThat(NoCache.INSTANCE.get(sig("/nope.json", Map.of()))).isEmpty();
    }

    @Test
    void no_cache_never_stores() {
        NoCache.INSTANCE.set(sig("/a.json", Map.of()), JsonSupport.object());
        assertThat(NoCache.INSTANCE.get(sig("/a.json", Map.of()))).isEmpty();
    }

    @Test
    void stored_and_returned_values_are_copies() {
        MapCache cache = new MapCache();
        ObjectNode v = JsonSupport.object().put("title", "original");
        cache.set(sig("/a.json", Map.of()), v);

        v.put("title", "mutated after set");
        JsonNode got = cache.get(sig("/a.json", Map.of())).orElseThrow();
        ((ObjectNode) got).put("title", "mutated after get");

        assertThat(cache.get(sig("/a.json", Map.of())).orElseThrow().get("title").asText()).isEqualTo("original");
    }

    @Test
    void last_writer_wins_and_invalidate_removes() {
        MapCache cache = new MapCache();
        RequestSignature k = sig("/a.json", Map.of("include", List.of("web_url")));
        cache.set(k, JsonSupport.object().put("v", 1));
        cache.set(k, JsonSupport.object().put("v", 2));
        assertThat(cache.get(k).orElseThrow().get("v").asInt()).isEqualTo(2);

        cache.invalidate(k);
        assertThat(cache.get(k)).isEmpty();
    }

    @Test
    void invalidatePath_drops_every_query_of_one_resource() {
        MapCache cache = new MapCache();
        cache.set(sig("/content_items/a.json", Map.of()), JsonSupport.object());
        cache.set(sig("/content_items/a.json", Map.of("include", List.of("web_url"))), JsonSupport.object());
        cache.set(sig("/content_items/b.json", Map.of()), JsonSupport.object());

        int removed = cache.invalidatePath("/content_items//a.json/");

        assertThat(removed).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get(sig("/content_items/b.json", Map.of()))).isPresent();
    }

    @Test
    void concurrent_sets_on_distinct_signatures_do_not_corrupt_each_other() throws Exception {
        MapCache cache = new MapCache();
        int threads = 8, perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> fs = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                final int tid = t;
                fs.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        String slug = "item-" + tid + "-" + i;
                        cache.set(sig("/content_items/" + slug + ".json", Map.of()), JsonSupport.object().put("slug", slug));
                        cache.get(sig("/content_items/" + slug + ".json", Map.of()));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : fs) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(cache.size()).isEqualTo(threads * perThread);
        for (int t = 0; t < threads; t++) {
            for (int i = 0; i < perThread; i++) {
                String slug = "item-" + t + "-" + i;
                assertThat(cache.get(sig("/content_items/" + slug + ".json", Map.of())).orElseThrow().get("slug").asText())
                        .isEqualTo(slug);
            }
        }
    }

    @Test
    void counting_cache_records_gets_hits_and_sets() {
        CountingCache cache = new CountingCache(new MapCache());
        RequestSignature k = sig("/a.json", Map.of());

        cache.get(k);                                // miss
        cache.set(k, JsonSupport.object());
        cache.get(k);                                // hit
        cache.get(sig("/b.json", Map.of()));         // miss

        CountingCache.CacheStats s = cache.stats();
        assertThat(s.gets()).isEqualTo(3);
        assertThat(s.hits()).isEqualTo(1);
        assertThat(s.misses()).isEqualTo(2);
        assertThat(s.sets()).isEqualTo(1);
        assertThat(s.hitRatio()).isCloseTo(1.0 / 3, org.assertj.core.data.Offset.offset(1e-9));
    }
}
