package com.p2pclient.core.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.p2pclient.core.model.HttpMethod;
import com.p2pclient.core.util.JsonSupport;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedisCacheTest {

    /** 메모리 Redis: 키/값과 만료 초를 기록 */
    static final class MemoryRedis implements RedisCache.Commands {
        final Map<String, String> data = new ConcurrentHashMap<>();
        final Map<String, Long> expiry = new ConcurrentHashMap<>();
        boolean down;

        @Override public String get(String key) {
            if (down) throw new IllegalStateException("connection refused");
            return data.get(key);
        }

        @Override public void set(String key, String value, long seconds) {
            if (down) throw new IllegalStateException("connection refused");
            data.put(key, value);
            expiry.put(key, seconds);
        }

        @Override public void del(List<String> keys) {
            keys.forEach(k -> { data.remove(k); expiry.remove(k); });
        }

        @Override public List<String> keys(String pattern) {
            // SCAN MATCH 의 '*' 와 '\' 이스케이프만 흉내
            StringBuilder re = new StringBuilder();
            for (int i = 0; i < pattern.length(); i++) {
                char c = pattern.charAt(i);
                if (c == '\\' && i + 1 < pattern.length()) re.append(Pattern.quote(String.valueOf(pattern.charAt(++i))));
                else if (c == '*') re.append(".*");
                else re.append(Pattern.quote(String.valueOf(c)));
            }
            Pattern p = Pattern.compile(re.toString());
            List<String> out = new ArrayList<>();
            for (String k : data.keySet()) if (p.matcher(k).matches()) out.add(k);
            return out;
        }
    }

    private static RequestSignature sig(String path) {
        return RequestSignature.of(HttpMethod.GET, path, Map.of("include", List.of("web_url")));
    }

    @Test
    void values_round_trip_as_json_under_the_prefixed_key() {
        MemoryRedis redis = new MemoryRedis();
        RedisCache cache = new RedisCache(redis, "p2p", null);
        JsonNode v = JsonSupport.tryParse("{\"content_item\":{\"id\":1,\"title\":\"Lorem\"}}");

        cache.set(sig("/content_items/a.json"), v);

        assertThat(cache.get(sig("/content_items/a.json"))).contains(v);
        assertThat(redis.data).containsKey("p2p:" + sig("/content_items/a.json").key());
        assertThat(redis.expiry.values()).containsOnly(0L);
        assertThat(cache.get(sig("/content_items/b.json"))).isEmpty();
    }

    @Test
    void ttl_is_passed_in_seconds() {
        MemoryRedis redis = new MemoryRedis();
        new RedisCache(redis, "p2p", Duration.ofMinutes(5)).set(sig("/x.json"), JsonSupport.object());

        assertThat(redis.expiry.values()).containsExactly(300L);
    }

    @Test
    void clear_only_touches_its_own_prefix() {
        MemoryRedis redis = new MemoryRedis();
        redis.data.put("other:GET /x.json", "{}");
        RedisCache cache = new RedisCache(redis, "p2p*", null);
        cache.set(sig("/a.json"), JsonSupport.object());
        cache.set(sig("/b.json"), JsonSupport.object());
        redis.data.put("p2pzzz:GET /c.json", "{}"); // '*' 는 글자 그대로여야 한다

        cache.clear();

        assertThat(redis.data).containsOnlyKeys("other:GET /x.json", "p2pzzz:GET /c.json");
    }

    @Test
    void invalidate_removes_one_entry() {
        MemoryRedis redis = new MemoryRedis();
        RedisCache cache = new RedisCache(redis, "p2p", null);
        cache.set(sig("/a.json"), JsonSupport.object());
        cache.set(sig("/b.json"), JsonSupport.object());

        cache.invalidate(sig("/a.json"));

        assertThat(cache.get(sig("/a.json"))).isEmpty();
        assertThat(cache.get(sig("/b.json"))).isPresent();
    }

    @Test
    void unavailable_or_corrupt_store_degrades_to_a_miss() {
        MemoryRedis redis = new MemoryRedis();
        RedisCache cache = new RedisCache(redis, "p2p", null);
        redis.data.put("p2p:" + sig("/bad.json").key(), "{not json");

        assertThat(cache.get(sig("/bad.json"))).isEmpty();

        redis.down = true;
        assertThat(cache.get(sig("/a.json"))).isEmpty();
        cache.set(sig("/a.json"), JsonSupport.object()); // 예외 없음
    }

    @Test
    void prefix_must_be_present() {
        assertThatThrownBy(() -> new RedisCache(new MemoryRedis(), " ", null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(RedisCache.globEscape("a*b?[c]")).isEqualTo("a\\*b\\?\\[c\\]");
    }
}
