package com.p2pclient.core.util;

import com.p2pclient.core.cache.ExpiringCache;
import com.p2pclient.core.cache.MapCache;
import com.p2pclient.core.cache.NoCache;
import com.p2pclient.core.cache.RedisCache;
import com.p2pclient.core.error.ErrorKind;
import com.p2pclient.core.error.P2PException;
import com.p2pclient.core.http.DefaultRetryPolicy;
import com.p2pclient.core.model.ConnectionConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class P2PConfigLoaderTest {

    @TempDir
    Path dir;

    private Path yaml(String text) throws IOException {
        Path p = dir.resolve("p2p.yml");
        Files.writeString(p, text, StandardCharsets.UTF_8);
        return p;
    }

    @Test
    void full_yaml_is_mapped_onto_the_config() throws Exception {
        ConnectionConfig c = P2PConfigLoader.load(yaml(String.join("\n",
                "url: \"https://content-api.example.com/\"",
                "authToken: \"abc\"",
                "debug: true",
                "secondaryUrl: \"https://report.example.com\"",
                "preserveEmbeddedTags: false",
                "timeoutMs: 5000",
                "retry:",
                "  maxAttempts: 5",
                "  baseDelayMs: 100",
                "encoding:",
                "  charset: \"ISO-8859-1\"",
                "  check: false",
                "cache:",
                "  type: expiring",
                "  ttlMinutes: 5",
                "")));

        assertThat(c.getBaseUrl()).isEqualTo("https://content-api.example.com");
        assertThat(c.getAuthToken()).isEqualTo("abc");
        assertThat(c.isDebug()).isTrue();
        assertThat(c.getSecondaryUrl()).isEqualTo("https://report.example.com");
        assertThat(c.isPreserveEmbeddedTags()).isFalse();
        assertThat(c.getTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(c.getRetryPolicy().maxAttempts()).isEqualTo(5);
        assertThat(((DefaultRetryPolicy) c.getRetryPolicy()).baseMillis()).isEqualTo(100);
        assertThat(c.getCharset()).isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(c.isEncodingCheck()).isFalse();
        assertThat(c.getCache()).isInstanceOf(ExpiringCache.class);
        assertThat(((ExpiringCache) c.getCache()).effectiveTtl()).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    void minimal_yaml_keeps_defaults() throws Exception {
        ConnectionConfig c = P2PConfigLoader.load(yaml("url: https://p2p.example.com\nauthToken: t\n"));

        assertThat(c.getCache()).isSameAs(NoCache.INSTANCE);
        assertThat(c.getRetryPolicy().maxAttempts()).isEqualTo(DefaultRetryPolicy.DEFAULT_MAX_ATTEMPTS);
        assertThat(c.isPreserveEmbeddedTags()).isTrue();
        assertThat(c.getCharset()).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void error_rules_are_checked_before_the_defaults_in_file_order() throws Exception {
        ConnectionConfig c = P2PConfigLoader.load(yaml(String.join("\n",
                "url: https://p2p.example.com",
                "authToken: t",
                "errorRules:",
                "  - status: \"5xx\"",
                "    contains: \"Deadlock found\"",
                "    kind: timeout",
                "  - status: \"400-499\"",
                "    pattern: \"title .* blank\"",
                "    kind: UNKNOWN_ATTRIBUTE",
                "")));

        assertThat(c.getErrorRules().match(503, "Deadlock found when trying to get lock", false))
                .isEqualTo(ErrorKind.TIMEOUT);
        assertThat(c.getErrorRules().match(422, "title can't be blank", false))
                .isEqualTo(ErrorKind.UNKNOWN_ATTRIBUTE);
        assertThat(c.getErrorRules().match(404, "", false)).isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    void broken_rules_and_caches_are_rejected() {
        assertThatThrownBy(() -> P2PConfigLoader.ruleOf(Map.of("status", 500), 0))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("kind is required");
        assertThatThrownBy(() -> P2PConfigLoader.ruleOf(Map.of("status", "abc", "kind", "TIMEOUT"), 1))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("status invalid");
        assertThatThrownBy(() -> P2PConfigLoader.ruleOf(Map.of("status", 500, "kind", "NOPE"), 2))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("kind unknown");
        assertThatThrownBy(() -> P2PConfigLoader.cacheOf(Map.<String, Object>of("type", "redis")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(P2PConfigLoader.cacheOf(Map.<String, Object>of("type", "map"))).isInstanceOf(MapCache.class);
        assertThatThrownBy(() -> P2PConfigLoader.ruleOf(Map.of("status", "5xx", "kind", "TIMEOUT"), 3))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("needs contains or pattern");
        assertThat(P2PConfigLoader.ruleOf(Map.of("status", 418, "kind", "FORBIDDEN"), 4).kind())
                .isEqualTo(ErrorKind.FORBIDDEN);
    }

    @Test
    void redis_cache_is_configured_without_connecting() throws Exception {
        ConnectionConfig c = P2PConfigLoader.load(yaml(String.join("\n",
                "url: https://p2p.example.com",
                "authToken: t",
                "cache:",
                "  type: redis",
                "  host: cache.internal",
                "  port: 6380",
                "  prefix: p2p-test",
                "  ttlMinutes: 10",
                "")));

        assertThat(c.getCache()).isInstanceOf(RedisCache.class);
        RedisCache redis = (RedisCache) c.getCache();
        assertThat(redis.prefix()).isEqualTo("p2p-test");
        assertThat(redis.ttl()).isEqualTo(Duration.ofMinutes(10));
        redis.close();
    }

    @Test
    void missing_file_and_non_mapping_root() throws Exception {
        assertThatThrownBy(() -> P2PConfigLoader.load(dir.resolve("nope.yml"))).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> P2PConfigLoader.load(yaml("- a\n- b\n"))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> P2PConfigLoader.load(yaml("url: ftp://p2p.example.com\nauthToken: t\n")))
                .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("http/https");
    }

    @Test
    void environment_settings() {
        ConnectionConfig c = P2PConfigLoader.fromEnvironment(Map.of(
                P2PConfigLoader.ENV_URL, "https://p2p.example.com",
                P2PConfigLoader.ENV_KEY, "k",
                P2PConfigLoader.ENV_DEBUG, "yes"));

        assertThat(c.isDebug()).isTrue();
        assertThat(c.getSecondaryUrl()).isNull();

        P2PException e = catchThrowableOfType(
                () -> P2PConfigLoader.fromEnvironment(Map.of(P2PConfigLoader.ENV_URL, "https://p2p.example.com")),
                P2PException.class);
        assertThat(e.getKind()).isEqualTo(ErrorKind.P2P_EXCEPTION);
        assertThat(e.getMessage()).contains("No connection settings available");
    }
}
