package com.p2pclient.core.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.p2pclient.core.cache.MapCache;
import com.p2pclient.core.error.ErrorKind;
import com.p2pclient.core.error.P2PException;
import com.p2pclient.core.model.ConnectionConfig;
import com.p2pclient.core.model.RequestSpec;
import com.p2pclient.core.util.TestSleeper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/** 실제 JDK HttpClient 경로(JdkHttpTransport)로 로컬 서버와 왕복 */
class RequestDispatcherHttpIntegrationTest {

    static HttpServer s;
    static int port;
    static final AtomicInteger throttled = new AtomicInteger();
    static final List<String> seenAuth = new CopyOnWriteArrayList<>();
    static final List<String> seenQueries = new CopyOnWriteArrayList<>();

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        port = s.getAddress().getPort();
        s.createContext("/content_items/chi-na-lorem-a.json", ex -> {
            seenAuth.add(ex.getRequestHeaders().getFirst("Authorization"));
            seenQueries.add(ex.getRequestURI().getRawQuery());
            respond(ex, 200, Map.of(), "{\"content_item\":{\"slug\":\"chi-na-lorem-a\",\"byline\":\"Null\"}}");
        });
        s.createContext("/content_items/throttled.json", ex -> {
            if (throttled.incrementAndGet() == 1) {
                respond(ex, 429, Map.of("Retry-After", "1"), "Rate limit exceeded");
            } else {
                respond(ex, 200, Map.of(), "{\"content_item\":{\"slug\":\"throttled\"}}");
            }
        });
        s.createContext("/content_items.json", ex ->
                respond(ex, 422, Map.of(), "{\"slug\":[\"has already been taken\"]}"));
        s.createContext("/content_items/boom.json", ex ->
                respond(ex, 500, Map.of(), "<h1>ORA-00001: unique constraint (P2P.UK) violated</h1>"));
        s.start();
    }

    @AfterAll
    static void down() { s.stop(0); }

    @BeforeEach
    void reset() {
        throttled.set(0);
        seenAuth.clear();
        seenQueries.clear();
    }

    private static ConnectionConfig.Builder cfg() {
        return ConnectionConfig.builder("http://127.0.0.1:" + port, "tok-123").timeout(Duration.ofSeconds(5));
    }

    @Test
    void get_round_trip_with_auth_query_and_cache() {
        MapCache cache = new MapCache();
        ConnectionConfig c = cfg().cache(cache).build();
        RequestDispatcher d = new RequestDispatcher(c, new JdkHttpTransport(c.getTimeout()), new TestSleeper());

        RequestSpec spec = RequestSpec.get("/content_items/chi-na-lorem-a.json").param("include", List.of("web_url")).build();
        JsonNode v1 = d.execute(spec);
        JsonNode v2 = d.execute(spec);

        assertThat(v1.at("/content_item/slug").asText()).isEqualTo("chi-na-lorem-a");
        assertThat(v1.at("/content_item/byline").isNull()).isTrue();
        assertThat(v2).isEqualTo(v1);
        assertThat(seenAuth).containsExactly("Bearer tok-123");
        assertThat(seenQueries).containsExactly("include%5B%5D=web_url");
    }

    @Test
    void throttled_request_waits_retry_after_and_succeeds() {
        TestSleeper sleeper = new TestSleeper();
        ConnectionConfig c = cfg().build();
        RequestDispatcher d = new RequestDispatcher(c, new JdkHttpTransport(c.getTimeout()), sleeper);

        JsonNode v = d.execute(RequestSpec.get("/content_items/throttled.json").build());

        assertThat(v.at("/content_item/slug").asText()).isEqualTo("throttled");
        assertThat(throttled.get()).isEqualTo(2);
        assertThat(sleeper.sleeps).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    void service_errors_are_classified() {
        ConnectionConfig c = cfg().build();
        RequestDispatcher d = new RequestDispatcher(c, new JdkHttpTransport(c.getTimeout()), new TestSleeper());

        P2PException taken = catchThrowableOfType(() -> d.execute(RequestSpec.post("/content_items.json")
                .body(Map.of("content_item", Map.of("slug", "chi-na-lorem-a"))).build()), P2PException.class);
        P2PException unique = catchThrowableOfType(() -> d.execute(RequestSpec.get("/content_items/boom.json").build()),
                P2PException.class);

        assertThat(taken.getKind()).isEqualTo(ErrorKind.SLUG_TAKEN);
        assertThat(taken.getStatusCode()).isEqualTo(422);
        assertThat(unique.getKind()).isEqualTo(ErrorKind.UNIQUE_CONSTRAINT_VIOLATED);
    }

    @Test
    void connection_refused_is_the_fallback_kind() throws IOException {
        int deadPort;
        try (var free = new java.net.ServerSocket(0)) {
            deadPort = free.getLocalPort();
        }
        ConnectionConfig c = ConnectionConfig.builder("http://127.0.0.1:" + deadPort, "tok").timeout(Duration.ofSeconds(2)).build();
        RequestDispatcher d = new RequestDispatcher(c, new JdkHttpTransport(c.getTimeout()), new TestSleeper());

        P2PException e = catchThrowableOfType(() -> d.execute(RequestSpec.get("/x.json").build()), P2PException.class);

        assertThat(e.getKind()).isEqualTo(ErrorKind.P2P_EXCEPTION);
        assertThat(e.getStatusCode()).isEqualTo(-1);
    }

    private static void respond(HttpExchange ex, int code, Map<String, String> headers, String body) throws IOException {
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "application/json; charset=utf-8");
        headers.forEach((k, v) -> ex.getResponseHeaders().add(k, v));
        ex.sendResponseHeaders(code, b.length);
        try (OutputStream os = ex.getResponseBody()) { os.write(b); }
    }
}
