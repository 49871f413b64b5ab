package com.p2pclient.core.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.p2pclient.core.cache.RequestSignature;
import com.p2pclient.core.cache.ResponseCache;
import com.p2pclient.core.error.ErrorClassifier;
import com.p2pclient.core.model.ConnectionConfig;
import com.p2pclient.core.model.RawResponse;
import com.p2pclient.core.model.RequestSpec;
import com.p2pclient.core.util.DefaultSleeper;
import com.p2pclient.core.util.JsonSupport;
import com.p2pclient.core.util.QueryStrings;
import com.p2pclient.core.util.Sleeper;
import com.p2pclient.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.Objects;
import java.util.Optional;

/**
 * 모든 P2P 호출의 단일 진입점.
 *
 * 1) 서명 계산 → 2) 읽기 + 캐시 히트 + !forceUpdate 면 네트워크 없이 반환
 * → 3) 인코딩 사전 검사 → 4) 재시도 정책 안에서 전송 → 5) 분류
 * → 6) 읽기 성공이면 캐시에 기록(쓰기 통과) → 7) 값 반환 또는 분류된 오류 전파.
 *
 * 설정과 캐시 외에는 상태가 없으므로 여러 스레드에서 공유해도 된다.
 * debug 는 로그 레벨만 바꾸고 동작은 바꾸지 않는다.
 */
public class RequestDispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(RequestDispatcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(RequestDispatcher.class);

    /** debug 로그에 남기는 실패 본문 최대 길이 */
    private static final int LOG_BODY_MAX = 2000;

    private final ConnectionConfig config;
    private final HttpTransport transport;
    private final ErrorClassifier classifier;
    private final RetryExecutor retry;

    public RequestDispatcher(ConnectionConfig config) {
        this(config, new JdkHttpTransport(Objects.requireNonNull(config, "config").getTimeout()), DefaultSleeper.INSTANCE);
    }

    public RequestDispatcher(ConnectionConfig config, HttpTransport transport) {
        this(config, transport, DefaultSleeper.INSTANCE);
    }

    public RequestDispatcher(ConnectionConfig config, HttpTransport transport, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.classifier = new ErrorClassifier(config.getErrorRules());
        this.retry = new RetryExecutor(config.getRetryPolicy(), Objects.requireNonNull(sleeper, "sleeper"), classifier);
    }

    public ConnectionConfig config() { return config; }
    public ResponseCache cache() { return config.getCache(); }
    public ErrorClassifier classifier() { return classifier; }

    /** 성공이면 정규화된 JSON(빈 본문이면 NullNode), 실패면 P2PException */
    public JsonNode execute(RequestSpec spec) {
        Objects.requireNonNull(spec, "spec");
        ResponseCache cache = config.getCache();
        RequestSignature sig = RequestSignature.of(spec);

        if (spec.isCacheable() && !spec.isForceUpdate()) {
            Optional<JsonNode> hit = cache.get(sig);
            if (hit.isPresent()) {
                SLOG.event(config.isDebug(), "p2p.cache.hit", "key", sig.key());
                return hit.get();
            }
        }

        if (config.isEncodingCheck()) {
            classifier.checkEncoding(spec, config.getCharset());
        }

        HttpRequest req = buildRequest(spec);
        JsonNode value = retry.run(spec, attempt -> attemptOnce(spec, req, attempt));

        if (spec.isCacheable()) {
            cache.set(sig, value);
        }
        return value;
    }

    /** 전송 1회 + 분류. 인터럽트는 TIMEOUT 으로 표면화(인터럽트 플래그 복원) */
    private JsonNode attemptOnce(RequestSpec spec, HttpRequest req, int attempt) {
        long start = System.nanoTime();
        RawResponse.Builder rb = RawResponse.builder().url(req.uri());
        try {
            HttpResponse<String> resp = transport.send(req);
            rb.statusCode(resp.statusCode())
              .headers(resp.headers().map())
              .body(resp.body() == null ? "" : resp.body());
        } catch (HttpTimeoutException e) {
            rb.transportError(e).timedOut(true);
        } catch (IOException e) {
            rb.transportError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw classifier.cancelled(spec, e);
        }
        RawResponse raw = rb.responseTimeMs((System.nanoTime() - start) / 1_000_000).build();
        logAttempt(spec, attempt, raw);
        return classifier.classify(spec, raw);
    }

    HttpRequest buildRequest(RequestSpec spec) {
        HttpRequest.Builder b = HttpRequest.newBuilder(urlFor(spec))
                .timeout(config.getTimeout())
                .header("Authorization", "Bearer " + config.getAuthToken())
                .header("Accept", "application/json")
                .header("User-Agent", config.getUserAgent());

        HttpRequest.BodyPublisher publisher;
        if (spec.getBody() != null) {
            b.header("Content-Type", "application/json");
            publisher = HttpRequest.BodyPublishers.ofString(JsonSupport.write(spec.getBody()), config.getCharset());
        } else {
            publisher = HttpRequest.BodyPublishers.noBody();
        }
        return b.method(spec.getMethod().name(), publisher).build();
    }

    /** base(또는 보조 URL) + path + ?쿼리 */
    URI urlFor(RequestSpec spec) {
        String base;
        if (spec.isSecondary()) {
            base = config.getSecondaryUrl();
            if (base == null) {
                throw new IllegalStateException("No secondary service URL configured for " + spec.describe());
            }
        } else {
            base = config.getBaseUrl();
        }
        String qs = QueryStrings.encode(spec.getQuery());
        return URI.create(base + spec.getPath() + (qs.isEmpty() ? "" : "?" + qs));
    }

    private void logAttempt(RequestSpec spec, int attempt, RawResponse raw) {
        boolean loud = config.isDebug();
        if (raw.isTransportFailure()) {
            LOG.debug("Transport failure on {} attempt {}: {}", spec.describe(), attempt, raw.getTransportError());
        }
        if (!SLOG.isLoggable(loud)) return;
        if (raw.isSuccess()) {
            SLOG.event(loud, "p2p.attempt",
                    "method", spec.getMethod(), "path", spec.getPath(), "attempt", attempt,
                    "status", raw.getStatusCode(), "ms", raw.getResponseTimeMs());
        } else {
            SLOG.event(loud, "p2p.attempt",
                    "method", spec.getMethod(), "path", spec.getPath(), "attempt", attempt,
                    "status", raw.getStatusCode(), "ms", raw.getResponseTimeMs(),
                    "timedOut", raw.isTimedOut(), "body", abbreviate(raw.getBody()));
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return (s.length() <= LOG_BODY_MAX) ? s : s.substring(0, LOG_BODY_MAX) + "...";
    }
}
