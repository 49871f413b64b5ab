package com.p2pclient.core.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.p2pclient.core.model.HttpMethod;
import com.p2pclient.core.model.RawResponse;
import com.p2pclient.core.model.RequestSpec;
import com.p2pclient.core.util.JsonSupport;
import com.p2pclient.core.util.QueryStrings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 완료된 HTTP 교환(상태 + 본문)을 성공 값 또는 정확히 하나의 ErrorKind 로 바꾼다.
 * 새 오류 종류를 만드는 곳은 여기뿐이다(재시도/디스패처는 전달만 한다).
 *
 * 판정 순서(먼저 맞는 것이 이김):
 *   0) 전송 실패: 타임아웃이면 TIMEOUT, 아니면 P2P_EXCEPTION
 *   1) 2xx + 파싱 가능한 본문(빈 본문 포함) → 성공
 *   2) 규칙표(ErrorRuleTable) 매칭 → 해당 kind
 *   3) 401/403/429 → FORBIDDEN
 *   4) 408/504 → TIMEOUT
 *   5) 그 외 → P2P_EXCEPTION (상태/본문 보존)
 */
public final class ErrorClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorClassifier.class);

    /** 메시지에 붙이는 본문 조각 최대 길이 */
    private static final int DETAIL_MAX = 200;
    /** Retry-After 상한 */
    static final Duration RETRY_AFTER_CAP = Duration.ofSeconds(30);

    private final ErrorRuleTable rules;

    public ErrorClassifier() {
        this(ErrorRuleTable.defaults());
    }

    public ErrorClassifier(ErrorRuleTable rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    /** 성공이면 정규화된 JSON(빈 본문이면 NullNode), 실패면 P2PException */
    public JsonNode classify(RequestSpec spec, RawResponse resp) {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(resp, "resp");
        HttpMethod method = spec.getMethod();
        String path = spec.getPath();

        if (resp.isTransportFailure()) {
            ErrorKind kind = resp.isTimedOut() ? ErrorKind.TIMEOUT : ErrorKind.P2P_EXCEPTION;
            Throwable cause = resp.getTransportError();
            String detail = (cause == null) ? "no response" : cause.toString();
            throw mint(kind, spec, RawResponse.NO_STATUS, "", detail, cause, null);
        }

        int status = resp.getStatusCode();
        String body = resp.getBody();
        JsonNode parsed = JsonSupport.tryParse(body);

        if (resp.isSuccess()) {
            if (body.isBlank()) return NullNode.getInstance();
            if (parsed != null) return JsonSupport.normalize(parsed);
            // 2xx 인데 JSON 이 아니면 알 수 없는 실패로 취급
            throw mint(ErrorKind.P2P_EXCEPTION, spec, status, body, "unparseable success body", null, null);
        }

        ErrorKind kind = rules.match(status, body, parsed != null);
        if (kind == null) kind = byStatus(status);

        if (kind == ErrorKind.P2P_EXCEPTION) {
            LOG.debug("Unclassified P2P error {} {} -> {}: {}", method, path, status, abbreviate(body));
        }
        throw mint(kind, spec, status, body, detailOf(parsed, body), null, retryAfterOf(resp));
    }

    /** 3~5단계: 상태 코드만으로 판정 */
    static ErrorKind byStatus(int status) {
        if (status == 401 || status == 403 || status == 429) return ErrorKind.FORBIDDEN;
        if (status == 408 || status == 504) return ErrorKind.TIMEOUT;
        return ErrorKind.P2P_EXCEPTION;
    }

    /**
     * 사전 검사: 본문 직렬화 결과와 쿼리 값이 charset 으로 표현 가능해야 한다.
     * 아니면 네트워크 호출 없이 ENCODING_MISMATCH.
     */
    public void checkEncoding(RequestSpec spec, Charset charset) {
        Objects.requireNonNull(charset, "charset");
        List<String> texts = new ArrayList<>(QueryStrings.values(spec.getQuery()));
        if (spec.getBody() != null) texts.add(JsonSupport.write(spec.getBody()));

        CharsetEncoder enc = charset.newEncoder();
        for (String s : texts) {
            int bad = firstUnencodable(enc, s);
            if (bad >= 0) {
                String detail = String.format("U+%04X at offset %d is not representable in %s",
                        (int) s.charAt(bad), bad, charset.name());
                throw mint(ErrorKind.ENCODING_MISMATCH, spec, RawResponse.NO_STATUS, "", detail, null, null);
            }
        }
    }

    /** multi 응답 안의 개별 항목 실패(200/304/404 외 상태) */
    public P2PException itemFailure(RequestSpec spec, int itemStatus, Object id) {
        return mint(ErrorKind.P2P_EXCEPTION, spec, itemStatus, "", itemStatus + " fetching " + id, null, null);
    }

    /** 전송/재시도 대기 중 인터럽트(취소) → TIMEOUT 으로 표면화 */
    public P2PException cancelled(RequestSpec spec, InterruptedException cause) {
        return mint(ErrorKind.TIMEOUT, spec, RawResponse.NO_STATUS, "", "request cancelled", cause, null);
    }

    /** 요청 하나에 묶이지 않는 대기(배치 합류, 생성 전 대기)의 인터럽트 */
    public static P2PException interrupted(String what, InterruptedException cause) {
        return new P2PException(ErrorKind.TIMEOUT, ErrorKind.TIMEOUT.message() + ": " + what + " (request cancelled)", cause);
    }

    /** 2xx 이지만 기대한 모양이 아닌 응답(예: content_item 필드 없음) */
    public P2PException malformed(RequestSpec spec, String body, String detail) {
        return mint(ErrorKind.P2P_EXCEPTION, spec, 200, body, detail, null, null);
    }

    // ------------ helpers ------------
    private static P2PException mint(ErrorKind kind, RequestSpec spec, int status, String body, String detail,
                                     Throwable cause, Duration retryAfter) {
        StringBuilder msg = new StringBuilder(kind.message())
                .append(": ").append(spec.describe());
        if (status != RawResponse.NO_STATUS) msg.append(" -> ").append(status);
        if (detail != null && !detail.isBlank()) msg.append(" (").append(detail).append(')');
        return new P2PException(kind, msg.toString(), cause, status, body,
                spec.getMethod(), spec.getPath(), retryAfter);
    }

    private static int firstUnencodable(CharsetEncoder enc, String s) {
        if (s == null || s.isEmpty() || enc.canEncode(s)) return -1;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
                if (!enc.canEncode(s.substring(i, i + 2))) return i;
                i++;
                continue;
            }
            if (!enc.canEncode(c)) return i;
        }
        return 0;
    }

    /** JSON 에러 본문이면 error/message/errors 필드, 아니면 본문 앞부분 */
    private static String detailOf(JsonNode parsed, String body) {
        if (parsed != null && parsed.isObject()) {
            for (String f : new String[]{"error", "message", "errors"}) {
                JsonNode v = parsed.get(f);
                if (v != null && !v.isNull()) return abbreviate(v.isTextual() ? v.textValue() : v.toString());
            }
        }
        return abbreviate(body);
    }

    /** Retry-After(초) → Duration, 상한 30초. HTTP-date 형식은 무시(기본 백오프 사용) */
    static Duration retryAfterOf(RawResponse resp) {
        String v = resp.header("Retry-After");
        if (v == null || v.isBlank()) return null;
        try {
            long sec = Long.parseLong(v.trim());
            if (sec < 0) return null;
            Duration d = Duration.ofSeconds(sec);
            return d.compareTo(RETRY_AFTER_CAP) > 0 ? RETRY_AFTER_CAP : d;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        String t = s.strip();
        return (t.length() <= DETAIL_MAX) ? t : t.substring(0, DETAIL_MAX) + "...";
    }
}
