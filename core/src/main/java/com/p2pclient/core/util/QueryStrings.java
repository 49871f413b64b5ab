package com.p2pclient.core.util;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.temporal.TemporalAccessor;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * P2P(Rails) 스타일 쿼리스트링 인코딩.
 *
 * 규칙:
 *   k=v                (스칼라: 문자열/숫자/불리언/날짜)
 *   k[]=v              (리스트)
 *   k[k2]=v            (맵 안의 스칼라)
 *   k[k2][]=v          (맵 안의 리스트)
 *   k[k2][k3]=v        (맵 안의 맵, 한 단계만)
 * 그 외 타입(null 포함)은 IllegalArgumentException.
 */
public final class QueryStrings {
    private QueryStrings() {}

    /** 원본 삽입 순서대로 평탄화된 (name, value) 쌍 */
    public static List<Map.Entry<String, String>> pairs(Map<String, ?> query) {
        List<Map.Entry<String, String>> out = new ArrayList<>();
        if (query == null) return out;
        for (var e : query.entrySet()) {
            String k = e.getKey();
            Object v = e.getValue();
            if (v instanceof Map<?, ?> m) {
                for (var e2 : m.entrySet()) {
                    String k2 = k + "[" + e2.getKey() + "]";
                    Object v2 = e2.getValue();
                    if (isScalar(v2)) {
                        out.add(pair(k2, v2));
                    } else if (v2 instanceof Collection<?> list) {
                        for (Object v3 : list) out.add(pair(k2 + "[]", requireScalar(k2, v3)));
                    } else if (v2 instanceof Map<?, ?> m3) {
                        for (var e3 : m3.entrySet()) {
                            out.add(pair(k2 + "[" + e3.getKey() + "]", requireScalar(k2, e3.getValue())));
                        }
                    } else {
                        throw unsupported(k2, v2);
                    }
                }
            } else if (isScalar(v)) {
                out.add(pair(k, v));
            } else if (v instanceof Collection<?> list) {
                for (Object v2 : list) out.add(pair(k + "[]", requireScalar(k, v2)));
            } else {
                throw unsupported(k, v);
            }
        }
        return out;
    }

    /** URL 에 붙일 인코딩된 쿼리스트링(선행 '?' 없음). 비어 있으면 "" */
    public static String encode(Map<String, ?> query) {
        return pairs(query).stream()
                .map(p -> urlEncode(p.getKey()) + "=" + urlEncode(p.getValue()))
                .collect(Collectors.joining("&"));
    }

    /**
     * 캐시 서명용 정규형: 이름 기준 안정 정렬(같은 이름 안의 리스트 순서는 유지), encode() 와 같은 인코딩.
     * 맵의 키 순서가 달라도 같은 문자열이 나온다.
     */
    public static String canonical(Map<String, ?> query) {
        List<Map.Entry<String, String>> ps = pairs(query);
        ps.sort(Map.Entry.comparingByKey());
        return ps.stream()
                .map(p -> urlEncode(p.getKey()) + "=" + urlEncode(p.getValue()))
                .collect(Collectors.joining("&"));
    }

    /** 값만 모아서(인코딩 검사용) */
    public static List<String> values(Map<String, ?> query) {
        return pairs(query).stream().map(Map.Entry::getValue).collect(Collectors.toList());
    }

    // ------------ helpers ------------
    private static boolean isScalar(Object v) {
        return v instanceof CharSequence || v instanceof Number || v instanceof Boolean
                || v instanceof Character || v instanceof TemporalAccessor;
    }

    private static Object requireScalar(String key, Object v) {
        if (!isScalar(v)) throw unsupported(key, v);
        return v;
    }

    private static Map.Entry<String, String> pair(String k, Object v) {
        String s = (v instanceof TemporalAccessor t) ? P2PDates.format(t) : String.valueOf(v);
        return new AbstractMap.SimpleImmutableEntry<>(k, s);
    }

    private static IllegalArgumentException unsupported(String key, Object v) {
        return new IllegalArgumentException("unsupported query value for '" + key + "': "
                + (v == null ? "null" : v.getClass().getName()));
    }

    private static String urlEncode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
