package com.p2pclient.core.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 순서 있는 분류 규칙표(먼저 맞는 규칙이 이긴다). 불변이며 with* 로 새 표를 만든다.
 *
 * 기본표는 서비스가 실제로 돌려주는 것으로 알려진 메시지만 담는다.
 * 모르는 메시지는 추측해서 넣지 말고 설정(errorRules)으로 덧붙인다.
 */
public final class ErrorRuleTable {

    private static final ErrorRuleTable DEFAULTS = new ErrorRuleTable(List.of(
            // 4xx: 검증 오류(JSON 본문)
            ErrorRule.contains(400, 499, "{\"slug\":[\"has already been taken\"]}", ErrorKind.SLUG_TAKEN),
            ErrorRule.contains(400, 499, "{\"code\":[\"has already been taken\"]}", ErrorKind.SLUG_TAKEN),
            ErrorRule.status(404, ErrorKind.NOT_FOUND),
            // 5xx: 서버가 원문 에러 페이지를 흘리는 경우
            ErrorRule.contains(500, 599, "ORA-00001: unique constraint", ErrorKind.UNIQUE_CONSTRAINT_VIOLATED),
            ErrorRule.contains(500, 599, "incompatible encoding regexp match", ErrorKind.ENCODING_MISMATCH),
            ErrorRule.contains(500, 599, "unknown attribute", ErrorKind.UNKNOWN_ATTRIBUTE),
            ErrorRule.contains(500, 599, "Invalid access definition", ErrorKind.INVALID_ACCESS_DEFINITION),
            ErrorRule.contains(500, 599, "solr.tila.trb", ErrorKind.SEARCH_ERROR),
            ErrorRule.contains(500, 599, "Request Timeout", ErrorKind.TIMEOUT)
    ));

    private static final ErrorRuleTable EMPTY = new ErrorRuleTable(List.of());

    private final List<ErrorRule> rules;

    private ErrorRuleTable(List<ErrorRule> rules) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(rules));
    }

    public static ErrorRuleTable defaults() { return DEFAULTS; }

    public static ErrorRuleTable empty() { return EMPTY; }

    public static ErrorRuleTable of(List<ErrorRule> rules) {
        return new ErrorRuleTable(Objects.requireNonNull(rules, "rules"));
    }

    /** 기존 규칙보다 먼저 검사할 규칙 추가 */
    public ErrorRuleTable withFirst(ErrorRule rule) {
        List<ErrorRule> out = new ArrayList<>(rules.size() + 1);
        out.add(Objects.requireNonNull(rule, "rule"));
        out.addAll(rules);
        return new ErrorRuleTable(out);
    }

    /** 기존 규칙 뒤에 추가 */
    public ErrorRuleTable withLast(ErrorRule rule) {
        List<ErrorRule> out = new ArrayList<>(rules);
        out.add(Objects.requireNonNull(rule, "rule"));
        return new ErrorRuleTable(out);
    }

    /** 첫 매칭 규칙의 kind, 없으면 null */
    public ErrorKind match(int statusCode, String rawBody, boolean bodyIsJson) {
        for (ErrorRule r : rules) {
            if (r.matches(statusCode, rawBody, bodyIsJson)) return r.kind();
        }
        return null;
    }

    public List<ErrorRule> rules() { return rules; }

    public int size() { return rules.size(); }
}
