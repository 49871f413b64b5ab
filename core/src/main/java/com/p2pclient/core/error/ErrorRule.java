package com.p2pclient.core.error;

import java.util.Objects;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * 분류표 한 줄: (상태 조건, 본문 조건) → ErrorKind.
 * jsonOnly=true 인 규칙은 본문이 JSON 으로 파싱될 때만 적용된다.
 */
public final class ErrorRule {
    private final String description;
    private final IntPredicate status;
    private final Predicate<String> body;
    private final boolean jsonOnly;
    private final ErrorKind kind;

    private ErrorRule(String description, IntPredicate status, Predicate<String> body, boolean jsonOnly, ErrorKind kind) {
        this.description = Objects.requireNonNull(description, "description");
        this.status = Objects.requireNonNull(status, "status");
        this.body = Objects.requireNonNull(body, "body");
        this.jsonOnly = jsonOnly;
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /** 상태 범위 [min,max] + 본문 부분 문자열 */
    public static ErrorRule contains(int minStatus, int maxStatus, String needle, ErrorKind kind) {
        Objects.requireNonNull(needle, "needle");
        return new ErrorRule(range(minStatus, maxStatus) + " contains '" + needle + "'",
                between(minStatus, maxStatus), b -> b.contains(needle), looksLikeJson(needle), kind);
    }

    /** 상태 범위 [min,max] + 본문 정규식(find) */
    public static ErrorRule pattern(int minStatus, int maxStatus, Pattern pattern, ErrorKind kind) {
        Objects.requireNonNull(pattern, "pattern");
        return new ErrorRule(range(minStatus, maxStatus) + " matches /" + pattern.pattern() + "/",
                between(minStatus, maxStatus), b -> pattern.matcher(b).find(), false, kind);
    }

    /** 상태만 보는 규칙(본문 무관) */
    public static ErrorRule status(int code, ErrorKind kind) {
        return new ErrorRule(code + " (any body)", s -> s == code, b -> true, false, kind);
    }

    public boolean matches(int statusCode, String rawBody, boolean bodyIsJson) {
        if (jsonOnly && !bodyIsJson) return false;
        return status.test(statusCode) && body.test(rawBody == null ? "" : rawBody);
    }

    public ErrorKind kind() { return kind; }

    @Override public String toString() { return description + " -> " + kind; }

    private static IntPredicate between(int min, int max) {
        if (min > max) throw new IllegalArgumentException("minStatus > maxStatus: " + min + " > " + max);
        return s -> s >= min && s <= max;
    }

    private static String range(int min, int max) {
        return (min == max) ? String.valueOf(min) : min + "-" + max;
    }

    private static boolean looksLikeJson(String needle) {
        String t = needle.trim();
        return t.startsWith("{") || t.startsWith("[");
    }
}
