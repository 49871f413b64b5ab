package com.p2pclient.core.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;

/** P2P API 날짜 포맷(UTC, 초 단위, 'Z' 접미사) 변환 헬퍼 */
public final class P2PDates {
    private P2PDates() {}

    public static final DateTimeFormatter WIRE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    /** if_modified_since 기본값: "이 이후로 변경된 것" = 전부 */
    public static final Instant EPOCH_1900 = Instant.parse("1900-01-01T00:00:00Z");

    public static String format(Instant instant) {
        return WIRE_FORMAT.format(Objects.requireNonNull(instant, "instant"));
    }

    /** Instant/OffsetDateTime/ZonedDateTime/LocalDate(UTC 자정) 지원. 그 외 타입은 IllegalArgumentException */
    public static String format(TemporalAccessor t) {
        if (t instanceof Instant i) return format(i);
        if (t instanceof OffsetDateTime o) return format(o.toInstant());
        if (t instanceof ZonedDateTime z) return format(z.toInstant());
        if (t instanceof LocalDate d) return format(d.atStartOfDay(ZoneOffset.UTC).toInstant());
        throw new IllegalArgumentException("unsupported temporal type: " + (t == null ? "null" : t.getClass().getName()));
    }
}
