package com.p2pclient.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonSupportTest {

    @Test
    void normalize_turns_null_strings_into_json_null() {
        JsonNode n = JsonSupport.normalize(JsonSupport.tryParse(
                "{\"a\":\"null\",\"b\":[\"Null\",\"x\"],\"c\":{\"d\":\"NULL\"}}"));

        assertThat(n.get("a").isNull()).isTrue();
        assertThat(n.at("/b/0").isNull()).isTrue();
        assertThat(n.at("/b/1").asText()).isEqualTo("x");
        assertThat(n.at("/c/d").asText()).isEqualTo("NULL"); // 대문자 전체는 그대로
        assertThat(JsonSupport.normalize(JsonSupport.tryParse("\"null\"")).isNull()).isTrue();
    }

    @Test
    void canonical_sorts_keys_recursively() {
        String a = JsonSupport.canonical(JsonSupport.tryParse("{\"b\":1,\"a\":{\"z\":1,\"y\":[2,1]}}"));
        String b = JsonSupport.canonical(JsonSupport.tryParse("{\"a\":{\"y\":[2,1],\"z\":1},\"b\":1}"));

        assertThat(a).isEqualTo(b).isEqualTo("{\"a\":{\"y\":[2,1],\"z\":1},\"b\":1}");
    }

    @Test
    void dates_are_written_in_wire_format() {
        OffsetDateTime t = OffsetDateTime.of(2014, 3, 2, 3, 4, 5, 0, ZoneOffset.ofHours(-6));

        assertThat(JsonSupport.write(Map.of("at", t))).isEqualTo("{\"at\":\"2014-03-02T09:04:05Z\"}");
        assertThat(JsonSupport.write(Map.of("at", Instant.parse("2014-03-02T09:04:05.789Z"))))
                .isEqualTo("{\"at\":\"2014-03-02T09:04:05Z\"}");
    }

    @Test
    void try_parse_returns_null_for_garbage() {
        assertThat(JsonSupport.tryParse("{\"truncated\":")).isNull();
        assertThat(JsonSupport.tryParse("  ")).isNull();
    }

    @Test
    void p2p_dates_format_supported_temporals() {
        assertThat(P2PDates.format(LocalDate.of(1900, 1, 1))).isEqualTo("1900-01-01T00:00:00Z");
        assertThatThrownBy(() -> P2PDates.format(java.time.LocalTime.NOON)).isInstanceOf(IllegalArgumentException.class);
    }
}
