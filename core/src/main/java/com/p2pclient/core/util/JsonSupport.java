package com.p2pclient.core.util;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Jackson 공용 설정 + P2P 응답/요청 정규화.
 * - 요청: 날짜는 P2PDates.WIRE_FORMAT 문자열로 직렬화
 * - 응답: "null"/"Null" 문자열은 JSON null 로 치환
 * - canonical(): 키 정렬된 직렬화(캐시 서명용)
 */
public final class JsonSupport {
    private JsonSupport() {}

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .registerModule(wireDates())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public static ObjectNode object() { return MAPPER.createObjectNode(); }

    public static ArrayNode array() { return MAPPER.createArrayNode(); }

    /** 파싱 실패 시 JsonProcessingException 그대로 전파 */
    public static JsonNode parse(String text) throws JsonProcessingException {
        return MAPPER.readTree(text);
    }

    /** 파싱 실패/빈 본문이면 null */
    public static JsonNode tryParse(String text) {
        if (text == null || text.isBlank()) return null;
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    public static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    /** Map/POJO → 트리. 날짜 직렬화 규칙이 같이 적용된다. */
    public static JsonNode toTree(Object value) {
        if (value == null) return NullNode.getInstance();
        if (value instanceof JsonNode n) return n;
        return MAPPER.valueToTree(value);
    }

    /** 응답 트리의 "null"/"Null" 문자열을 실제 null 로 바꾼다(제자리 수정, 루트는 반환값 사용). */
    public static JsonNode normalize(JsonNode node) {
        if (node == null) return NullNode.getInstance();
        if (node.isTextual()) {
            String s = node.textValue();
            return ("null".equals(s) || "Null".equals(s)) ? NullNode.getInstance() : node;
        }
        if (node instanceof ObjectNode obj) {
            List<String> names = new ArrayList<>();
            obj.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                obj.set(name, normalize(obj.get(name)));
            }
        } else if (node instanceof ArrayNode arr) {
            for (int i = 0; i < arr.size(); i++) {
                arr.set(i, normalize(arr.get(i)));
            }
        }
        return node;
    }

    /** 키를 사전순으로 정렬해 직렬화. 같은 내용이면 필드 순서와 무관하게 같은 문자열. */
    public static String canonical(JsonNode node) {
        return write(sorted(node));
    }

    private static JsonNode sorted(JsonNode node) {
        if (node instanceof ObjectNode obj) {
            List<String> names = new ArrayList<>();
            obj.fieldNames().forEachRemaining(names::add);
            names.sort(null);
            ObjectNode out = MAPPER.createObjectNode();
            for (String name : names) out.set(name, sorted(obj.get(name)));
            return out;
        }
        if (node instanceof ArrayNode arr) {
            ArrayNode out = MAPPER.createArrayNode();
            for (Iterator<JsonNode> it = arr.elements(); it.hasNext(); ) out.add(sorted(it.next()));
            return out;
        }
        return node;
    }

    /** Map 을 얕게 ObjectNode 로 복사(요청 본문 조립용) */
    public static ObjectNode objectOf(Map<String, ?> map) {
        ObjectNode out = object();
        if (map == null) return out;
        for (var e : map.entrySet()) out.set(e.getKey(), toTree(e.getValue()));
        return out;
    }

    // ------------ 날짜 직렬화 ------------
    private static SimpleModule wireDates() {
        SimpleModule m = new SimpleModule("p2p-wire-dates");
        m.addSerializer(Instant.class, new WireDateSerializer<>(Instant.class));
        m.addSerializer(OffsetDateTime.class, new WireDateSerializer<>(OffsetDateTime.class));
        m.addSerializer(ZonedDateTime.class, new WireDateSerializer<>(ZonedDateTime.class));
        return m;
    }

    private static final class WireDateSerializer<T extends TemporalAccessor> extends StdSerializer<T> {
        WireDateSerializer(Class<T> type) { super(type); }

        @Override
        public void serialize(T value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeString(P2PDates.format(value));
        }
    }
}
