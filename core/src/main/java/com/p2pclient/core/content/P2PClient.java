package com.p2pclient.core.content;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p2pclient.core.batch.Batcher;
import com.p2pclient.core.error.ErrorClassifier;
import com.p2pclient.core.error.ErrorKind;
import com.p2pclient.core.error.P2PException;
import com.p2pclient.core.http.RequestDispatcher;
import com.p2pclient.core.model.ConnectionConfig;
import com.p2pclient.core.model.RequestSpec;
import com.p2pclient.core.util.DefaultSleeper;
import com.p2pclient.core.util.JsonSupport;
import com.p2pclient.core.util.P2PDates;
import com.p2pclient.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 콘텐츠 아이템용 얇은 협력자. 동사 + 경로 + 페이로드만 정해서 디스패처에 넘긴다.
 * 필드 이름은 해석하지 않고 JSON 그대로 통과시킨다.
 */
public class P2PClient {

    private static final Logger LOG = LoggerFactory.getLogger(P2PClient.class);

    public static final String MULTI_PATH = "/content_items/multi.json";
    public static final String CREATE_PATH = "/content_items.json";
    public static final String SEARCH_PATH = "/content_items/search.json";

    /** update 가 404 일 때 create 전에 기다리는 시간 */
    public static final Duration CREATE_AFTER_MISS_DELAY = Duration.ofSeconds(2);

    private final RequestDispatcher dispatcher;
    private final Batcher batcher;
    private final Sleeper sleeper;
    private final Map<String, Object> contentItemDefaults;

    public P2PClient(ConnectionConfig config) {
        this(new RequestDispatcher(config));
    }

    public P2PClient(RequestDispatcher dispatcher) {
        this(dispatcher, new Batcher(), DefaultSleeper.INSTANCE, Map.of());
    }

    /**
     * @param contentItemDefaults create 시 아이템 필드 앞에 깔리는 기본값(아이템 쪽이 우선)
     */
    public P2PClient(RequestDispatcher dispatcher, Batcher batcher, Sleeper sleeper,
                     Map<String, ?> contentItemDefaults) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.batcher = Objects.requireNonNull(batcher, "batcher");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.contentItemDefaults = new LinkedHashMap<>(Objects.requireNonNull(contentItemDefaults, "contentItemDefaults"));
    }

    public RequestDispatcher dispatcher() { return dispatcher; }

    // ---------- 범용 ----------
    public JsonNode execute(RequestSpec spec) {
        return dispatcher.execute(spec);
    }

    public JsonNode get(String path, Map<String, ?> query, boolean forceUpdate) {
        return execute(RequestSpec.get(path).query(query).forceUpdate(forceUpdate).build());
    }

    public JsonNode post(String path, Object body) {
        return execute(RequestSpec.post(path).body(body).build());
    }

    public JsonNode put(String path, Object body) {
        return execute(RequestSpec.put(path).body(body).build());
    }

    public JsonNode delete(String path) {
        return execute(RequestSpec.delete(path).build());
    }

    // ---------- content items ----------

    /** slug 로 단건 조회. query 가 비면 기본 쿼리(include[]=web_url) */
    public JsonNode getContentItem(String slug, Map<String, ?> query, boolean forceUpdate) {
        RequestSpec spec = RequestSpec.get(itemPath(slug))
                .query(queryOrDefault(query))
                .forceUpdate(forceUpdate)
                .build();
        JsonNode resp = execute(spec);
        JsonNode ci = resp.get("content_item");
        if (ci == null || ci.isNull()) {
            throw dispatcher.classifier().malformed(spec, JsonSupport.write(resp), "response has no content_item");
        }
        return ci;
    }

    /**
     * id 목록으로 대량 조회(multi 엔드포인트, 25개씩).
     * 결과는 ids 와 같은 길이/순서이며 없는 항목(404/304)은 null.
     */
    public List<JsonNode> getMultiContentItems(List<Long> ids, Map<String, ?> query, boolean forceUpdate) {
        Map<String, Object> q = queryOrDefault(query);
        return batcher.fetchAll(ids, chunk -> fetchMultiChunk(chunk, q, forceUpdate));
    }

    private Map<Long, JsonNode> fetchMultiChunk(List<Long> chunk, Map<String, Object> query, boolean forceUpdate) {
        ObjectNode body = JsonSupport.objectOf(query);
        ArrayNode items = body.putArray("content_items");
        String since = P2PDates.format(P2PDates.EPOCH_1900);
        for (Long id : chunk) {
            items.addObject().put("id", id).put("if_modified_since", since);
        }
        RequestSpec spec = RequestSpec.post(MULTI_PATH)
                .body(body)
                .read(true)
                .forceUpdate(forceUpdate)
                .build();

        JsonNode resp = execute(spec);
        if (!resp.isArray()) {
            throw dispatcher.classifier().malformed(spec, JsonSupport.write(resp), "multi response is not an array");
        }

        Map<Long, JsonNode> out = new LinkedHashMap<>();
        for (JsonNode entry : resp) {
            int status = entry.path("status").asInt(-1);
            JsonNode id = entry.get("id");
            switch (status) {
                case 200 -> {
                    JsonNode ci = entry.path("body").path("content_item");
                    long key = (id != null && id.canConvertToLong()) ? id.asLong() : ci.path("id").asLong();
                    out.put(key, ci);
                }
                case 404 -> LOG.debug("Content item {} doesn't exist", id);
                case 304 -> LOG.debug("Content item {} hasn't changed", id);
                default -> throw dispatcher.classifier().itemFailure(spec, status, id == null ? "?" : id.asText());
            }
        }
        return out;
    }

    /** 새 아이템 생성. 기본값 위에 아이템 필드를 덮어쓴다. */
    public JsonNode createContentItem(Map<String, ?> contentItem) {
        Objects.requireNonNull(contentItem, "contentItem");
        ObjectNode content = JsonSupport.objectOf(contentItemDefaults);
        content.setAll(JsonSupport.objectOf(contentItem));
        return post(CREATE_PATH, wrap(content));
    }

    /**
     * 아이템 갱신. slug 가 null 이면 아이템의 slug 필드를 꺼내 경로로 쓰고 본문에서는 뺀다.
     * slug 를 따로 주면 아이템의 slug 필드는 새 slug 로 전송된다(이름 변경).
     */
    public JsonNode updateContentItem(Map<String, ?> contentItem, String slug) {
        Objects.requireNonNull(contentItem, "contentItem");
        ObjectNode content = JsonSupport.objectOf(contentItem);
        if (slug == null) {
            JsonNode s = content.remove("slug");
            if (s == null || s.isNull() || s.asText().isBlank()) {
                throw new IllegalArgumentException("content item has no slug and none was given");
            }
            slug = s.asText();
        }
        return put(itemPath(slug), wrap(content));
    }

    /** update 를 먼저 시도하고 NOT_FOUND 면 잠시 기다렸다가 create */
    public CreateOrUpdateResult createOrUpdateContentItem(Map<String, ?> contentItem) {
        try {
            return new CreateOrUpdateResult(false, updateContentItem(contentItem, null));
        } catch (P2PException e) {
            if (!e.is(ErrorKind.NOT_FOUND)) throw e;
            LOG.info("Content item not found on update, creating it: {}", contentItem.get("slug"));
        }
        try {
            sleeper.sleep(CREATE_AFTER_MISS_DELAY);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw ErrorClassifier.interrupted("create after missed update", ie);
        }
        return new CreateOrUpdateResult(true, createContentItem(contentItem));
    }

    /** 상태를 junk 로 바꾼다 */
    public JsonNode junkContentItem(String slug) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("slug", Objects.requireNonNull(slug, "slug"));
        item.put("content_item_state_code", "junk");
        return updateContentItem(item, null);
    }

    public JsonNode search(Map<String, ?> params) {
        return get(SEARCH_PATH, params, false);
    }

    /** created=true 면 create 경로로 저장됨 */
    public record CreateOrUpdateResult(boolean created, JsonNode response) {}

    // ------------ helpers ------------
    private ObjectNode wrap(ObjectNode content) {
        ObjectNode d = JsonSupport.object();
        d.set("content_item", content);
        if (dispatcher.config().isPreserveEmbeddedTags()) {
            d.put("preserve_embedded_tags", true);
        }
        return d;
    }

    private Map<String, Object> queryOrDefault(Map<String, ?> query) {
        if (query == null || query.isEmpty()) return new LinkedHashMap<>(dispatcher.config().getDefaultContentItemQuery());
        return new LinkedHashMap<>(query);
    }

    private static String itemPath(String slug) {
        Objects.requireNonNull(slug, "slug");
        if (slug.isBlank() || slug.contains("/")) throw new IllegalArgumentException("invalid slug: " + slug);
        return "/content_items/" + slug + ".json";
    }
}
