package com.ddm.metis.source;

import com.ddm.metis.codec.EntityCodec;
import com.ddm.metis.codec.EntityCodecs;
import com.ddm.metis.defined.RegistryEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 远程 REST 关系存储数据源（PostgREST / Supabase 风格）。
 *
 * <p><strong>接口约定：</strong>
 * <ul>
 *   <li>读取：{@code GET {endpoint}?select=*}，返回扁平行对象数组</li>
 *   <li>写入：{@code POST {endpoint}}，头部 {@code Prefer: resolution=merge-duplicates}</li>
 *   <li>删除：{@code DELETE {endpoint}?id=eq.{id}}；清空：{@code DELETE {endpoint}?id=not.is.null}</li>
 *   <li>每个请求携带 {@code apikey} 与 {@code Authorization: Bearer} 头</li>
 * </ul>
 *
 * <p>所有请求带有界超时，内部不重试：超时或非 2xx 响应即抛出 {@link RegistrySourceException}。
 *
 * <p>行格式：设置了 {@code payloadColumn} 时按两层模型读写（提升列 + 载荷列），
 * 否则整行即实体字段。读取时行内出现载荷列也按两层模型解码。
 *
 * @author metis
 * @since 1.0
 */
public class RestRegistrySource<T extends RegistryEntity> implements WritableRegistrySource<T> {

    private static final Logger log = LoggerFactory.getLogger(RestRegistrySource.class);

    private static final int BODY_SNIPPET = 200;

    private final HttpClient http;
    private final String endpoint;
    private final String apiKey;
    private final Duration timeout;
    private final EntityCodec<T> codec;
    private final String payloadColumn;

    /**
     * @param http          共享的 HTTP 客户端
     * @param endpoint      表的完整地址，如 {@code https://x.supabase.co/rest/v1/kpis}
     * @param apiKey        API key，可以为 null
     * @param timeout       单次请求超时
     * @param codec         实体编解码
     * @param payloadColumn 载荷列名，为 null 时使用扁平行
     */
    public RestRegistrySource(HttpClient http, String endpoint, String apiKey, Duration timeout,
                              EntityCodec<T> codec, String payloadColumn) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("Missing required config: remote endpoint");
        }
        this.http = http;
        this.endpoint = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.apiKey = apiKey;
        this.timeout = timeout;
        this.codec = codec;
        this.payloadColumn = payloadColumn;
    }

    @Override
    public String type() {
        return "remote";
    }

    public String endpoint() {
        return endpoint;
    }

    @Override
    public List<T> loadAll() {
        JsonNode rows = send(request(endpoint + "?select=*").GET().build());
        if (rows == null || !rows.isArray()) {
            throw new RegistrySourceException("Unexpected response from " + endpoint + ": expected a JSON array");
        }
        List<T> entities = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            try {
                entities.add(decodeRow(row));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed row from {}: {}", endpoint, e.getMessage());
            }
        }
        log.debug("Fetched {} rows from {}", entities.size(), endpoint);
        return entities;
    }

    private T decodeRow(JsonNode row) {
        String column = payloadColumn != null ? payloadColumn : JdbcRegistrySource.PAYLOAD_COLUMN;
        JsonNode payload = row.get(column);
        if (payload == null || payload.isNull()) {
            return codec.decode(row);
        }
        Map<String, Object> promoted = new HashMap<>();
        for (String field : codec.promotedFields()) {
            JsonNode v = row.get(field);
            if (v != null && !v.isNull()) promoted.put(field, v.asText());
        }
        return codec.decode(payload.isTextual() ? payload.asText() : payload.toString(), promoted);
    }

    @Override
    public void upsert(T entity) {
        ArrayNode body = EntityCodecs.JSON.createArrayNode();
        body.add(encodeRow(entity));
        try {
            send(request(endpoint)
                    .header("Content-Type", "application/json")
                    .header("Prefer", "resolution=merge-duplicates")
                    .POST(HttpRequest.BodyPublishers.ofString(EntityCodecs.JSON.writeValueAsString(body)))
                    .build());
        } catch (JsonProcessingException e) {
            throw new RegistrySourceException("Failed to encode " + entity.id(), e);
        }
    }

    private ObjectNode encodeRow(T entity) {
        if (payloadColumn == null) {
            return codec.encode(entity);
        }
        ObjectNode row = EntityCodecs.JSON.createObjectNode();
        codec.promote(entity).forEach((k, v) -> row.put(k, String.valueOf(v)));
        row.set(payloadColumn, codec.encode(entity));
        return row;
    }

    @Override
    public boolean delete(String id) {
        String url = endpoint + "?id=eq." + URLEncoder.encode(id, StandardCharsets.UTF_8);
        JsonNode deleted = send(request(url)
                .header("Prefer", "return=representation")
                .DELETE()
                .build());
        return deleted != null && deleted.isArray() && !deleted.isEmpty();
    }

    @Override
    public void truncate() {
        send(request(endpoint + "?id=not.is.null").DELETE().build());
        log.info("Truncated remote registry {}", endpoint);
    }

    private HttpRequest.Builder request(String url) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .header("Accept", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("apikey", apiKey)
                    .header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private JsonNode send(HttpRequest req) {
        HttpResponse<String> res;
        try {
            res = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new RegistrySourceException(req.method() + " " + req.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistrySourceException(req.method() + " " + req.uri() + " interrupted", e);
        }
        if (res.statusCode() < 200 || res.statusCode() >= 300) {
            String body = res.body();
            String bodySnippet = body != null && body.length() > BODY_SNIPPET
                    ? body.substring(0, BODY_SNIPPET) + "..."
                    : body;
            throw new RegistrySourceException("HTTP request failed with status " + res.statusCode()
                    + " for " + req.method() + " " + req.uri() + " | body: " + bodySnippet);
        }
        String body = res.body();
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return EntityCodecs.JSON.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RegistrySourceException("Invalid JSON from " + req.uri(), e);
        }
    }
}
