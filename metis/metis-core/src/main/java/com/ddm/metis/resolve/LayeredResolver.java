package com.ddm.metis.resolve;

import com.ddm.metis.codec.EntityCodec;
import com.ddm.metis.defined.RegistryEntity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * 分层配置解析：基础记录 ← 默认层 ← 覆盖层，按顺序应用纯合并函数。
 *
 * <p>每个字段的合并方式由 {@link FieldRule} 声明，未声明的字段按 {@link MergeRule#REPLACE} 处理；
 * {@code id} 字段永远取自基础记录。输入记录不会被修改，结果是新的实体。
 *
 * @param <T> 实体类型
 * @author metis
 * @since 1.0
 */
public class LayeredResolver<T extends RegistryEntity> {

    private static final Logger log = LoggerFactory.getLogger(LayeredResolver.class);

    /**
     * 字段规则。
     *
     * @param rule 合并规则
     * @param key  {@link MergeRule#UNION_BY_KEY} 的键字段，其余规则为 null
     */
    public record FieldRule(MergeRule rule, String key) {

        public static FieldRule of(MergeRule rule) {
            return new FieldRule(rule, null);
        }

        public static FieldRule byKey(String key) {
            return new FieldRule(MergeRule.UNION_BY_KEY, key);
        }
    }

    private static final FieldRule DEFAULT_RULE = FieldRule.of(MergeRule.REPLACE);

    private final EntityCodec<T> codec;
    private final Map<String, FieldRule> rules;

    public LayeredResolver(EntityCodec<T> codec, Map<String, FieldRule> rules) {
        this.codec = codec;
        this.rules = Map.copyOf(rules);
    }

    public T resolve(T base, List<Layer> layers) {
        ObjectNode node = codec.encode(base);
        for (Layer layer : layers) {
            node = apply(node, layer);
            log.trace("Applied layer '{}' to {}", layer.name(), base.id());
        }
        return codec.decode(node);
    }

    ObjectNode apply(ObjectNode current, Layer layer) {
        ObjectNode next = current.deepCopy();
        Iterator<Map.Entry<String, JsonNode>> fields = layer.values().fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> e = fields.next();
            String field = e.getKey();
            JsonNode incoming = e.getValue();
            if ("id".equals(field) || incoming == null || incoming.isNull()) {
                continue;
            }
            JsonNode existing = next.get(field);
            FieldRule rule = rules.getOrDefault(field, DEFAULT_RULE);
            next.set(field, merge(existing, incoming, rule, layer.fillOnly()));
        }
        return next;
    }

    private JsonNode merge(JsonNode existing, JsonNode incoming, FieldRule rule, boolean fillOnly) {
        boolean absent = isEmpty(existing);
        if (absent) {
            return incoming.deepCopy();
        }
        return switch (rule.rule()) {
            case REPLACE -> fillOnly ? existing : incoming.deepCopy();
            case UNION -> union(existing, incoming);
            case UNION_BY_KEY -> unionByKey(existing, incoming, rule.key(), fillOnly);
            case MERGE_MAP -> mergeMap(existing, incoming, fillOnly);
        };
    }

    private static boolean isEmpty(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return true;
        if (node.isContainerNode()) return node.isEmpty();
        return node.isTextual() && node.asText().isEmpty();
    }

    private static JsonNode union(JsonNode existing, JsonNode incoming) {
        if (!existing.isArray() || !incoming.isArray()) {
            return existing;
        }
        ArrayNode out = ((ArrayNode) existing).deepCopy();
        for (JsonNode v : incoming) {
            boolean present = false;
            for (JsonNode have : out) {
                if (have.equals(v)) {
                    present = true;
                    break;
                }
            }
            if (!present) out.add(v.deepCopy());
        }
        return out;
    }

    private static JsonNode unionByKey(JsonNode existing, JsonNode incoming, String key, boolean fillOnly) {
        if (!existing.isArray() || !incoming.isArray()) {
            return existing;
        }
        ArrayNode out = ((ArrayNode) existing).deepCopy();
        for (JsonNode item : incoming) {
            JsonNode k = item.get(key);
            int match = -1;
            for (int i = 0; i < out.size(); i++) {
                if (k != null && k.equals(out.get(i).get(key))) {
                    match = i;
                    break;
                }
            }
            if (match < 0) {
                out.add(item.deepCopy());
            } else if (!fillOnly) {
                out.set(match, item.deepCopy());
            }
        }
        return out;
    }

    private static JsonNode mergeMap(JsonNode existing, JsonNode incoming, boolean fillOnly) {
        if (!existing.isObject() || !incoming.isObject()) {
            return existing;
        }
        ObjectNode out = ((ObjectNode) existing).deepCopy();
        incoming.fields().forEachRemaining(e -> {
            if (!fillOnly || !out.has(e.getKey())) {
                out.set(e.getKey(), e.getValue().deepCopy());
            }
        });
        return out;
    }
}
