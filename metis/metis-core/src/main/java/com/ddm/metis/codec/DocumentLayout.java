package com.ddm.metis.codec;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 注册表文件的文档布局，按声明解码一次，不在运行时猜测形状。
 *
 * <p><strong>布局种类：</strong>
 * <ul>
 *   <li>{@link Kind#LIST}：顶层为实体序列，每个实体自带 {@code id}</li>
 *   <li>{@link Kind#KEYED}：顶层为映射，键在值缺少 {@code id} 时成为实体 id</li>
 *   <li>{@link Kind#WRAPPED}：实体集合包在某个键下（如 {@code kpis:}），内层布局为 LIST 或 KEYED</li>
 *   <li>{@link Kind#CONTRACT}：整个文档是一个实体，缺省 id 取文件名（不含扩展名）</li>
 * </ul>
 *
 * <pre>{@code
 * DocumentLayout layout = DocumentLayout.wrapped("kpis", DocumentLayout.list());
 * List<DocumentLayout.Entry> entries = layout.entries(root, "kpi_registry");
 * }</pre>
 *
 * @param kind       布局种类
 * @param wrapperKey {@link Kind#WRAPPED} 时的包装键，其余为 null
 * @param inner      {@link Kind#WRAPPED} 时的内层布局，其余为 null
 * @author metis
 * @since 1.0
 */
public record DocumentLayout(Kind kind, String wrapperKey, DocumentLayout inner) {

    public enum Kind {LIST, KEYED, WRAPPED, CONTRACT}

    /**
     * 布局展开后的单个实体节点。
     *
     * @param defaultId 节点缺少 id 时使用的 id，可以为 null
     * @param node      实体节点
     */
    public record Entry(String defaultId, JsonNode node) {
    }

    public DocumentLayout {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.WRAPPED) {
            Objects.requireNonNull(wrapperKey, "wrapperKey");
            Objects.requireNonNull(inner, "inner");
            if (inner.kind() != Kind.LIST && inner.kind() != Kind.KEYED) {
                throw new IllegalArgumentException("Wrapped layout must contain a list or keyed layout");
            }
        }
    }

    public static DocumentLayout list() {
        return new DocumentLayout(Kind.LIST, null, null);
    }

    public static DocumentLayout keyed() {
        return new DocumentLayout(Kind.KEYED, null, null);
    }

    public static DocumentLayout contract() {
        return new DocumentLayout(Kind.CONTRACT, null, null);
    }

    public static DocumentLayout wrapped(String key, DocumentLayout inner) {
        return new DocumentLayout(Kind.WRAPPED, key, inner);
    }

    /**
     * 从配置值解析布局：{@code list}、{@code keyed}、{@code contract}、{@code wrapped}
     * （内层为 list）或 {@code wrapped-keyed}。
     *
     * @throws IllegalArgumentException 无法识别的布局，或包装布局缺少包装键
     */
    public static DocumentLayout parse(String value, String wrapperKey) {
        String v = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "list" -> list();
            case "keyed" -> keyed();
            case "contract" -> contract();
            case "wrapped", "wrapped-list" -> wrapped(requireKey(wrapperKey), list());
            case "wrapped-keyed" -> wrapped(requireKey(wrapperKey), keyed());
            default -> throw new IllegalArgumentException("Unknown document layout: " + value);
        };
    }

    private static String requireKey(String wrapperKey) {
        if (wrapperKey == null || wrapperKey.isBlank()) {
            throw new IllegalArgumentException("Wrapped layout requires a wrapper-key");
        }
        return wrapperKey;
    }

    /**
     * 按布局展开文档。
     *
     * @param root         文档根节点
     * @param documentName 文档名（文件名去扩展名），用于 CONTRACT 布局的缺省 id
     * @throws IllegalArgumentException 文档与声明的布局不符
     */
    public List<Entry> entries(JsonNode root, String documentName) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        return switch (kind) {
            case LIST -> {
                if (!root.isArray()) throw mismatch("a sequence", root);
                List<Entry> out = new ArrayList<>(root.size());
                root.forEach(n -> out.add(new Entry(null, n)));
                yield out;
            }
            case KEYED -> {
                if (!root.isObject()) throw mismatch("a mapping", root);
                List<Entry> out = new ArrayList<>(root.size());
                Iterator<Map.Entry<String, JsonNode>> it = root.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    out.add(new Entry(e.getKey(), e.getValue()));
                }
                yield out;
            }
            case WRAPPED -> {
                if (!root.isObject()) throw mismatch("a mapping with key '" + wrapperKey + "'", root);
                yield inner.entries(root.get(wrapperKey), documentName);
            }
            case CONTRACT -> {
                if (!root.isObject()) throw mismatch("a mapping", root);
                yield List.of(new Entry(documentName, root));
            }
        };
    }

    private IllegalArgumentException mismatch(String expected, JsonNode actual) {
        return new IllegalArgumentException("Document does not match layout " + this
                + ": expected " + expected + " but found " + actual.getNodeType());
    }

    @Override
    public String toString() {
        return kind == Kind.WRAPPED ? "wrapped(" + wrapperKey + ", " + inner + ")" : kind.name().toLowerCase(Locale.ROOT);
    }
}
