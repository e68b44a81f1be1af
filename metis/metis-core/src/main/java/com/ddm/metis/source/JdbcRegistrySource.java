package com.ddm.metis.source;

import com.ddm.metis.codec.EntityCodec;
import com.ddm.metis.defined.RegistryEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 通用两层数据库表数据源：提升列 + {@code definition} 载荷列。
 *
 * <p><strong>表结构（以 KPI 为例）：</strong>
 * <pre>{@code
 * CREATE TABLE kpis (
 *   id         VARCHAR(255) NOT NULL,
 *   name       VARCHAR(255),
 *   domain     VARCHAR(255),
 *   owner_role VARCHAR(255),
 *   definition TEXT,            -- 完整实体 JSON
 *   PRIMARY KEY (id)
 * );
 * }</pre>
 *
 * <p><strong>读写规则：</strong>
 * <ul>
 *   <li>读取：解码 {@code definition}，再用非空提升列覆盖对应字段</li>
 *   <li>写入：完整实体编码进 {@code definition}，并从编码结果抽取提升列</li>
 *   <li>upsert 以声明的键字段（默认 {@code id}）判定冲突，按方言选择 MERGE / ON CONFLICT /
 *       ON DUPLICATE KEY，未知方言退化为先 UPDATE 后 INSERT</li>
 *   <li>{@code initTable=true} 时按方言执行 {@code CREATE TABLE IF NOT EXISTS}</li>
 * </ul>
 *
 * <p>DataSource 的生命周期由外部管理，本类不负责关闭。
 *
 * @author metis
 * @since 1.0
 */
public class JdbcRegistrySource<T extends RegistryEntity> implements WritableRegistrySource<T> {

    private static final Logger log = LoggerFactory.getLogger(JdbcRegistrySource.class);

    public static final String PAYLOAD_COLUMN = "definition";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");

    /**
     * 各方言的 SQL 模板。
     *
     * <p>Key 格式：{dialect}:{statement}；占位符依次为 表名、列定义/列清单、键列 等。
     */
    private static final Map<String, String> SQL_TEMPLATES = Map.of(
            "h2:create", """
                    CREATE TABLE IF NOT EXISTS %s (
                        %s,
                        definition CLOB,
                        PRIMARY KEY (%s)
                    )
                    """,
            "h2:upsert", "MERGE INTO %s (%s) KEY (%s) VALUES (%s)",
            "postgresql:create", """
                    CREATE TABLE IF NOT EXISTS %s (
                        %s,
                        definition TEXT,
                        PRIMARY KEY (%s)
                    )
                    """,
            "postgresql:upsert", "INSERT INTO %s (%s) VALUES (%s) ON CONFLICT (%s) DO UPDATE SET %s",
            "mysql:create", """
                    CREATE TABLE IF NOT EXISTS %s (
                        %s,
                        definition LONGTEXT,
                        PRIMARY KEY (%s)
                    ) ENGINE=InnoDB DEFAULT CHARSET=utf8mb4
                    """,
            "mysql:upsert", "INSERT INTO %s (%s) VALUES (%s) ON DUPLICATE KEY UPDATE %s"
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final String table;
    private final EntityCodec<T> codec;
    private final List<String> keyFields;
    private final List<String> columns;
    private volatile String dialect;

    public JdbcRegistrySource(DataSource dataSource, String table, EntityCodec<T> codec) {
        this(dataSource, table, codec, List.of("id"), false);
    }

    /**
     * @param dataSource 数据源，不能为 null
     * @param table      表名，只允许标识符字符
     * @param codec      实体编解码与提升列声明
     * @param keyFields  upsert 的键字段，为空时使用 {@code id}
     * @param initTable  是否自动建表
     */
    public JdbcRegistrySource(DataSource dataSource, String table, EntityCodec<T> codec,
                              List<String> keyFields, boolean initTable) {
        if (table == null || !IDENTIFIER.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid registry table name: " + table);
        }
        this.jdbc = new NamedParameterJdbcTemplate(dataSource);
        this.table = table;
        this.codec = codec;
        this.keyFields = keyFields == null || keyFields.isEmpty() ? List.of("id") : List.copyOf(keyFields);
        Set<String> cols = new LinkedHashSet<>(this.keyFields);
        cols.addAll(codec.promotedFields());
        for (String c : cols) {
            if (!IDENTIFIER.matcher(c).matches()) {
                throw new IllegalArgumentException("Invalid column name: " + c);
            }
        }
        this.columns = List.copyOf(cols);
        if (initTable) {
            ensureTable();
        }
    }

    @Override
    public String type() {
        return "database";
    }

    public String table() {
        return table;
    }

    @Override
    public List<T> loadAll() {
        String sql = "SELECT * FROM " + table;
        try {
            List<T> entities = new ArrayList<>();
            jdbc.getJdbcTemplate().query(sql, rs -> {
                Set<String> labels = columnLabels(rs.getMetaData());
                while (rs.next()) {
                    T entity = mapRow(rs, labels);
                    if (entity != null) entities.add(entity);
                }
                return null;
            });
            log.debug("Loaded {} rows from table {}", entities.size(), table);
            return entities;
        } catch (DataAccessException e) {
            throw new RegistrySourceException("Failed to query registry table: " + table, e);
        }
    }

    private T mapRow(ResultSet rs, Set<String> labels) throws SQLException {
        Map<String, Object> promoted = new HashMap<>();
        for (String field : codec.promotedFields()) {
            if (labels.contains(field)) {
                promoted.put(field, rs.getString(field));
            }
        }
        String payload = labels.contains(PAYLOAD_COLUMN) ? rs.getString(PAYLOAD_COLUMN) : null;
        try {
            return codec.decode(payload, promoted);
        } catch (IllegalArgumentException e) {
            log.warn("Skipping malformed row in {} (id={}): {}", table, promoted.get("id"), e.getMessage());
            return null;
        }
    }

    private static Set<String> columnLabels(ResultSetMetaData md) throws SQLException {
        Set<String> labels = new HashSet<>();
        for (int i = 1; i <= md.getColumnCount(); i++) {
            labels.add(md.getColumnLabel(i).toLowerCase(Locale.ROOT));
        }
        return labels;
    }

    @Override
    public void upsert(T entity) {
        Map<String, Object> promoted = codec.promote(entity);
        MapSqlParameterSource params = new MapSqlParameterSource();
        for (String c : columns) {
            params.addValue(c, promoted.get(c));
        }
        params.addValue(PAYLOAD_COLUMN, codec.encodeToString(entity));
        try {
            String dbType = dialect();
            String template = SQL_TEMPLATES.get(dbType + ":upsert");
            if (template == null) {
                updateThenInsert(params);
            } else {
                jdbc.update(upsertSql(dbType, template), params);
            }
            log.debug("Upserted {} into {}", entity.id(), table);
        } catch (DataAccessException e) {
            throw new RegistrySourceException("Failed to upsert " + entity.id() + " into " + table, e);
        }
    }

    private String upsertSql(String dbType, String template) {
        List<String> all = new ArrayList<>(columns);
        all.add(PAYLOAD_COLUMN);
        String cols = String.join(", ", all);
        String values = all.stream().map(c -> ":" + c).collect(Collectors.joining(", "));
        String keys = String.join(", ", keyFields);
        List<String> updatable = all.stream().filter(c -> !keyFields.contains(c)).toList();
        return switch (dbType) {
            case "h2" -> template.formatted(table, cols, keys, values);
            case "postgresql" -> template.formatted(table, cols, values, keys,
                    updatable.stream().map(c -> c + " = EXCLUDED." + c).collect(Collectors.joining(", ")));
            case "mysql" -> template.formatted(table, cols, values,
                    updatable.stream().map(c -> c + " = VALUES(" + c + ")").collect(Collectors.joining(", ")));
            default -> throw new IllegalStateException("No upsert template for " + dbType);
        };
    }

    private void updateThenInsert(MapSqlParameterSource params) {
        List<String> all = new ArrayList<>(columns);
        all.add(PAYLOAD_COLUMN);
        String set = all.stream().filter(c -> !keyFields.contains(c))
                .map(c -> c + " = :" + c).collect(Collectors.joining(", "));
        String where = keyFields.stream().map(k -> k + " = :" + k).collect(Collectors.joining(" AND "));
        int updated = jdbc.update("UPDATE " + table + " SET " + set + " WHERE " + where, params);
        if (updated == 0) {
            jdbc.update("INSERT INTO " + table + " (" + String.join(", ", all) + ") VALUES ("
                    + all.stream().map(c -> ":" + c).collect(Collectors.joining(", ")) + ")", params);
        }
    }

    @Override
    public boolean delete(String id) {
        try {
            return jdbc.update("DELETE FROM " + table + " WHERE id = :id",
                    new MapSqlParameterSource("id", id)) > 0;
        } catch (DataAccessException e) {
            throw new RegistrySourceException("Failed to delete " + id + " from " + table, e);
        }
    }

    @Override
    public void truncate() {
        try {
            int removed = jdbc.getJdbcTemplate().update("DELETE FROM " + table);
            log.info("Truncated registry table {} ({} rows)", table, removed);
        } catch (DataAccessException e) {
            throw new RegistrySourceException("Failed to truncate " + table, e);
        }
    }

    /**
     * 确保表结构存在（幂等执行）。失败时记录告警，不影响主流程。
     */
    private void ensureTable() {
        try {
            String dbType = dialect();
            String template = SQL_TEMPLATES.get(dbType + ":create");
            if (template == null) {
                log.warn("Unsupported database dialect: {}, table creation skipped for {}", dbType, table);
                return;
            }
            String colDefs = columns.stream()
                    .map(c -> c + " VARCHAR(255)" + (keyFields.contains(c) ? " NOT NULL" : ""))
                    .collect(Collectors.joining(",\n    "));
            jdbc.getJdbcTemplate().execute(template.formatted(table, colDefs, String.join(", ", keyFields)));
            log.info("Ensured registry table {} ({})", table, dbType);
        } catch (DataAccessException e) {
            log.warn("Failed to ensure registry table {} (may already exist).", table, e);
        }
    }

    private String dialect() {
        String d = dialect;
        if (d == null) {
            String url = jdbc.getJdbcTemplate().execute(
                    (ConnectionCallback<String>) con -> con.getMetaData().getURL());
            d = detectDatabaseType(url == null ? "" : url);
            dialect = d;
        }
        return d;
    }

    /**
     * 根据数据库 URL 检测方言：h2、postgresql、mysql，其余返回 generic。
     */
    static String detectDatabaseType(String url) {
        String lowerUrl = url.toLowerCase(Locale.ROOT);
        if (lowerUrl.contains(":h2:")) {
            return "h2";
        } else if (lowerUrl.contains(":postgresql:")) {
            return "postgresql";
        } else if (lowerUrl.contains(":mysql:") || lowerUrl.contains(":mariadb:")) {
            return "mysql";
        }
        return "generic";
    }
}
