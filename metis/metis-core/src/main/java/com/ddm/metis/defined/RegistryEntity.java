package com.ddm.metis.defined;

import java.util.List;
import java.util.Map;

/**
 * 注册表实体的公共视图。
 *
 * <p>五类实体（业务流程、KPI、角色画像、数据产品、业务术语）都是不可变的值记录，
 * 共享全局唯一的 {@code id}、名称、分类（domain）、自由标签与开放的元数据映射。
 * 实体之间的关联只以字符串 id 的形式保存在列表中，从不持有对象引用。
 *
 * @author metis
 * @since 1.0
 */
public interface RegistryEntity {

    String id();

    String name();

    String domain();

    List<String> tags();

    Map<String, Object> metadata();

    /**
     * 旧命名体系下的标识，未定义时返回 null。
     */
    default String legacyId() {
        return null;
    }

    /**
     * 展示名称（如 {@code "Finance: Cash Flow Management"}），未定义时返回 null。
     */
    default String displayName() {
        return null;
    }
}
