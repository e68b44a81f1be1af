package com.ddm.metis.defined;

import com.ddm.metis.utils.Identifiers;
import com.ddm.metis.utils.Values;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 业务流程定义。
 *
 * <p><strong>字段说明：</strong>
 * <ul>
 *   <li>{@code id}：全局唯一标识，如 {@code finance_cash_flow_management}</li>
 *   <li>{@code domain}：所属业务域，如 {@code Finance}</li>
 *   <li>{@code ownerRole} / {@code stakeholderRoles}：负责角色与相关角色</li>
 *   <li>{@code displayName}：展示名称，缺省为 {@code "<domain>: <name>"}</li>
 * </ul>
 *
 * @author metis
 * @since 1.0
 */
public record BusinessProcess(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("domain") String domain,
        @JsonProperty("description") String description,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("owner_role") String ownerRole,
        @JsonProperty("stakeholder_roles") List<String> stakeholderRoles,
        @JsonProperty("display_name") String displayName,
        @JsonProperty("metadata") Map<String, Object> metadata) implements RegistryEntity {

    private static final String DEFAULT_DOMAIN = "Finance";

    public BusinessProcess {
        if (Identifiers.isBlank(id)) {
            throw new IllegalArgumentException("BusinessProcess id must not be blank");
        }
        name = Values.orDefault(name, Identifiers.humanize(id));
        if (Identifiers.isBlank(displayName) && !Identifiers.isBlank(domain)) {
            displayName = domain + ": " + name;
        }
        tags = Values.list(tags);
        stakeholderRoles = Values.list(stakeholderRoles);
        metadata = Values.map(metadata);
    }

    public static BusinessProcess of(String id, String name, String domain) {
        return new BusinessProcess(id, name, domain, null, null, null, null, null, null);
    }

    /**
     * 由旧式标签构造业务流程，id 由 domain 与 name 确定性推导。
     * <p>{@code "Finance: Cash Flow Management"} → id {@code finance_cash_flow_management}；
     * 不含 {@code ": "} 的标签默认归入 {@code Finance} 域。
     */
    public static BusinessProcess fromLegacyLabel(String label) {
        String domain = DEFAULT_DOMAIN;
        String name = label.trim();
        int sep = name.indexOf(": ");
        if (sep >= 0) {
            domain = name.substring(0, sep).trim();
            name = name.substring(sep + 2).trim();
        }
        String id = Identifiers.slug(domain) + "_" + Identifiers.slug(name);
        return new BusinessProcess(id, name, domain, name + " process",
                List.of(domain.toLowerCase(Locale.ROOT)), null, null, null, null);
    }

    @Override
    public String legacyId() {
        return Identifiers.legacyId(name);
    }

    public BusinessProcess withOwnerRole(String role) {
        return new BusinessProcess(id, name, domain, description, tags, role, stakeholderRoles, displayName, metadata);
    }
}
