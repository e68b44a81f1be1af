package com.ddm.metis.provider;

/**
 * 业务术语翻译结果。
 *
 * @param resolved      是否找到技术字段名
 * @param technicalName 目标系统中的技术字段名，未解析时为 null
 * @param canonicalTerm 术语的规范名称（小写），术语未知时为 null
 * @author metis
 * @since 1.0
 */
public record TermTranslation(boolean resolved, String technicalName, String canonicalTerm) {
}
