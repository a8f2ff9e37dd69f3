package com.david.spring.cache.local.generator;

import org.springframework.lang.Nullable;

/**
 * 结构化缓存键的分解结果
 *
 * @param entityType 实体类型
 * @param entityId 实体ID
 * @param paramsHash 参数摘要，无参数时为空
 */
public record ParsedKey(String entityType, String entityId, @Nullable String paramsHash) {

    public ParsedKey(String entityType, String entityId) {
        this(entityType, entityId, null);
    }

    public boolean hasParams() {
        return paramsHash != null;
    }
}
