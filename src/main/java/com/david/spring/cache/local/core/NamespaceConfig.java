package com.david.spring.cache.local.core;

import lombok.Builder;
import lombok.Value;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.function.Consumer;

/**
 * 命名空间配置
 *
 * <p>字段均可为空，便于按 "常量默认值 -> 全局默认 -> 预置命名空间配置 -> 调用方配置" 逐层合并。
 * 命名空间创建后配置即固定，后续不同的配置不会重新生效（先写者生效）。
 */
@Value
@Builder(toBuilder = true)
public class NamespaceConfig {

    /** 最大条目数，必须大于 0 */
    @Nullable Integer maxSize;

    /** 默认 TTL，为空表示不过期 */
    @Nullable Duration defaultTtl;

    /** 淘汰策略名称 */
    @Nullable String strategy;

    /** 是否统计命中/未命中等计数 */
    @Nullable Boolean enableStats;

    /** 容量淘汰回调，异常会被捕获并记录，不影响写入 */
    @Nullable Consumer<CacheEntry> onEvict;

    public static NamespaceConfig empty() {
        return NamespaceConfig.builder().build();
    }

    /**
     * 与覆盖配置合并，覆盖配置中的非空字段优先
     *
     * @param override 覆盖配置，可为空
     * @return 合并后的新配置
     */
    public NamespaceConfig mergedWith(@Nullable NamespaceConfig override) {
        if (override == null) {
            return this;
        }
        return NamespaceConfig.builder()
                .maxSize(override.maxSize != null ? override.maxSize : maxSize)
                .defaultTtl(override.defaultTtl != null ? override.defaultTtl : defaultTtl)
                .strategy(override.strategy != null ? override.strategy : strategy)
                .enableStats(override.enableStats != null ? override.enableStats : enableStats)
                .onEvict(override.onEvict != null ? override.onEvict : onEvict)
                .build();
    }

    /**
     * 用常量默认值补齐空字段
     *
     * @return 所有必填字段均非空的配置
     */
    public NamespaceConfig withDefaults() {
        return toBuilder()
                .maxSize(maxSize != null ? maxSize : CacheConstants.DEFAULT_MAX_SIZE)
                .strategy(strategy != null ? strategy : CacheConstants.DEFAULT_STRATEGY)
                .enableStats(enableStats == null || enableStats)
                .build();
    }

    public int maxSizeOrDefault() {
        return maxSize != null ? maxSize : CacheConstants.DEFAULT_MAX_SIZE;
    }

    public String strategyOrDefault() {
        return strategy != null ? strategy : CacheConstants.DEFAULT_STRATEGY;
    }

    public boolean statsEnabled() {
        return enableStats == null || enableStats;
    }
}
