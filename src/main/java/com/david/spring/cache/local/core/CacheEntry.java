package com.david.spring.cache.local.core;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 缓存条目
 *
 * <p>值对缓存引擎不透明，元数据由所属的 {@link NamespaceCacheStore} 独占维护。
 * 覆盖写入会创建新的条目，因此 accessCount 从 0 重新计数。
 */
@Getter
@ToString(exclude = "value")
public final class CacheEntry {

    private final String key;
    private final String namespace;
    private final Object value;
    private final long createdAt;
    @Nullable private final Long expiresAt;
    private final long approxSizeBytes;
    @Nullable private final Integer priority;
    private final Map<String, Object> metadata;

    private long accessedAt;
    private long accessCount;

    @Builder
    private CacheEntry(
            String key,
            String namespace,
            Object value,
            long createdAt,
            @Nullable Long expiresAt,
            long approxSizeBytes,
            @Nullable Integer priority,
            @Nullable Map<String, Object> metadata) {
        this.key = Objects.requireNonNull(key, "key");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.value = Objects.requireNonNull(value, "value");
        this.createdAt = createdAt;
        this.accessedAt = createdAt;
        this.expiresAt = expiresAt;
        this.approxSizeBytes = approxSizeBytes;
        this.priority = priority;
        this.metadata =
                metadata == null || metadata.isEmpty()
                        ? Collections.emptyMap()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        this.accessCount = 0;
    }

    /**
     * 记录一次成功读取
     *
     * @param now 当前时间戳（毫秒）
     */
    void recordAccess(long now) {
        this.accessedAt = now;
        this.accessCount++;
    }

    /** 是否设置了过期时间 */
    public boolean hasTtl() {
        return expiresAt != null;
    }

    /**
     * 判断条目在给定时刻是否已过期
     *
     * @param now 当前时间戳（毫秒）
     * @return true=已过期
     */
    public boolean isExpiredAt(long now) {
        return expiresAt != null && now > expiresAt;
    }

    public Instant getCreatedInstant() {
        return Instant.ofEpochMilli(createdAt);
    }
}
