package com.david.spring.cache.local.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.Map;

/**
 * 单次写入选项
 *
 * <p>ttl 覆盖命名空间的 defaultTtl；priority 为保留扩展点，内置策略不使用；metadata 为自由标签。
 */
@Value
@Builder
public class SetOptions {

    private static final SetOptions NONE = SetOptions.builder().build();

    @Nullable Duration ttl;

    @Nullable Integer priority;

    @Singular("metadataEntry")
    Map<String, Object> metadata;

    public static SetOptions none() {
        return NONE;
    }

    public static SetOptions ttl(Duration ttl) {
        return SetOptions.builder().ttl(ttl).build();
    }
}
