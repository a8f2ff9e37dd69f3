package com.david.spring.cache.local.core;

import java.time.Duration;

/**
 * 缓存操作相关常量
 */
public final class CacheConstants {

    private CacheConstants() {}

    // 缓存键分隔符
    public static final String CACHE_KEY_SEPARATOR = ":";

    // 哈希长度（MD5）
    public static final int HASH_LENGTH = 32;

    // 命名空间名称最大长度
    public static final int MAX_NAMESPACE_LENGTH = 50;

    // 命名空间默认容量
    public static final int DEFAULT_MAX_SIZE = 1000;

    // 默认淘汰策略
    public static final String DEFAULT_STRATEGY = "lru";

    // 无法序列化时的估算大小（字节）
    public static final long UNKNOWN_SIZE_BYTES = 1024L;

    // SWR 模式下超过该时长的过期条目优先淘汰
    public static final Duration VERY_STALE_THRESHOLD = Duration.ofHours(1);

    // 事件通道默认容量
    public static final int DEFAULT_EVENT_CHANNEL_CAPACITY = 1024;

    // 内置策略名称
    public static final class Strategies {
        public static final String LRU = "lru";
        public static final String TTL = "ttl";
        public static final String SWR = "swr";

        private Strategies() {}
    }

    // 操作类型常量
    public static final class Operations {
        public static final String ON_EVICT = "on_evict";

        private Operations() {}
    }
}
