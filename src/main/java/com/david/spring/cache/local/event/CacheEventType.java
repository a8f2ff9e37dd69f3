package com.david.spring.cache.local.event;

/**
 * 缓存事件类型
 */
public enum CacheEventType {
    /**
     * 容量淘汰
     */
    CACHE_EVICT,

    /**
     * 过期移除（读取时惰性移除或主动清理）
     */
    CACHE_EXPIRED,

    /**
     * SWR 模式下返回了过期值，需要后台刷新
     */
    STALE_REFRESH_TRIGGERED
}
