package com.david.spring.cache.local.event;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 缓存事件基类
 */
@Getter
@ToString
public abstract class CacheEvent {
    private final String namespace;
    private final String key;
    private final Instant timestamp;

    protected CacheEvent(String namespace, String key, Instant timestamp) {
        this.namespace = namespace;
        this.key = key;
        this.timestamp = timestamp;
    }

    /**
     * 获取事件类型
     */
    public abstract CacheEventType getEventType();
}
