package com.david.spring.cache.local.event;

import com.david.spring.cache.local.core.CacheEntry;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 条目被淘汰或过期移除，携带条目移除前的最后状态
 */
@Getter
@ToString(callSuper = true)
public class EntryRemovedEvent extends CacheEvent {

    private final CacheEventType eventType;
    @ToString.Exclude private final CacheEntry entry;

    private EntryRemovedEvent(CacheEventType eventType, CacheEntry entry, Instant timestamp) {
        super(entry.getNamespace(), entry.getKey(), timestamp);
        this.eventType = eventType;
        this.entry = entry;
    }

    public static EntryRemovedEvent evicted(CacheEntry entry, Instant timestamp) {
        return new EntryRemovedEvent(CacheEventType.CACHE_EVICT, entry, timestamp);
    }

    public static EntryRemovedEvent expired(CacheEntry entry, Instant timestamp) {
        return new EntryRemovedEvent(CacheEventType.CACHE_EXPIRED, entry, timestamp);
    }
}
