package com.david.spring.cache.local.event;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 过期值已被返回，调用方应在后台刷新该键
 */
@Getter
@ToString(callSuper = true)
public class StaleEntryRefreshEvent extends CacheEvent {

    /** 条目原定的过期时间 */
    private final Instant expiredAt;

    public StaleEntryRefreshEvent(String namespace, String key, Instant expiredAt, Instant timestamp) {
        super(namespace, key, timestamp);
        this.expiredAt = expiredAt;
    }

    @Override
    public CacheEventType getEventType() {
        return CacheEventType.STALE_REFRESH_TRIGGERED;
    }
}
