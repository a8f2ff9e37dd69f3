package com.david.spring.cache.local.strategy.eviction.impl;

import com.david.spring.cache.local.core.CacheConstants;
import com.david.spring.cache.local.core.CacheEntry;
import com.david.spring.cache.local.core.NamespaceConfig;
import com.david.spring.cache.local.event.CacheEvent;
import com.david.spring.cache.local.event.StaleEntryRefreshEvent;
import com.david.spring.cache.local.strategy.eviction.EvictionStrategy;
import com.david.spring.cache.local.strategy.eviction.StrategyContext;
import com.david.spring.cache.local.strategy.eviction.support.AccessOrderIndex;

import lombok.extern.slf4j.Slf4j;

import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * SWR（stale-while-revalidate）淘汰策略
 *
 * <p>条目不会因过期被惰性移除或清理，只会被容量淘汰；读到过期条目时照常返回旧值，
 * 同时返回 {@link StaleEntryRefreshEvent}，存储释放锁后发布，由监听方在后台刷新。
 * 容量淘汰优先选过期超过一小时的条目，否则选最久未使用的条目。
 */
@Slf4j
public class SwrEvictionStrategy implements EvictionStrategy {

    private final String namespace;
    private final Clock clock;
    private final AccessOrderIndex index = new AccessOrderIndex();

    public SwrEvictionStrategy(StrategyContext context) {
        this.namespace = context.namespace();
        this.clock = context.clock();
    }

    @Override
    public String getName() {
        return CacheConstants.Strategies.SWR;
    }

    @Override
    @Nullable
    public CacheEvent onAccess(CacheEntry entry) {
        index.moveToFront(entry.getKey());

        long now = clock.millis();
        if (!entry.isExpiredAt(now)) {
            return null;
        }
        if (log.isDebugEnabled()) {
            log.debug("Serving stale entry, refresh requested: namespace={}, key={}", namespace, entry.getKey());
        }
        return new StaleEntryRefreshEvent(
                namespace, entry.getKey(), Instant.ofEpochMilli(entry.getExpiresAt()), Instant.ofEpochMilli(now));
    }

    @Override
    public void onSet(CacheEntry entry) {
        index.addFirst(entry.getKey());
    }

    @Override
    public void onRemove(String key) {
        index.remove(key);
    }

    @Override
    public boolean shouldEvict(CacheEntry entry, NamespaceConfig config) {
        return false;
    }

    @Override
    @Nullable
    public String selectEvictionCandidate(Map<String, CacheEntry> entries, NamespaceConfig config) {
        long veryStaleThreshold = clock.millis() - CacheConstants.VERY_STALE_THRESHOLD.toMillis();

        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            Long expiresAt = e.getValue().getExpiresAt();
            if (expiresAt != null && expiresAt < veryStaleThreshold) {
                if (log.isDebugEnabled()) {
                    log.debug("SWR evicting very stale entry: namespace={}, key={}", namespace, e.getKey());
                }
                return e.getKey();
            }
        }

        return index.leastRecent();
    }

    @Override
    public void clear() {
        index.clear();
    }
}
