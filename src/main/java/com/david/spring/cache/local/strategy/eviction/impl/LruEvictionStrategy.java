package com.david.spring.cache.local.strategy.eviction.impl;

import com.david.spring.cache.local.core.CacheConstants;
import com.david.spring.cache.local.core.CacheEntry;
import com.david.spring.cache.local.core.NamespaceConfig;
import com.david.spring.cache.local.event.CacheEvent;
import com.david.spring.cache.local.strategy.eviction.EvictionStrategy;
import com.david.spring.cache.local.strategy.eviction.StrategyContext;
import com.david.spring.cache.local.utils.CacheUtil;
import com.david.spring.cache.local.strategy.eviction.support.AccessOrderIndex;

import lombok.extern.slf4j.Slf4j;

import org.springframework.lang.Nullable;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * LRU 淘汰策略
 *
 * <p>读取与写入都把键移到最近使用端，容量淘汰时选最久未使用的键。
 * 惰性检查只看 TTL，仅凭访问时间不会让条目失效。
 */
@Slf4j
public class LruEvictionStrategy implements EvictionStrategy {

    private final String namespace;
    private final Clock clock;

    /** 核心访问顺序索引 */
    private final AccessOrderIndex index = new AccessOrderIndex();

    public LruEvictionStrategy(StrategyContext context) {
        this.namespace = context.namespace();
        this.clock = context.clock();
    }

    @Override
    public String getName() {
        return CacheConstants.Strategies.LRU;
    }

    @Override
    @Nullable
    public CacheEvent onAccess(CacheEntry entry) {
        index.moveToFront(entry.getKey());
        return null;
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
        return CacheUtil.isExpired(entry, clock.millis());
    }

    @Override
    @Nullable
    public String selectEvictionCandidate(Map<String, CacheEntry> entries, NamespaceConfig config) {
        String candidate = index.leastRecent();
        if (log.isDebugEnabled()) {
            log.debug("LRU eviction candidate: namespace={}, key={}", namespace, candidate);
        }
        return candidate;
    }

    @Override
    public void clear() {
        index.clear();
    }

    /**
     * 诊断：从最近到最久的键顺序
     */
    public List<String> recencyOrder() {
        return index.keysFromMostRecent();
    }
}
