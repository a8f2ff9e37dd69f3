package com.david.spring.cache.local.strategy.eviction.impl;

import com.david.spring.cache.local.core.CacheConstants;
import com.david.spring.cache.local.core.CacheEntry;
import com.david.spring.cache.local.core.NamespaceConfig;
import com.david.spring.cache.local.event.CacheEvent;
import com.david.spring.cache.local.strategy.eviction.EvictionStrategy;
import com.david.spring.cache.local.strategy.eviction.StrategyContext;
import com.david.spring.cache.local.utils.CacheUtil;

import lombok.extern.slf4j.Slf4j;

import org.springframework.lang.Nullable;

import java.time.Clock;
import java.util.Map;

/**
 * TTL 淘汰策略
 *
 * <p>不维护访问顺序。容量淘汰时扫描一次全部条目，选过期时间最早的；
 * 所有条目都没有 TTL 时选创建时间最早的。并列时取迭代中先遇到的条目。
 * 扫描为 O(n)，只在容量边界触发。
 */
@Slf4j
public class TtlEvictionStrategy implements EvictionStrategy {

    private final String namespace;
    private final Clock clock;

    public TtlEvictionStrategy(StrategyContext context) {
        this.namespace = context.namespace();
        this.clock = context.clock();
    }

    @Override
    public String getName() {
        return CacheConstants.Strategies.TTL;
    }

    @Override
    @Nullable
    public CacheEvent onAccess(CacheEntry entry) {
        // 访问元数据由存储维护
        return null;
    }

    @Override
    public void onSet(CacheEntry entry) {
        // 过期时间在创建条目时已确定
    }

    @Override
    public boolean shouldEvict(CacheEntry entry, NamespaceConfig config) {
        return CacheUtil.isExpired(entry, clock.millis());
    }

    @Override
    @Nullable
    public String selectEvictionCandidate(Map<String, CacheEntry> entries, NamespaceConfig config) {
        String earliestExpiring = null;
        long minExpiry = Long.MAX_VALUE;
        String oldest = null;
        long minCreated = Long.MAX_VALUE;

        for (Map.Entry<String, CacheEntry> e : entries.entrySet()) {
            CacheEntry entry = e.getValue();
            Long expiresAt = entry.getExpiresAt();
            if (expiresAt != null && (earliestExpiring == null || expiresAt < minExpiry)) {
                minExpiry = expiresAt;
                earliestExpiring = e.getKey();
            }
            if (oldest == null || entry.getCreatedAt() < minCreated) {
                minCreated = entry.getCreatedAt();
                oldest = e.getKey();
            }
        }

        String candidate = earliestExpiring != null ? earliestExpiring : oldest;
        if (log.isDebugEnabled()) {
            log.debug(
                    "TTL eviction candidate: namespace={}, key={}, byExpiry={}",
                    namespace,
                    candidate,
                    earliestExpiring != null);
        }
        return candidate;
    }
}
