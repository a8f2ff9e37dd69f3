package com.david.spring.cache.local.strategy.eviction;

import com.david.spring.cache.local.core.CacheConstants;
import com.david.spring.cache.local.strategy.eviction.impl.LruEvictionStrategy;
import com.david.spring.cache.local.strategy.eviction.impl.SwrEvictionStrategy;
import com.david.spring.cache.local.strategy.eviction.impl.TtlEvictionStrategy;

import lombok.Getter;

import java.util.Optional;

/**
 * 内置淘汰策略
 */
@Getter
public enum StrategyType implements StrategyProvider {
    /** 最近最少使用 */
    LRU(CacheConstants.Strategies.LRU),

    /** 最早过期优先，无 TTL 时最早创建优先 */
    TTL(CacheConstants.Strategies.TTL),

    /** 过期后仍返回旧值并触发后台刷新 */
    SWR(CacheConstants.Strategies.SWR);

    private final String strategyName;

    StrategyType(String strategyName) {
        this.strategyName = strategyName;
    }

    @Override
    public EvictionStrategy create(StrategyContext context) {
        return switch (this) {
            case LRU -> new LruEvictionStrategy(context);
            case TTL -> new TtlEvictionStrategy(context);
            case SWR -> new SwrEvictionStrategy(context);
        };
    }

    public static Optional<StrategyType> fromName(String name) {
        for (StrategyType type : values()) {
            if (type.strategyName.equalsIgnoreCase(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
