package com.david.spring.cache.local.strategy.eviction;

/**
 * 策略工厂，为每个命名空间创建独立的策略实例
 */
@FunctionalInterface
public interface StrategyProvider {

    EvictionStrategy create(StrategyContext context);
}
