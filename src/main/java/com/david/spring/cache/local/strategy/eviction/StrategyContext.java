package com.david.spring.cache.local.strategy.eviction;

import java.time.Clock;

/**
 * 创建策略实例时的上下文
 *
 * @param namespace 策略所属命名空间
 * @param clock 时钟
 */
public record StrategyContext(String namespace, Clock clock) {}
