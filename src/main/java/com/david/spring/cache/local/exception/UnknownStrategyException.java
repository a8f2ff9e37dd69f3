package com.david.spring.cache.local.exception;

import lombok.Getter;

/**
 * 命名空间配置引用了未注册的淘汰策略
 */
@Getter
public class UnknownStrategyException extends CacheException {

    private final String strategyName;

    public UnknownStrategyException(String strategyName) {
        super("Unknown strategy: " + strategyName);
        this.strategyName = strategyName;
    }
}
