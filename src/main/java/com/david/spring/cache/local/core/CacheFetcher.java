package com.david.spring.cache.local.core;

/**
 * 读穿模式下未命中时加载值
 *
 * @param <T> 值类型
 * @param <E> 加载失败时抛出的异常类型，原样传播给调用方
 */
@FunctionalInterface
public interface CacheFetcher<T, E extends Exception> {

    T fetch() throws E;
}
