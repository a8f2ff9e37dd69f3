package com.david.spring.cache.local.event;

import java.util.Set;

/**
 * 缓存事件监听器
 *
 * <p>注册到 {@link CacheEventPublisher} 后接收淘汰、过期和 SWR 刷新等事件。
 * 同步发布器下监听器在写入或读取线程执行，此时已释放存储锁，可以回调缓存管理器。
 * 抛出的异常只计入发布器的错误计数，不会传给缓存调用方。
 */
@FunctionalInterface
public interface CacheEventListener {

    void onCacheEvent(CacheEvent event);

    /**
     * 关注的事件类型，空集合表示全部
     */
    default Set<CacheEventType> eventTypes() {
        return Set.of();
    }

    /**
     * 关注的命名空间，空集合表示全部
     */
    default Set<String> namespaces() {
        return Set.of();
    }

    /**
     * 是否处理该类型的事件
     */
    default boolean supports(CacheEventType type) {
        Set<CacheEventType> types = eventTypes();
        return types == null || types.isEmpty() || types.contains(type);
    }

    /**
     * 发布器分发前调用，按事件类型和命名空间过滤
     *
     * @param event 事件
     * @return 是否需要通知本监听器
     */
    default boolean supports(CacheEvent event) {
        if (!supports(event.getEventType())) {
            return false;
        }
        Set<String> scope = namespaces();
        return scope == null || scope.isEmpty() || scope.contains(event.getNamespace());
    }

    /** 分发顺序，数值小的先执行 */
    default int getOrder() {
        return 0;
    }
}
