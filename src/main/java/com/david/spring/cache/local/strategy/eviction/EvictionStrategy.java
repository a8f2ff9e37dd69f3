package com.david.spring.cache.local.strategy.eviction;

import com.david.spring.cache.local.core.CacheEntry;
import com.david.spring.cache.local.core.NamespaceConfig;
import com.david.spring.cache.local.event.CacheEvent;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * 淘汰策略接口
 *
 * <p>策略只负责决策（记录访问、判断条目是否失效、选出淘汰候选），由存储执行实际的删除。
 * 实例有状态，每个命名空间绑定独立实例；所有回调都在存储锁内调用，不能在回调中发布事件或执行外部代码。
 */
public interface EvictionStrategy {

    /**
     * 策略名称
     */
    String getName();

    /**
     * 每次成功读取后调用
     *
     * @param entry 被读取的条目
     * @return 需要发布的事件，由存储在释放锁之后发布；没有则为 null
     */
    @Nullable
    CacheEvent onAccess(CacheEntry entry);

    /**
     * 每次写入（新增或覆盖）后调用
     *
     * @param entry 新写入的条目
     */
    void onSet(CacheEntry entry);

    /**
     * 条目被删除、淘汰或过期移除后调用
     *
     * @param key 被移除的键
     */
    default void onRemove(String key) {}

    /**
     * 读取路径上的惰性检查，与容量无关
     *
     * @param entry 条目
     * @param config 命名空间配置
     * @return true=条目已失效，应当移除
     */
    boolean shouldEvict(CacheEntry entry, NamespaceConfig config);

    /**
     * 容量已满且写入新键时选出淘汰候选
     *
     * @param entries 当前所有条目（按插入顺序迭代，只读）
     * @param config 命名空间配置
     * @return 候选键，null 表示不淘汰
     */
    @Nullable
    String selectEvictionCandidate(Map<String, CacheEntry> entries, NamespaceConfig config);

    /** 清空策略内部跟踪结构 */
    default void clear() {}
}
