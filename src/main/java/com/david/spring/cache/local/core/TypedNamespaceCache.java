package com.david.spring.cache.local.core;

import com.david.spring.cache.local.stats.NamespaceStatistics;

import lombok.Getter;

import org.springframework.lang.Nullable;

import java.util.Optional;

/**
 * 绑定命名空间与值类型的缓存视图，所有操作委托给 {@link NamespaceCacheManager}
 *
 * @param <V> 值类型
 */
public class TypedNamespaceCache<V> {

    private final NamespaceCacheManager manager;
    @Getter private final String namespace;
    @Getter private final Class<V> valueType;

    TypedNamespaceCache(NamespaceCacheManager manager, String namespace, Class<V> valueType) {
        this.manager = manager;
        this.namespace = namespace;
        this.valueType = valueType;
    }

    public Optional<V> get(String key) {
        return manager.get(namespace, key, valueType);
    }

    public boolean has(String key) {
        return manager.has(namespace, key);
    }

    public void set(String key, V value) {
        manager.set(namespace, key, value);
    }

    public void set(String key, V value, @Nullable SetOptions options) {
        manager.set(namespace, key, value, options);
    }

    public boolean delete(String key) {
        return manager.delete(namespace, key);
    }

    public <E extends Exception> V getOrFetch(String key, CacheFetcher<V, E> fetcher, @Nullable SetOptions options)
            throws E {
        return manager.getOrFetch(namespace, key, fetcher, options);
    }

    public void clear() {
        manager.clear(namespace);
    }

    public NamespaceStatistics getStats() {
        return manager.getStats(namespace);
    }
}
