package com.david.spring.cache.local.core;

import com.david.spring.cache.local.config.JacksonConfig;
import com.david.spring.cache.local.event.CacheEvent;
import com.david.spring.cache.local.event.CacheEventPublisher;
import com.david.spring.cache.local.exception.InvalidNamespaceException;
import com.david.spring.cache.local.exception.UnknownStrategyException;
import com.david.spring.cache.local.stats.GlobalStatistics;
import com.david.spring.cache.local.stats.NamespaceStatistics;
import com.david.spring.cache.local.strategy.eviction.EvictionStrategy;
import com.david.spring.cache.local.strategy.eviction.StrategyContext;
import com.david.spring.cache.local.strategy.eviction.StrategyProvider;
import com.david.spring.cache.local.strategy.eviction.StrategyType;
import com.david.spring.cache.local.utils.CacheUtil;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.function.ToLongFunction;

/**
 * 进程级缓存管理器
 *
 * <p>持有命名空间表与策略注册表，把调用路由到对应的 {@link NamespaceCacheStore}，
 * 首次写入时惰性创建命名空间。显式构造后按引用传递给使用方，测试间可用 {@link #reset()} 隔离。
 *
 * <p>{@link #getOrFetch} 不合并并发未命中：两个调用方同时未命中同一键时都会加载并写入，后写者生效。
 */
@Slf4j
public class NamespaceCacheManager implements AutoCloseable {

    private final ConcurrentHashMap<String, NamespaceCacheStore> namespaces = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, StrategyProvider> strategies = new ConcurrentHashMap<>();

    /** 全局默认配置 */
    @Getter private final NamespaceConfig defaultConfig;

    /** 预置的命名空间配置，在命名空间首次创建时合并 */
    private final Map<String, NamespaceConfig> namespaceConfigs;

    private final Clock clock;
    @Getter private final CacheEventPublisher eventPublisher;
    private final ToLongFunction<Object> sizeEstimator;

    @Builder
    private NamespaceCacheManager(
            @Nullable NamespaceConfig defaultConfig,
            @Nullable Map<String, NamespaceConfig> namespaceConfigs,
            @Nullable Clock clock,
            @Nullable CacheEventPublisher eventPublisher,
            @Nullable ObjectMapper sizeMapper) {
        this.defaultConfig = defaultConfig != null ? defaultConfig : NamespaceConfig.empty();
        this.namespaceConfigs = namespaceConfigs != null ? Map.copyOf(namespaceConfigs) : Map.of();
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.eventPublisher =
                eventPublisher != null
                        ? eventPublisher
                        : CacheEventPublisher.synchronous(CacheConstants.DEFAULT_EVENT_CHANNEL_CAPACITY);
        ObjectMapper mapper = sizeMapper != null ? sizeMapper : JacksonConfig.sizeEstimationMapper();
        this.sizeEstimator = value -> CacheUtil.estimateSize(value, mapper);

        // 注册内置策略
        for (StrategyType type : StrategyType.values()) {
            strategies.put(type.getStrategyName(), type);
        }
    }

    public static NamespaceCacheManager create() {
        return NamespaceCacheManager.builder().build();
    }

    /**
     * 注册或覆盖具名策略，只影响之后创建的命名空间
     *
     * @param name 策略名称，不能为空
     * @param provider 策略工厂
     */
    public void registerStrategy(String name, StrategyProvider provider) {
        if (!StringUtils.hasText(name)) {
            throw new IllegalArgumentException("Strategy name must not be empty");
        }
        Objects.requireNonNull(provider, "provider");
        StrategyProvider previous = strategies.put(name, provider);
        log.info("{} eviction strategy: {}", previous == null ? "Registered" : "Replaced", name);
    }

    public boolean hasStrategy(String name) {
        return name != null && strategies.containsKey(name);
    }

    /**
     * 读取值，未知命名空间按未命中处理
     */
    @SuppressWarnings("unchecked")
    public <T> Optional<T> get(String namespace, String key) {
        NamespaceCacheStore store = namespaces.get(namespace);
        if (store == null) {
            return Optional.empty();
        }
        return (Optional<T>) store.get(key);
    }

    /**
     * 按类型读取值
     *
     * @throws ClassCastException 缓存值不是期望类型
     */
    public <T> Optional<T> get(String namespace, String key, Class<T> type) {
        return this.<Object>get(namespace, key).map(type::cast);
    }

    public boolean has(String namespace, String key) {
        NamespaceCacheStore store = namespaces.get(namespace);
        return store != null && store.has(key);
    }

    public void set(String namespace, String key, Object value) {
        set(namespace, key, value, SetOptions.none(), null);
    }

    public void set(String namespace, String key, Object value, @Nullable SetOptions options) {
        set(namespace, key, value, options, null);
    }

    /**
     * 写入值，首次写入时创建命名空间
     *
     * @param namespace 命名空间
     * @param key 键
     * @param value 值
     * @param options 写入选项
     * @param config 命名空间配置，仅在命名空间首次创建时生效
     * @throws InvalidNamespaceException 命名空间名称不合法
     * @throws UnknownStrategyException 配置的策略未注册
     */
    public void set(
            String namespace,
            String key,
            Object value,
            @Nullable SetOptions options,
            @Nullable NamespaceConfig config) {
        getOrCreateStore(namespace, config).set(key, value, options);
    }

    public boolean delete(String namespace, String key) {
        NamespaceCacheStore store = namespaces.get(namespace);
        return store != null && store.delete(key);
    }

    /**
     * 清空命名空间中的条目与统计，命名空间保留
     */
    public void clear(String namespace) {
        NamespaceCacheStore store = namespaces.get(namespace);
        if (store != null) {
            store.clear();
        }
    }

    /**
     * 清空并移除所有命名空间
     */
    public void clearAll() {
        int count = namespaces.size();
        namespaces.values().forEach(NamespaceCacheStore::clear);
        namespaces.clear();
        log.info("Cleared all cache namespaces: {}", count);
    }

    /**
     * 重置到初始状态（清空命名空间并丢弃未拉取的事件），用于测试隔离
     */
    public void reset() {
        clearAll();
        eventPublisher.clearPending();
    }

    /**
     * 命名空间统计，未知命名空间返回空统计
     */
    public NamespaceStatistics getStats(String namespace) {
        NamespaceCacheStore store = namespaces.get(namespace);
        return store != null ? store.getStats() : NamespaceStatistics.empty(namespace);
    }

    /**
     * 全局统计
     */
    public GlobalStatistics getStats() {
        Map<String, NamespaceStatistics> breakdown = new LinkedHashMap<>();
        long totalEntries = 0;
        long totalBytes = 0;
        for (Map.Entry<String, NamespaceCacheStore> e : namespaces.entrySet()) {
            NamespaceStatistics stats = e.getValue().getStats();
            breakdown.put(e.getKey(), stats);
            totalEntries += stats.size();
            totalBytes += stats.approxSizeBytes();
        }
        return new GlobalStatistics(breakdown.size(), totalEntries, totalBytes, breakdown);
    }

    /**
     * 清理指定命名空间中的失效条目
     *
     * @return 移除的条目数
     */
    public int cleanup(String namespace) {
        NamespaceCacheStore store = namespaces.get(namespace);
        return store != null ? store.cleanup() : 0;
    }

    /**
     * 清理所有命名空间中的失效条目
     *
     * @return 移除的条目数
     */
    public int cleanup() {
        int removed = 0;
        for (NamespaceCacheStore store : namespaces.values()) {
            removed += store.cleanup();
        }
        return removed;
    }

    /**
     * 读穿：命中直接返回，未命中时加载、写入并返回
     *
     * <p>加载抛出的异常原样传播，不会写入缓存；加载结果为 null 时直接返回 null，不写入。
     */
    public <T, E extends Exception> T getOrFetch(
            String namespace, String key, CacheFetcher<T, E> fetcher, @Nullable SetOptions options)
            throws E {
        Optional<T> cached = get(namespace, key);
        if (cached.isPresent()) {
            return cached.get();
        }

        T value = fetcher.fetch();
        if (value == null) {
            log.debug("Fetcher returned null, not caching: namespace={}, key={}", namespace, key);
            return null;
        }
        set(namespace, key, value, options);
        return value;
    }

    public <T, E extends Exception> T getOrFetch(String namespace, String key, CacheFetcher<T, E> fetcher)
            throws E {
        return getOrFetch(namespace, key, fetcher, null);
    }

    /**
     * 异步读穿，加载失败时返回的 future 以原异常结束，不写入缓存
     */
    public <T> CompletableFuture<T> getOrFetchAsync(
            String namespace,
            String key,
            Supplier<CompletableFuture<T>> fetcher,
            @Nullable SetOptions options) {
        Optional<T> cached = get(namespace, key);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }
        return fetcher.get()
                .thenApply(
                        value -> {
                            if (value != null) {
                                set(namespace, key, value, options);
                            }
                            return value;
                        });
    }

    /**
     * 批量读取，只返回命中的键
     */
    public <T> Map<String, T> getMany(String namespace, Collection<String> keys) {
        Map<String, T> results = new LinkedHashMap<>();
        NamespaceCacheStore store = namespaces.get(namespace);
        if (store == null) {
            return results;
        }
        for (String key : keys) {
            Optional<T> value = get(namespace, key);
            value.ifPresent(v -> results.put(key, v));
        }
        return results;
    }

    /**
     * 批量写入，选项应用于所有条目
     */
    public void setMany(String namespace, Map<String, ?> entries, @Nullable SetOptions options) {
        NamespaceCacheStore store = getOrCreateStore(namespace, null);
        entries.forEach((key, value) -> store.set(key, value, options));
    }

    /**
     * 批量删除
     *
     * @return 实际删除的条目数
     */
    public int deleteMany(String namespace, Collection<String> keys) {
        NamespaceCacheStore store = namespaces.get(namespace);
        if (store == null) {
            return 0;
        }
        int deleted = 0;
        for (String key : keys) {
            if (store.delete(key)) {
                deleted++;
            }
        }
        return deleted;
    }

    /**
     * 条目是否已过期但仍在缓存中（SWR 模式下常见），不影响统计
     */
    public boolean isStale(String namespace, String key) {
        NamespaceCacheStore store = namespaces.get(namespace);
        if (store == null) {
            return false;
        }
        long now = clock.millis();
        return store.peek(key).map(entry -> entry.isExpiredAt(now)).orElse(false);
    }

    public List<String> getNamespaces() {
        return List.copyOf(namespaces.keySet());
    }

    public Optional<NamespaceCacheStore> getStore(String namespace) {
        return Optional.ofNullable(namespaces.get(namespace));
    }

    /**
     * 类型化的命名空间视图
     */
    public <V> TypedNamespaceCache<V> namespace(String namespace, Class<V> valueType) {
        return new TypedNamespaceCache<>(this, namespace, valueType);
    }

    /**
     * 拉取待处理的缓存事件（淘汰、过期、SWR 刷新信号）
     */
    public List<CacheEvent> drainEvents(int maxEvents) {
        return eventPublisher.drain(maxEvents);
    }

    @Override
    public void close() {
        reset();
        eventPublisher.shutdown();
    }

    private NamespaceCacheStore getOrCreateStore(String namespace, @Nullable NamespaceConfig config) {
        if (!CacheUtil.validateNamespace(namespace)) {
            throw new InvalidNamespaceException(namespace);
        }

        NamespaceCacheStore existing = namespaces.get(namespace);
        if (existing != null) {
            if (config != null && log.isDebugEnabled()) {
                log.debug("Namespace {} already exists, ignoring per-call config", namespace);
            }
            return existing;
        }
        return namespaces.computeIfAbsent(namespace, name -> createStore(name, config));
    }

    private NamespaceCacheStore createStore(String namespace, @Nullable NamespaceConfig config) {
        NamespaceConfig merged =
                defaultConfig
                        .mergedWith(namespaceConfigs.get(namespace))
                        .mergedWith(config)
                        .withDefaults();

        String strategyName = merged.strategyOrDefault();
        StrategyProvider provider = strategies.get(strategyName);
        if (provider == null) {
            throw new UnknownStrategyException(strategyName);
        }

        EvictionStrategy strategy = provider.create(new StrategyContext(namespace, clock));
        NamespaceCacheStore store =
                new NamespaceCacheStore(namespace, merged, strategy, clock, eventPublisher, sizeEstimator);
        log.info(
                "Created cache namespace: name={}, maxSize={}, strategy={}, defaultTtl={}, stats={}",
                namespace,
                merged.getMaxSize(),
                strategyName,
                merged.getDefaultTtl(),
                merged.statsEnabled());
        return store;
    }
}
