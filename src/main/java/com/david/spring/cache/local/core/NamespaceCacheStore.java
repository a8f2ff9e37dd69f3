package com.david.spring.cache.local.core;

import com.david.spring.cache.local.event.CacheEvent;
import com.david.spring.cache.local.event.CacheEventPublisher;
import com.david.spring.cache.local.event.EntryRemovedEvent;
import com.david.spring.cache.local.stats.NamespaceStatistics;
import com.david.spring.cache.local.strategy.eviction.EvictionStrategy;
import com.david.spring.cache.local.support.CacheExceptionHandler;
import com.david.spring.cache.local.utils.CacheUtil;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.ToLongFunction;

/**
 * 单个命名空间的缓存存储
 *
 * <p>持有条目表、绑定的策略实例、命名空间配置和统计计数。一把锁同时保护条目表与策略的访问顺序索引。
 * 淘汰回调与事件发布在释放锁之后执行。
 */
@Slf4j
public class NamespaceCacheStore {

    @Getter private final String namespace;
    @Getter private final NamespaceConfig config;
    @Getter private final EvictionStrategy strategy;

    private final Clock clock;
    private final CacheEventPublisher eventPublisher;
    private final ToLongFunction<Object> sizeEstimator;

    /** 按插入顺序迭代，覆盖写入视为重新插入 */
    private final LinkedHashMap<String, CacheEntry> data = new LinkedHashMap<>();

    private final Map<String, CacheEntry> readOnlyView = Collections.unmodifiableMap(data);

    private final ReentrantLock lock = new ReentrantLock();

    private final StatsCounter counter = new StatsCounter();

    public NamespaceCacheStore(
            String namespace,
            NamespaceConfig config,
            EvictionStrategy strategy,
            Clock clock,
            CacheEventPublisher eventPublisher,
            ToLongFunction<Object> sizeEstimator) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.config = config.withDefaults();
        if (this.config.maxSizeOrDefault() <= 0) {
            throw new IllegalArgumentException(
                    "maxSize must be positive for namespace " + namespace + ": " + this.config.getMaxSize());
        }
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.clock = clock;
        this.eventPublisher = eventPublisher;
        this.sizeEstimator = sizeEstimator;
    }

    /**
     * 读取值
     *
     * <p>策略判定条目已失效时先移除再按未命中处理。
     *
     * @param key 键
     * @return 值，不存在或已失效时为空
     */
    public Optional<Object> get(String key) {
        CacheEntry expired;
        Object value;
        CacheEvent accessEvent;
        lock.lock();
        try {
            CacheEntry entry = data.get(key);
            if (entry == null) {
                counter.recordMiss();
                return Optional.empty();
            }

            if (strategy.shouldEvict(entry, config)) {
                removeUnsafe(key);
                counter.recordExpiration();
                counter.recordMiss();
                expired = entry;
                value = null;
                accessEvent = null;
            } else {
                entry.recordAccess(clock.millis());
                accessEvent = strategy.onAccess(entry);
                counter.recordHit();
                expired = null;
                value = entry.getValue();
            }
        } finally {
            lock.unlock();
        }

        // 监听器可能回调本存储，必须在锁外发布
        if (expired == null) {
            if (accessEvent != null) {
                eventPublisher.publish(accessEvent);
            }
            return Optional.of(value);
        }

        if (log.isDebugEnabled()) {
            log.debug("Lazily expired entry on read: namespace={}, key={}", namespace, key);
        }
        eventPublisher.publish(EntryRemovedEvent.expired(expired, clock.instant()));
        return Optional.empty();
    }

    /**
     * 判断键是否存在且未失效，计入命中统计
     */
    public boolean has(String key) {
        return get(key).isPresent();
    }

    /**
     * 查看条目，不影响统计与访问顺序
     *
     * @param key 键
     * @return 条目（可能已过期）
     */
    public Optional<CacheEntry> peek(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(data.get(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 写入值
     *
     * <p>容量已满且键不存在时先淘汰一个条目；策略给不出候选时允许超出容量（软上限）。
     *
     * @param key 键
     * @param value 值，不能为空
     * @param options 写入选项
     */
    public void set(String key, Object value, @Nullable SetOptions options) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        SetOptions effective = options != null ? options : SetOptions.none();

        long now = clock.millis();
        CacheEntry entry =
                CacheEntry.builder()
                        .key(key)
                        .namespace(namespace)
                        .value(value)
                        .createdAt(now)
                        .expiresAt(CacheUtil.calculateExpiry(effective.getTtl(), config.getDefaultTtl(), now))
                        .approxSizeBytes(sizeEstimator.applyAsLong(value))
                        .priority(effective.getPriority())
                        .metadata(effective.getMetadata())
                        .build();

        CacheEntry evicted = null;
        lock.lock();
        try {
            boolean exists = data.containsKey(key);
            if (!exists && data.size() >= config.maxSizeOrDefault()) {
                evicted = evictOneUnsafe();
            }
            if (exists) {
                data.remove(key);
            }
            data.put(key, entry);
            strategy.onSet(entry);
            counter.recordSet();
        } finally {
            lock.unlock();
        }

        if (log.isDebugEnabled()) {
            log.debug(
                    "Set entry: namespace={}, key={}, expiresAt={}, size={}",
                    namespace,
                    key,
                    entry.getExpiresAt(),
                    entry.getApproxSizeBytes());
        }

        if (evicted != null) {
            notifyEvicted(evicted);
        }
    }

    /**
     * 删除条目，幂等
     *
     * @param key 键
     * @return true=确实删除了条目
     */
    public boolean delete(String key) {
        lock.lock();
        try {
            if (removeUnsafe(key) == null) {
                return false;
            }
            counter.recordDelete();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 清空条目并重置统计，命名空间本身保留
     */
    public void clear() {
        lock.lock();
        try {
            int cleared = data.size();
            data.clear();
            strategy.clear();
            counter.reset();
            log.debug("Cleared namespace: namespace={}, entries={}", namespace, cleared);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 主动清理所有被策略判定为失效的条目
     *
     * @return 移除的条目数
     */
    public int cleanup() {
        List<CacheEntry> removed = new ArrayList<>();
        lock.lock();
        try {
            Iterator<Map.Entry<String, CacheEntry>> it = data.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, CacheEntry> e = it.next();
                if (strategy.shouldEvict(e.getValue(), config)) {
                    it.remove();
                    strategy.onRemove(e.getKey());
                    counter.recordExpiration();
                    removed.add(e.getValue());
                }
            }
        } finally {
            lock.unlock();
        }

        if (!removed.isEmpty()) {
            Instant now = clock.instant();
            removed.forEach(entry -> eventPublisher.publish(EntryRemovedEvent.expired(entry, now)));
            log.debug("Cleanup removed {} entries from namespace {}", removed.size(), namespace);
        }
        return removed.size();
    }

    /**
     * 获取统计快照，派生字段按当前条目重新计算
     */
    public NamespaceStatistics getStats() {
        lock.lock();
        try {
            int size = data.size();
            long totalAccessCount = 0;
            long totalBytes = 0;
            long oldest = Long.MAX_VALUE;
            long newest = Long.MIN_VALUE;
            for (CacheEntry entry : data.values()) {
                totalAccessCount += entry.getAccessCount();
                totalBytes += entry.getApproxSizeBytes();
                oldest = Math.min(oldest, entry.getCreatedAt());
                newest = Math.max(newest, entry.getCreatedAt());
            }

            long requests = counter.hits + counter.misses;
            return new NamespaceStatistics(
                    namespace,
                    counter.hits,
                    counter.misses,
                    counter.sets,
                    counter.deletes,
                    counter.evictions,
                    counter.expirations,
                    size,
                    requests > 0 ? (double) counter.hits / requests : 0.0,
                    size > 0 ? (double) totalAccessCount / size : 0.0,
                    size > 0 ? Instant.ofEpochMilli(oldest) : null,
                    size > 0 ? Instant.ofEpochMilli(newest) : null,
                    totalBytes);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return data.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 当前条目快照（插入顺序），用于调试
     */
    public List<CacheEntry> entries() {
        lock.lock();
        try {
            return List.copyOf(data.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 淘汰一个条目（需要持有锁）
     *
     * @return 被淘汰的条目，未淘汰时为 null
     */
    @Nullable
    private CacheEntry evictOneUnsafe() {
        String candidate = strategy.selectEvictionCandidate(readOnlyView, config);
        if (candidate == null) {
            log.warn(
                    "No eviction candidate at capacity, growing past maxSize: namespace={}, size={}, maxSize={}",
                    namespace,
                    data.size(),
                    config.getMaxSize());
            return null;
        }

        CacheEntry victim = removeUnsafe(candidate);
        if (victim == null) {
            log.warn("Strategy {} selected unknown key {} in namespace {}", strategy.getName(), candidate, namespace);
            return null;
        }
        counter.recordEviction();
        return victim;
    }

    @Nullable
    private CacheEntry removeUnsafe(String key) {
        CacheEntry removed = data.remove(key);
        if (removed != null) {
            strategy.onRemove(key);
        }
        return removed;
    }

    private void notifyEvicted(CacheEntry evicted) {
        if (log.isDebugEnabled()) {
            log.debug("Evicted entry: namespace={}, key={}", namespace, evicted.getKey());
        }

        Consumer<CacheEntry> onEvict = config.getOnEvict();
        if (onEvict != null) {
            CacheExceptionHandler.safeExecute(
                    () -> onEvict.accept(evicted),
                    CacheConstants.Operations.ON_EVICT,
                    namespace,
                    evicted.getKey());
        }
        eventPublisher.publish(EntryRemovedEvent.evicted(evicted, clock.instant()));
    }

    /** 统计计数器，由存储锁保护 */
    private final class StatsCounter {
        private long hits;
        private long misses;
        private long sets;
        private long deletes;
        private long evictions;
        private long expirations;

        void recordHit() {
            if (config.statsEnabled()) hits++;
        }

        void recordMiss() {
            if (config.statsEnabled()) misses++;
        }

        void recordSet() {
            if (config.statsEnabled()) sets++;
        }

        void recordDelete() {
            if (config.statsEnabled()) deletes++;
        }

        void recordEviction() {
            if (config.statsEnabled()) evictions++;
        }

        void recordExpiration() {
            if (config.statsEnabled()) expirations++;
        }

        void reset() {
            hits = 0;
            misses = 0;
            sets = 0;
            deletes = 0;
            evictions = 0;
            expirations = 0;
        }
    }
}
