package com.david.spring.cache.local.core;

import static org.assertj.core.api.Assertions.*;

import com.david.spring.cache.local.MutableClock;
import com.david.spring.cache.local.event.CacheEvent;
import com.david.spring.cache.local.event.CacheEventPublisher;
import com.david.spring.cache.local.event.CacheEventType;
import com.david.spring.cache.local.event.EntryRemovedEvent;
import com.david.spring.cache.local.stats.NamespaceStatistics;
import com.david.spring.cache.local.strategy.eviction.EvictionStrategy;
import com.david.spring.cache.local.strategy.eviction.StrategyContext;
import com.david.spring.cache.local.strategy.eviction.StrategyType;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@DisplayName("NamespaceCacheStore 测试")
class NamespaceCacheStoreTest {

    private MutableClock clock;
    private CacheEventPublisher publisher;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        publisher = CacheEventPublisher.synchronous(64);
    }

    private NamespaceCacheStore store(NamespaceConfig config) {
        NamespaceConfig effective = config.withDefaults();
        StrategyType type = StrategyType.fromName(effective.getStrategy()).orElseThrow();
        return new NamespaceCacheStore(
                "store",
                effective,
                type.create(new StrategyContext("store", clock)),
                clock,
                publisher,
                value -> 10L);
    }

    @Nested
    @DisplayName("读写")
    class ReadWrite {

        @Test
        @DisplayName("写入后可以读到，覆盖写入更新值")
        void shouldStoreAndOverwrite() {
            NamespaceCacheStore store = store(NamespaceConfig.empty());

            store.set("a", 1, null);
            store.set("a", 2, null);

            assertThat(store.get("a")).contains(2);
            assertThat(store.size()).isEqualTo(1);
            assertThat(store.getStats().sets()).isEqualTo(2);
        }

        @Test
        @DisplayName("拒绝 null 值")
        void shouldRejectNullValue() {
            NamespaceCacheStore store = store(NamespaceConfig.empty());

            assertThatThrownBy(() -> store.set("a", null, null)).isInstanceOf(NullPointerException.class);
            assertThat(store.size()).isZero();
        }

        @Test
        @DisplayName("覆盖写入视为重新插入")
        void overwriteShouldReinsert() {
            NamespaceCacheStore store = store(NamespaceConfig.empty());
            store.set("a", 1, null);
            store.set("b", 2, null);
            store.set("a", 3, null);

            assertThat(store.entries()).extracting(CacheEntry::getKey).containsExactly("b", "a");
        }

        @Test
        @DisplayName("写入选项中的元数据与优先级保存在条目上")
        void shouldKeepOptionsOnEntry() {
            NamespaceCacheStore store = store(NamespaceConfig.empty());

            store.set("a", "v", SetOptions.builder().priority(5).metadataEntry("source", "db").build());

            CacheEntry entry = store.peek("a").orElseThrow();
            assertThat(entry.getPriority()).isEqualTo(5);
            assertThat(entry.getMetadata()).containsEntry("source", "db");
            assertThat(entry.getApproxSizeBytes()).isEqualTo(10L);
            assertThat(entry.hasTtl()).isFalse();
        }

        @Test
        @DisplayName("读取记录访问次数，peek 不影响统计")
        void shouldTrackAccess() {
            NamespaceCacheStore store = store(NamespaceConfig.empty());
            store.set("a", 1, null);

            store.get("a");
            store.get("a");
            store.peek("a");

            assertThat(store.peek("a").orElseThrow().getAccessCount()).isEqualTo(2);
            NamespaceStatistics stats = store.getStats();
            assertThat(stats.hits()).isEqualTo(2);
            assertThat(stats.avgAccessCount()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("maxSize 必须为正数")
        void shouldRejectNonPositiveMaxSize() {
            assertThatThrownBy(() -> store(NamespaceConfig.builder().maxSize(0).build()))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("过期")
    class Expiry {

        @Test
        @DisplayName("读取时惰性移除过期条目并计为过期")
        void shouldExpireLazily() {
            NamespaceCacheStore store = store(NamespaceConfig.empty());
            store.set("a", 1, SetOptions.ttl(Duration.ofMillis(50)));

            clock.advanceMillis(80);

            assertThat(store.get("a")).isEmpty();
            assertThat(store.size()).isZero();
            NamespaceStatistics stats = store.getStats();
            assertThat(stats.expirations()).isEqualTo(1);
            assertThat(stats.deletes()).isZero();
            assertThat(stats.misses()).isEqualTo(1);

            List<CacheEvent> events = publisher.drain(10);
            assertThat(events).singleElement().extracting(CacheEvent::getEventType).isEqualTo(CacheEventType.CACHE_EXPIRED);
        }

        @Test
        @DisplayName("默认 TTL 对没有显式 ttl 的写入生效")
        void shouldApplyDefaultTtl() {
            NamespaceCacheStore store = store(NamespaceConfig.builder().defaultTtl(Duration.ofSeconds(1)).build());
            store.set("a", 1, null);
            store.set("b", 2, SetOptions.ttl(Duration.ofSeconds(10)));

            clock.advance(Duration.ofSeconds(2));

            assertThat(store.get("a")).isEmpty();
            assertThat(store.get("b")).contains(2);
        }

        @Test
        @DisplayName("超大 TTL 的条目可以正常读取")
        void hugeTtlEntryShouldStayReadable() {
            NamespaceCacheStore store = store(NamespaceConfig.empty());
            store.set("a", 1, SetOptions.ttl(Duration.ofMillis(Long.MAX_VALUE)));
            store.set("b", 2, SetOptions.ttl(Duration.ofDays(365_000_000_000L)));

            clock.advance(Duration.ofDays(365));

            assertThat(store.peek("a").orElseThrow().getExpiresAt()).isEqualTo(Long.MAX_VALUE);
            assertThat(store.get("a")).contains(1);
            assertThat(store.get("b")).contains(2);
            assertThat(store.cleanup()).isZero();
            assertThat(store.getStats().expirations()).isZero();
        }

        @Test
        @DisplayName("cleanup 移除所有过期条目")
        void cleanupShouldRemoveExpired() {
            NamespaceCacheStore store = store(NamespaceConfig.empty());
            store.set("a", 1, SetOptions.ttl(Duration.ofMillis(10)));
            store.set("b", 2, SetOptions.ttl(Duration.ofMillis(10)));
            store.set("c", 3, null);

            clock.advanceMillis(20);

            assertThat(store.cleanup()).isEqualTo(2);
            assertThat(store.size()).isEqualTo(1);
            assertThat(store.getStats().expirations()).isEqualTo(2);
            assertThat(store.cleanup()).isZero();
        }
    }

    @Nested
    @DisplayName("容量淘汰")
    class Eviction {

        @Test
        @DisplayName("满容量写入新键时淘汰一个条目并通知回调")
        void shouldEvictAndNotify() {
            List<String> evicted = new ArrayList<>();
            NamespaceCacheStore store =
                    store(NamespaceConfig.builder().maxSize(2).onEvict(e -> evicted.add(e.getKey())).build());

            store.set("a", 1, null);
            store.set("b", 2, null);
            store.set("c", 3, null);

            assertThat(store.size()).isEqualTo(2);
            assertThat(evicted).containsExactly("a");
            assertThat(store.getStats().evictions()).isEqualTo(1);

            List<CacheEvent> events = publisher.drain(10);
            assertThat(events).hasSize(1);
            EntryRemovedEvent removed = (EntryRemovedEvent) events.get(0);
            assertThat(removed.getEventType()).isEqualTo(CacheEventType.CACHE_EVICT);
            assertThat(removed.getEntry().getValue()).isEqualTo(1);
        }

        @Test
        @DisplayName("覆盖已存在的键不触发淘汰")
        void overwriteShouldNotEvict() {
            NamespaceCacheStore store = store(NamespaceConfig.builder().maxSize(2).build());
            store.set("a", 1, null);
            store.set("b", 2, null);
            store.set("a", 10, null);

            assertThat(store.getStats().evictions()).isZero();
            assertThat(store.get("b")).contains(2);
        }

        @Test
        @DisplayName("淘汰回调异常不影响写入")
        void failingHookShouldNotFailSet() {
            NamespaceCacheStore store =
                    store(NamespaceConfig.builder()
                            .maxSize(1)
                            .onEvict(e -> {
                                throw new IllegalStateException("hook failure");
                            })
                            .build());

            store.set("a", 1, null);
            assertThatCode(() -> store.set("b", 2, null)).doesNotThrowAnyException();

            assertThat(store.get("b")).contains(2);
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("策略给不出候选时允许超出容量，不计淘汰也不回调")
        void shouldGrowPastMaxSizeWithoutCandidate() {
            List<String> evicted = new ArrayList<>();
            NamespaceConfig config =
                    NamespaceConfig.builder().maxSize(2).onEvict(e -> evicted.add(e.getKey())).build();
            NamespaceCacheStore store =
                    new NamespaceCacheStore("store", config, new NoCandidateStrategy(), clock, publisher, value -> 10L);

            store.set("a", 1, null);
            store.set("b", 2, null);
            store.set("c", 3, null);

            assertThat(store.size()).isEqualTo(3);
            assertThat(store.getStats().evictions()).isZero();
            assertThat(evicted).isEmpty();
            assertThat(publisher.drain(10)).isEmpty();
            assertThat(store.get("a")).contains(1);
            assertThat(store.get("c")).contains(3);
        }
    }

    @Nested
    @DisplayName("删除与清空")
    class DeleteAndClear {

        @Test
        @DisplayName("删除幂等，只统计真实删除")
        void deleteShouldBeIdempotent() {
            NamespaceCacheStore store = store(NamespaceConfig.empty());
            store.set("a", 1, null);

            assertThat(store.delete("a")).isTrue();
            assertThat(store.delete("a")).isFalse();
            assertThat(store.getStats().deletes()).isEqualTo(1);
        }

        @Test
        @DisplayName("清空后统计归零")
        void clearShouldResetCounters() {
            NamespaceCacheStore store = store(NamespaceConfig.empty());
            store.set("a", 1, null);
            store.get("a");
            store.get("missing");

            store.clear();

            assertThat(store.getStats()).isEqualTo(NamespaceStatistics.empty("store"));
        }

        @Test
        @DisplayName("关闭统计时计数保持为零，大小照常报告")
        void disabledStatsShouldKeepCountersAtZero() {
            NamespaceCacheStore store = store(NamespaceConfig.builder().enableStats(false).build());
            store.set("a", 1, null);
            store.get("a");
            store.get("missing");

            NamespaceStatistics stats = store.getStats();
            assertThat(stats.hits()).isZero();
            assertThat(stats.misses()).isZero();
            assertThat(stats.sets()).isZero();
            assertThat(stats.size()).isEqualTo(1);
        }
    }

    /** 从不失效、也从不给出淘汰候选的策略 */
    private static class NoCandidateStrategy implements EvictionStrategy {

        @Override
        public String getName() {
            return "no-candidate";
        }

        @Override
        public CacheEvent onAccess(CacheEntry entry) {
            return null;
        }

        @Override
        public void onSet(CacheEntry entry) {}

        @Override
        public boolean shouldEvict(CacheEntry entry, NamespaceConfig config) {
            return false;
        }

        @Override
        public String selectEvictionCandidate(Map<String, CacheEntry> entries, NamespaceConfig config) {
            return null;
        }
    }
}
