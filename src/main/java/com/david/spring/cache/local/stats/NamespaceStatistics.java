package com.david.spring.cache.local.stats;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Locale;

/**
 * 命名空间统计快照
 *
 * <p>计数器单调递增（clear 时归零）；hitRate、avgAccessCount、oldestEntry、newestEntry
 * 在读取时根据当前条目重新计算，不做增量维护。
 */
public record NamespaceStatistics(
        String namespace,
        long hits,
        long misses,
        long sets,
        long deletes,
        long evictions,
        long expirations,
        int size,
        double hitRate,
        double avgAccessCount,
        @Nullable Instant oldestEntry,
        @Nullable Instant newestEntry,
        long approxSizeBytes) {

    public static NamespaceStatistics empty(String namespace) {
        return new NamespaceStatistics(namespace, 0, 0, 0, 0, 0, 0, 0, 0.0, 0.0, null, null, 0);
    }

    public long requests() {
        return hits + misses;
    }

    @Override
    @NonNull
    public String toString() {
        return String.format(
                Locale.ROOT,
                "NamespaceStatistics{namespace=%s, size=%d, hits=%d, misses=%d, hitRate=%.2f, sets=%d, deletes=%d, evictions=%d, expirations=%d}",
                namespace, size, hits, misses, hitRate, sets, deletes, evictions, expirations);
    }
}
