package com.david.spring.cache.local.stats;

import java.util.Map;

/**
 * 全局统计视图，按需汇总各命名空间统计，不做持久化
 */
public record GlobalStatistics(
        int totalNamespaces,
        long totalEntries,
        long totalMemoryBytes,
        Map<String, NamespaceStatistics> namespaces) {

    public GlobalStatistics {
        namespaces = Map.copyOf(namespaces);
    }

    public long totalHits() {
        return namespaces.values().stream().mapToLong(NamespaceStatistics::hits).sum();
    }

    public long totalMisses() {
        return namespaces.values().stream().mapToLong(NamespaceStatistics::misses).sum();
    }

    public double hitRate() {
        long total = totalHits() + totalMisses();
        return total == 0 ? 0.0 : (double) totalHits() / total;
    }
}
