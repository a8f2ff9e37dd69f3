package com.david.spring.cache.local.support;

import com.david.spring.cache.local.core.NamespaceCacheManager;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 缓存清理服务
 * 定期移除各命名空间中已失效的条目，避免只写不读的键长期占用内存
 */
@Slf4j
public class CacheCleanupService implements InitializingBean, DisposableBean {

    private final NamespaceCacheManager cacheManager;
    private final Duration interval;

    private final AtomicLong runs = new AtomicLong(0);
    private final AtomicLong totalRemoved = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);

    private ScheduledExecutorService scheduler;

    public CacheCleanupService(NamespaceCacheManager cacheManager, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Cleanup interval must be positive: " + interval);
        }
        this.cacheManager = cacheManager;
        this.interval = interval;
    }

    @Override
    public void afterPropertiesSet() {
        scheduler =
                Executors.newSingleThreadScheduledExecutor(
                        r -> {
                            Thread t = new Thread(r, "local-cache-cleanup");
                            t.setDaemon(true);
                            return t;
                        });
        long delayMs = interval.toMillis();
        scheduler.scheduleWithFixedDelay(this::cleanupExpiredEntries, delayMs, delayMs, TimeUnit.MILLISECONDS);
        log.info("Local cache cleanup scheduled every {}", interval);
    }

    /**
     * 清理所有命名空间中的失效条目
     *
     * @return 移除的条目数，失败时为 0
     */
    public int cleanupExpiredEntries() {
        long startTime = System.currentTimeMillis();
        log.debug("Starting local cache cleanup task");

        try {
            int removed = cacheManager.cleanup();
            runs.incrementAndGet();
            totalRemoved.addAndGet(removed);

            long duration = System.currentTimeMillis() - startTime;
            if (removed > 0) {
                log.info("Local cache cleanup completed: removed {} entries in {}ms", removed, duration);
            } else {
                log.debug("Local cache cleanup completed: nothing to remove ({}ms)", duration);
            }
            return removed;
        } catch (Exception e) {
            // 异常不能逃出调度线程，否则后续周期会被取消
            failures.incrementAndGet();
            log.error("Local cache cleanup failed", e);
            return 0;
        }
    }

    /**
     * 手动触发清理（用于测试或紧急情况）
     */
    public int forceCleanup() {
        log.info("Force cleanup triggered");
        return cleanupExpiredEntries();
    }

    public CleanupStats getCleanupStats() {
        return new CleanupStats(runs.get(), totalRemoved.get(), failures.get());
    }

    @Override
    public void destroy() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            log.info("Local cache cleanup stopped");
        }
    }

    /**
     * 清理统计信息
     */
    public record CleanupStats(long runs, long totalRemoved, long failures) {}
}
