package com.david.spring.cache.local.config;

import com.david.spring.cache.local.core.NamespaceCacheManager;
import com.david.spring.cache.local.event.CacheEventListener;
import com.david.spring.cache.local.event.CacheEventPublisher;
import com.david.spring.cache.local.support.CacheCleanupService;

import lombok.extern.slf4j.Slf4j;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 本地命名空间缓存自动配置主入口
 *
 * <p>职责： 1. 绑定 cache.local 配置 2. 创建事件发布器与缓存管理器 3. 注册容器中的事件监听器 4. 按需启用定期清理
 */
@Slf4j
@AutoConfiguration
@ConditionalOnProperty(prefix = "cache.local", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(LocalCacheProperties.class)
public class LocalCacheAutoConfiguration {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public CacheEventPublisher localCacheEventPublisher(LocalCacheProperties properties) {
        LocalCacheProperties.Event event = properties.getEvent();
        if (!event.isAsync()) {
            return CacheEventPublisher.synchronous(event.getChannelCapacity());
        }

        AtomicInteger threadNumber = new AtomicInteger(1);
        ThreadPoolExecutor executor =
                new ThreadPoolExecutor(
                        event.getCorePoolSize(),
                        Math.max(event.getCorePoolSize(), event.getMaxPoolSize()),
                        60L,
                        TimeUnit.SECONDS,
                        new ArrayBlockingQueue<>(event.getQueueSize()),
                        r -> {
                            Thread t = new Thread(r, "local-cache-event-" + threadNumber.getAndIncrement());
                            t.setDaemon(true);
                            return t;
                        });
        log.info(
                "Local cache event publisher initialized: coreSize={}, maxSize={}, queueSize={}, channelCapacity={}",
                event.getCorePoolSize(),
                event.getMaxPoolSize(),
                event.getQueueSize(),
                event.getChannelCapacity());
        return new CacheEventPublisher(event.getChannelCapacity(), executor);
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public NamespaceCacheManager namespaceCacheManager(
            LocalCacheProperties properties,
            CacheEventPublisher localCacheEventPublisher,
            ObjectProvider<Clock> clock,
            ObjectProvider<CacheEventListener> listeners) {
        listeners.orderedStream().forEach(localCacheEventPublisher::registerListener);

        NamespaceCacheManager manager =
                NamespaceCacheManager.builder()
                        .defaultConfig(properties.toDefaultConfig())
                        .namespaceConfigs(properties.toNamespaceConfigs())
                        .clock(clock.getIfAvailable(Clock::systemUTC))
                        .eventPublisher(localCacheEventPublisher)
                        .build();
        log.info(
                "Local namespace cache manager initialized: presets={}, listeners={}",
                properties.getNamespaces().keySet(),
                localCacheEventPublisher.getListenerCount());
        return manager;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "cache.local.cleanup", name = "enabled", havingValue = "true", matchIfMissing = true)
    public CacheCleanupService localCacheCleanupService(
            NamespaceCacheManager namespaceCacheManager, LocalCacheProperties properties) {
        return new CacheCleanupService(namespaceCacheManager, properties.getCleanup().getInterval());
    }
}
