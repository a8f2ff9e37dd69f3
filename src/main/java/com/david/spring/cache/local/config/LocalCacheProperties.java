package com.david.spring.cache.local.config;

import com.david.spring.cache.local.core.CacheConstants;
import com.david.spring.cache.local.core.NamespaceConfig;

import lombok.Data;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "cache.local")
public class LocalCacheProperties {

    private boolean enabled = true;

    /** 全局默认最大条目数 */
    private Integer maxSize;

    /** 全局默认 TTL，为空表示不过期 */
    private Duration defaultTtl;

    /** 全局默认淘汰策略 */
    private String strategy;

    private Boolean enableStats;

    /** 按命名空间预置的配置 */
    private Map<String, NamespaceProperties> namespaces = new LinkedHashMap<>();

    private Cleanup cleanup = new Cleanup();

    private Event event = new Event();

    public NamespaceConfig toDefaultConfig() {
        return NamespaceConfig.builder()
                .maxSize(maxSize)
                .defaultTtl(defaultTtl)
                .strategy(strategy)
                .enableStats(enableStats)
                .build();
    }

    public Map<String, NamespaceConfig> toNamespaceConfigs() {
        Map<String, NamespaceConfig> configs = new LinkedHashMap<>();
        namespaces.forEach((name, props) -> configs.put(name, props.toConfig()));
        return configs;
    }

    @Data
    public static class NamespaceProperties {
        private Integer maxSize;
        private Duration defaultTtl;
        private String strategy;
        private Boolean enableStats;

        NamespaceConfig toConfig() {
            return NamespaceConfig.builder()
                    .maxSize(maxSize)
                    .defaultTtl(defaultTtl)
                    .strategy(strategy)
                    .enableStats(enableStats)
                    .build();
        }
    }

    @Data
    public static class Cleanup {
        /** 是否启用定期清理 */
        private boolean enabled = true;

        /** 清理间隔 */
        private Duration interval = Duration.ofMinutes(1);
    }

    @Data
    public static class Event {
        /** 可拉取事件通道容量，满时丢弃最旧事件 */
        private int channelCapacity = CacheConstants.DEFAULT_EVENT_CHANNEL_CAPACITY;

        /** 是否在独立线程池中分发监听器 */
        private boolean async = true;

        private int corePoolSize = 1;
        private int maxPoolSize = 2;
        private int queueSize = 1000;
    }
}
