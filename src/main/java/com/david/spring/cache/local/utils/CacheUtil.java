package com.david.spring.cache.local.utils;

import com.david.spring.cache.local.core.CacheConstants;
import com.david.spring.cache.local.core.CacheEntry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

import org.springframework.lang.Nullable;

import java.time.Duration;
import java.util.regex.Pattern;

/**
 * 缓存工具方法：命名空间校验、大小估算、过期计算
 */
@Slf4j
public final class CacheUtil {

    private static final Pattern NAMESPACE_PATTERN =
            Pattern.compile("^[A-Za-z0-9_-]{1," + CacheConstants.MAX_NAMESPACE_LENGTH + "}$");

    private CacheUtil() {}

    /**
     * 校验命名空间名称，仅允许字母、数字、下划线和连字符，长度 1-50
     *
     * @param name 命名空间名称
     * @return true=合法
     */
    public static boolean validateNamespace(@Nullable String name) {
        return name != null && NAMESPACE_PATTERN.matcher(name).matches();
    }

    /**
     * 估算值序列化后的字节数，仅供参考
     *
     * <p>无法序列化（含循环引用）时返回 {@link CacheConstants#UNKNOWN_SIZE_BYTES}，不会抛出异常。
     *
     * @param value 待估算的值
     * @param objectMapper 用于序列化的 ObjectMapper
     * @return 估算字节数
     */
    public static long estimateSize(@Nullable Object value, ObjectMapper objectMapper) {
        if (value == null) {
            return 0L;
        }
        try {
            return objectMapper.writeValueAsBytes(value).length;
        } catch (JsonProcessingException | RuntimeException e) {
            if (log.isDebugEnabled()) {
                log.debug(
                        "Size estimation failed for type={}, using sentinel: {}",
                        value.getClass().getName(),
                        e.getMessage());
            }
            return CacheConstants.UNKNOWN_SIZE_BYTES;
        } catch (StackOverflowError e) {
            log.debug("Size estimation overflowed for type={}", value.getClass().getName());
            return CacheConstants.UNKNOWN_SIZE_BYTES;
        }
    }

    /**
     * 判断条目在给定时刻是否已过期
     */
    public static boolean isExpired(CacheEntry entry, long now) {
        return entry.isExpiredAt(now);
    }

    /**
     * 计算过期时间戳
     *
     * <p>显式 ttl 为正数时优先；否则使用为正数的 defaultTtl；都没有则不过期。
     * 超出 long 毫秒范围的结果截断为 {@link Long#MAX_VALUE}。
     *
     * @param ttl 本次写入的 ttl
     * @param defaultTtl 命名空间默认 ttl
     * @param now 当前时间戳（毫秒）
     * @return 过期时间戳，null 表示不过期
     */
    @Nullable
    public static Long calculateExpiry(
            @Nullable Duration ttl, @Nullable Duration defaultTtl, long now) {
        Duration effective = isPositive(ttl) ? ttl : isPositive(defaultTtl) ? defaultTtl : null;
        if (effective == null) {
            return null;
        }
        try {
            return Math.addExact(now, effective.toMillis());
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static boolean isPositive(@Nullable Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
}
