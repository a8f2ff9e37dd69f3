package com.david.spring.cache.local.support;

import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * 缓存异常处理工具类
 * 隔离回调类副作用的异常，保证缓存自身操作不受影响
 */
@Slf4j
public final class CacheExceptionHandler {

    private CacheExceptionHandler() {
        // 工具类不允许实例化
    }

    /**
     * 安全执行操作，发生异常时记录日志（无返回值）
     *
     * @param operation 要执行的操作
     * @param operationName 操作名称（用于日志）
     * @param context 上下文信息（用于日志）
     * @return true=执行成功
     */
    public static boolean safeExecute(Runnable operation, String operationName, Object... context) {
        try {
            operation.run();
            return true;
        } catch (Exception e) {
            logException(operationName, e, context);
            return false;
        }
    }

    /**
     * 记录异常日志
     */
    private static void logException(String operationName, Exception e, Object... context) {
        if (context.length > 0) {
            log.warn(
                    "Operation '{}' failed with context {}: {}",
                    operationName,
                    formatContext(context),
                    e.getMessage(),
                    e);
        } else {
            log.warn("Operation '{}' failed: {}", operationName, e.getMessage(), e);
        }
    }

    private static String formatContext(Object... context) {
        return Arrays.stream(context).map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
    }
}
