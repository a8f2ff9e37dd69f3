package com.david.spring.cache.local.exception;

/**
 * 本地缓存异常基类
 */
public class CacheException extends RuntimeException {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
