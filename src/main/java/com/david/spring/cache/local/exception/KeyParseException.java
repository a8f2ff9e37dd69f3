package com.david.spring.cache.local.exception;

import lombok.Getter;

/**
 * 结构化缓存键格式错误
 */
@Getter
public class KeyParseException extends CacheException {

    private final String key;

    public KeyParseException(String key, String reason) {
        super("Malformed cache key '" + key + "': " + reason);
        this.key = key;
    }
}
