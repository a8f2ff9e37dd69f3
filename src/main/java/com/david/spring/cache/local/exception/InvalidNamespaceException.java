package com.david.spring.cache.local.exception;

import lombok.Getter;

/**
 * 命名空间名称不合法
 */
@Getter
public class InvalidNamespaceException extends CacheException {

    private final String namespace;

    public InvalidNamespaceException(String namespace) {
        super("Invalid namespace: " + namespace);
        this.namespace = namespace;
    }
}
