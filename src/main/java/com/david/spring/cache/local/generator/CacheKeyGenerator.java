package com.david.spring.cache.local.generator;

import static com.david.spring.cache.local.core.CacheConstants.*;

import cn.hutool.crypto.digest.DigestUtil;

import com.david.spring.cache.local.config.JacksonConfig;
import com.david.spring.cache.local.exception.KeyParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * 结构化缓存键生成器
 *
 * <p>格式：{@code entityType:entityId[:paramsHash]}。参数先序列化为规范化 JSON（Map 键与属性排序），
 * 再取 MD5，因此语义相同的参数与字段顺序无关，生成的键一致。
 */
@Slf4j
public class CacheKeyGenerator {

    private static final Pattern HASH_PATTERN = Pattern.compile("^[0-9a-f]{" + HASH_LENGTH + "}$");

    private final ObjectMapper canonicalMapper;

    public CacheKeyGenerator() {
        this(JacksonConfig.canonicalKeyMapper());
    }

    public CacheKeyGenerator(ObjectMapper canonicalMapper) {
        this.canonicalMapper = canonicalMapper;
    }

    @NonNull
    public String generateKey(String entityType, String entityId) {
        return generateKey(entityType, entityId, null);
    }

    /**
     * 生成缓存键
     *
     * @param entityType 实体类型，不能为空且不能包含分隔符
     * @param entityId 实体ID，不能为空且不能包含分隔符
     * @param params 附加参数，可为空
     * @return 缓存键
     */
    @NonNull
    public String generateKey(
            String entityType, String entityId, @Nullable Map<String, ?> params) {
        requireSegment(entityType, "entityType");
        requireSegment(entityId, "entityId");

        StringBuilder keyBuilder = new StringBuilder();
        keyBuilder.append(entityType).append(CACHE_KEY_SEPARATOR).append(entityId);

        if (params != null && !params.isEmpty()) {
            keyBuilder.append(CACHE_KEY_SEPARATOR).append(hashParams(params));
        }

        String key = keyBuilder.toString();
        log.debug("Generated cache key: {}", key);
        return key;
    }

    /**
     * 分解缓存键
     *
     * @param key 由 {@link #generateKey} 生成的键
     * @return 分解结果
     * @throws KeyParseException 键格式错误
     */
    public ParsedKey parseKey(@Nullable String key) {
        if (!StringUtils.hasText(key)) {
            throw new KeyParseException(String.valueOf(key), "key is empty");
        }

        String[] segments = key.split(CACHE_KEY_SEPARATOR, -1);
        if (segments.length < 2 || segments.length > 3) {
            throw new KeyParseException(key, "expected 2 or 3 segments but found " + segments.length);
        }
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new KeyParseException(key, "empty segment");
            }
        }

        if (segments.length == 2) {
            return new ParsedKey(segments[0], segments[1]);
        }
        if (!HASH_PATTERN.matcher(segments[2]).matches()) {
            throw new KeyParseException(key, "params segment is not an MD5 digest");
        }
        return new ParsedKey(segments[0], segments[1], segments[2]);
    }

    private String hashParams(Map<String, ?> params) {
        try {
            return DigestUtil.md5Hex(canonicalMapper.writeValueAsString(params));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Key params are not serializable: " + e.getMessage(), e);
        }
    }

    private static void requireSegment(@Nullable String segment, String name) {
        if (!StringUtils.hasText(segment)) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        if (segment.contains(CACHE_KEY_SEPARATOR)) {
            throw new IllegalArgumentException(
                    name + " must not contain '" + CACHE_KEY_SEPARATOR + "': " + segment);
        }
    }
}
