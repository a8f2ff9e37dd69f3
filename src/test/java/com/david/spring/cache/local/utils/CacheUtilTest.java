package com.david.spring.cache.local.utils;

import static org.assertj.core.api.Assertions.*;

import com.david.spring.cache.local.config.JacksonConfig;
import com.david.spring.cache.local.core.CacheConstants;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@DisplayName("CacheUtil 工具方法测试")
class CacheUtilTest {

    @Nested
    @DisplayName("命名空间校验")
    class ValidateNamespace {

        @Test
        @DisplayName("允许字母、数字、下划线和连字符")
        void shouldAcceptValidNames() {
            assertThat(CacheUtil.validateNamespace("users")).isTrue();
            assertThat(CacheUtil.validateNamespace("user_profile-v2")).isTrue();
            assertThat(CacheUtil.validateNamespace("a".repeat(CacheConstants.MAX_NAMESPACE_LENGTH))).isTrue();
        }

        @Test
        @DisplayName("拒绝空值、超长和非法字符")
        void shouldRejectInvalidNames() {
            assertThat(CacheUtil.validateNamespace(null)).isFalse();
            assertThat(CacheUtil.validateNamespace("")).isFalse();
            assertThat(CacheUtil.validateNamespace("a".repeat(CacheConstants.MAX_NAMESPACE_LENGTH + 1))).isFalse();
            assertThat(CacheUtil.validateNamespace("user:profile")).isFalse();
            assertThat(CacheUtil.validateNamespace("user profile")).isFalse();
            assertThat(CacheUtil.validateNamespace("用户")).isFalse();
        }
    }

    @Nested
    @DisplayName("大小估算")
    class EstimateSize {

        private final ObjectMapper mapper = JacksonConfig.sizeEstimationMapper();

        @Test
        @DisplayName("按 JSON 序列化长度估算")
        void shouldUseSerializedLength() {
            assertThat(CacheUtil.estimateSize(null, mapper)).isZero();
            assertThat(CacheUtil.estimateSize("abc", mapper)).isEqualTo(5);
            assertThat(CacheUtil.estimateSize(Map.of("a", 1), mapper)).isEqualTo("{\"a\":1}".length());
        }

        @Test
        @DisplayName("支持 java.time 类型")
        void shouldSupportJavaTime() {
            assertThat(CacheUtil.estimateSize(LocalDate.of(2024, 1, 1), mapper)).isPositive();
        }

        @Test
        @DisplayName("循环引用返回固定的占位值而不是抛出异常")
        void shouldReturnSentinelForCyclicValue() {
            List<Object> cyclic = new ArrayList<>();
            cyclic.add(cyclic);

            assertThat(CacheUtil.estimateSize(cyclic, mapper)).isEqualTo(CacheConstants.UNKNOWN_SIZE_BYTES);
        }
    }

    @Nested
    @DisplayName("过期时间计算")
    class CalculateExpiry {

        @Test
        @DisplayName("显式 ttl 优先于默认 ttl")
        void explicitTtlWins() {
            assertThat(CacheUtil.calculateExpiry(Duration.ofMillis(50), Duration.ofSeconds(10), 1000L))
                    .isEqualTo(1050L);
        }

        @Test
        @DisplayName("没有显式 ttl 时使用默认 ttl")
        void fallsBackToDefaultTtl() {
            assertThat(CacheUtil.calculateExpiry(null, Duration.ofSeconds(1), 1000L)).isEqualTo(2000L);
            assertThat(CacheUtil.calculateExpiry(Duration.ZERO, Duration.ofSeconds(1), 1000L)).isEqualTo(2000L);
        }

        @Test
        @DisplayName("都没有时不过期")
        void noExpiryWithoutTtl() {
            assertThat(CacheUtil.calculateExpiry(null, null, 1000L)).isNull();
            assertThat(CacheUtil.calculateExpiry(Duration.ofSeconds(-1), Duration.ZERO, 1000L)).isNull();
        }

        @Test
        @DisplayName("超大 ttl 截断为 Long.MAX_VALUE 而不是溢出")
        void hugeTtlSaturates() {
            assertThat(CacheUtil.calculateExpiry(Duration.ofMillis(Long.MAX_VALUE), null, 1000L))
                    .isEqualTo(Long.MAX_VALUE);
            assertThat(CacheUtil.calculateExpiry(null, Duration.ofMillis(Long.MAX_VALUE - 500), 1000L))
                    .isEqualTo(Long.MAX_VALUE);
            assertThatCode(() -> CacheUtil.calculateExpiry(Duration.ofDays(365_000_000_000L), null, 1000L))
                    .doesNotThrowAnyException();
            assertThat(CacheUtil.calculateExpiry(Duration.ofDays(365_000_000_000L), null, 1000L))
                    .isEqualTo(Long.MAX_VALUE);
        }
    }
}
