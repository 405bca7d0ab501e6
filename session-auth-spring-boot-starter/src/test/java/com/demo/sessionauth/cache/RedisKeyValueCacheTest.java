package com.demo.sessionauth.cache;

import com.demo.sessionauth.exception.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisKeyValueCache 测试")
class RedisKeyValueCacheTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    private RedisKeyValueCache cache;

    @BeforeEach
    void setUp() {
        cache = new RedisKeyValueCache(redisTemplate);
    }

    @Test
    @DisplayName("set 带 TTL 写入")
    void setWithTtl() {
        // Given
        given(redisTemplate.opsForValue()).willReturn(valueOps);

        // When
        cache.set("k", "v", Duration.ofSeconds(30));

        // Then
        verify(valueOps).set("k", "v", Duration.ofSeconds(30));
    }

    @Test
    @DisplayName("非正 TTL 直接拒绝，不访问 Redis")
    void rejectsNonPositiveTtl() {
        assertThatThrownBy(() -> cache.set("k", "v", Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(redisTemplate);
    }

    @Test
    @DisplayName("连接失败转换为 StoreUnavailableException")
    void connectionFailureTranslated() {
        given(redisTemplate.opsForValue()).willReturn(valueOps);
        given(valueOps.get("k")).willThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> cache.get("k"))
                .isInstanceOf(StoreUnavailableException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }

    @Test
    @DisplayName("命令超时转换为 StoreUnavailableException")
    void timeoutTranslated() {
        given(redisTemplate.hasKey("k")).willThrow(new QueryTimeoutException("timeout"));

        assertThatThrownBy(() -> cache.exists("k")).isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    @DisplayName("exists / keys / ttl 的空值处理")
    void nullHandling() {
        given(redisTemplate.hasKey("missing")).willReturn(null);
        given(redisTemplate.keys("p:*")).willReturn(null);
        given(redisTemplate.getExpire("k", TimeUnit.MILLISECONDS)).willReturn(-2L);
        given(redisTemplate.getExpire("live", TimeUnit.MILLISECONDS)).willReturn(1500L);

        assertThat(cache.exists("missing")).isFalse();
        assertThat(cache.keys("p:*")).isEmpty();
        assertThat(cache.ttl("k")).isNull();
        assertThat(cache.ttl("live")).isEqualTo(Duration.ofMillis(1500));
    }

    @Test
    @DisplayName("keys 透传匹配模式")
    void keysDelegates() {
        given(redisTemplate.keys("session:*")).willReturn(Set.of("session:a"));

        assertThat(cache.keys("session:*")).containsExactly("session:a");
    }

    @Test
    @DisplayName("escapePattern 转义 * ? [ ] 与反斜杠")
    void escapePatternEscapesGlobCharacters() {
        assertThat(KeyValueCache.escapePattern("a*b?[c]\\d")).isEqualTo("a\\*b\\?\\[c\\]\\\\d");
        assertThat(KeyValueCache.escapePattern("plain:user")).isEqualTo("plain:user");
    }
}
