package com.demo.sessionauth.store;

import com.demo.sessionauth.cache.CacheCodec;
import com.demo.sessionauth.exception.StoreUnavailableException;
import com.demo.sessionauth.support.InMemoryKeyValueCache;
import com.demo.sessionauth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CacheBlacklistStore 测试")
class CacheBlacklistStoreTest {

    private MutableClock clock;
    private InMemoryKeyValueCache cache;
    private CacheBlacklistStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        cache = new InMemoryKeyValueCache(clock);
        store = new CacheBlacklistStore(cache, new CacheCodec());
    }

    @Test
    @DisplayName("黑名单条目到期自动消失")
    void entryExpiresWithTtl() {
        store.blacklist("tok", Duration.ofMinutes(5));
        assertThat(store.isBlacklisted("tok")).isTrue();
        assertThat(cache.get("jwt:blacklist:tok")).isEqualTo("1");

        clock.advance(Duration.ofMinutes(5));

        assertThat(store.isBlacklisted("tok")).isFalse();
    }

    @Test
    @DisplayName("TTL 不足 1 秒时按 1 秒存储")
    void minimumTtlIsOneSecond() {
        store.blacklist("tok", Duration.ofMillis(10));

        assertThat(cache.ttl("jwt:blacklist:tok")).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("存储不可用时 isBlacklisted 抛 StoreUnavailableException")
    void unavailableStorePropagates() {
        cache.setUnavailable(true);

        assertThatThrownBy(() -> store.isBlacklisted("tok")).isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    @DisplayName("追踪列表去重，TTL 取较长者，移除后为空则删除 key")
    void trackAndUntrack() {
        store.track("u1", "a", Duration.ofHours(1));
        store.track("u1", "b", Duration.ofMinutes(10));
        store.track("u1", "a", Duration.ofHours(1));

        assertThat(store.trackedTokens("u1")).containsExactly("a", "b");
        assertThat(cache.ttl("jwt:issued:u1")).isEqualTo(Duration.ofHours(1));

        store.untrack("u1", List.of("a"));
        assertThat(store.trackedTokens("u1")).containsExactly("b");

        store.untrack("u1", List.of("b"));
        assertThat(cache.containsRaw("jwt:issued:u1")).isFalse();
        assertThat(store.trackedTokens("u1")).isEmpty();
    }
}
