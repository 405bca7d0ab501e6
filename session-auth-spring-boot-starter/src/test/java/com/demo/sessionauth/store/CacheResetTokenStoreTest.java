package com.demo.sessionauth.store;

import com.demo.sessionauth.cache.CacheCodec;
import com.demo.sessionauth.exception.AuthErrorCode;
import com.demo.sessionauth.exception.AuthException;
import com.demo.sessionauth.exception.StoreUnavailableException;
import com.demo.sessionauth.properties.SessionAuthProperties;
import com.demo.sessionauth.support.InMemoryKeyValueCache;
import com.demo.sessionauth.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CacheResetTokenStore 测试")
class CacheResetTokenStoreTest {

    private MutableClock clock;
    private InMemoryKeyValueCache cache;
    private CacheResetTokenStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        cache = new InMemoryKeyValueCache(clock);
        store = new CacheResetTokenStore(cache, new CacheCodec(), new SessionAuthProperties.PasswordReset(), clock);
    }

    private static AuthErrorCode errorOf(Runnable action) {
        try {
            action.run();
        } catch (AuthException e) {
            return e.getErrorCode();
        }
        return null;
    }

    // ===== 签发 / 消费 =====

    @Test
    @DisplayName("签发的令牌可以换回 userId，存储中只有哈希不含原文")
    void createAndConsume() {
        // Given
        ResetToken issued = store.create("u1");

        // Then
        assertThat(issued.token()).hasSize(64);
        assertThat(issued.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofMinutes(30)));
        assertThat(cache.keys("pwd:reset:*")).noneMatch(k -> k.contains(issued.token()));
        assertThat(issued.toString()).doesNotContain(issued.token());

        // When / Then
        assertThat(store.consume(issued.token())).isEqualTo("u1");
    }

    @Test
    @DisplayName("令牌只能使用一次，保留期内重放返回“已使用”，之后返回“无效”")
    void tokenIsSingleUse() {
        // Given
        ResetToken issued = store.create("u1");
        store.consume(issued.token());

        // Then
        assertThat(errorOf(() -> store.consume(issued.token()))).isEqualTo(AuthErrorCode.RESET_TOKEN_USED);

        clock.advance(Duration.ofMinutes(2));
        assertThat(errorOf(() -> store.consume(issued.token()))).isEqualTo(AuthErrorCode.RESET_TOKEN_INVALID);
    }

    @Test
    @DisplayName("过期、未知或空白令牌一律无效")
    void invalidTokens() {
        ResetToken issued = store.create("u1");
        clock.advance(Duration.ofMinutes(31));

        assertThat(errorOf(() -> store.consume(issued.token()))).isEqualTo(AuthErrorCode.RESET_TOKEN_INVALID);
        assertThat(errorOf(() -> store.consume("deadbeef"))).isEqualTo(AuthErrorCode.RESET_TOKEN_INVALID);
        assertThatThrownBy(() -> store.consume(" "))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getErrorCode())
                .isEqualTo(AuthErrorCode.RESET_TOKEN_INVALID);
    }

    @Test
    @DisplayName("重新签发后旧令牌失效")
    void reissueRevokesPrevious() {
        ResetToken first = store.create("u1");
        ResetToken second = store.create("u1");

        assertThat(errorOf(() -> store.consume(first.token()))).isEqualTo(AuthErrorCode.RESET_TOKEN_INVALID);
        assertThat(store.consume(second.token())).isEqualTo("u1");
    }

    @Test
    @DisplayName("吊销只影响该用户，重复吊销不报错")
    void revoke() {
        ResetToken mine = store.create("u1");
        ResetToken theirs = store.create("u2");

        store.revoke("u1");
        store.revoke("u1");

        assertThat(errorOf(() -> store.consume(mine.token()))).isEqualTo(AuthErrorCode.RESET_TOKEN_INVALID);
        assertThat(store.consume(theirs.token())).isEqualTo("u2");
    }

    // ===== 限流 =====

    @Test
    @DisplayName("窗口内最多 5 次，窗口过后重新计数")
    void attemptsAreLimitedPerWindow() {
        for (int i = 0; i < 5; i++) {
            assertThat(store.tryAttempt("alice@example.com")).isTrue();
        }
        assertThat(store.tryAttempt("alice@example.com")).isFalse();
        assertThat(store.tryAttempt("bob@example.com")).isTrue();

        clock.advance(Duration.ofMinutes(16));
        assertThat(store.tryAttempt("alice@example.com")).isTrue();
    }

    @Test
    @DisplayName("存储不可用时限流放行，签发则直接失败")
    void storeOutage() {
        cache.setUnavailable(true);

        assertThat(store.tryAttempt("alice@example.com")).isTrue();
        assertThatThrownBy(() -> store.create("u1")).isInstanceOf(StoreUnavailableException.class);
    }
}
