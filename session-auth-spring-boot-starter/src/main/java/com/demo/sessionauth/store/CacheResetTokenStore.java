package com.demo.sessionauth.store;

import com.demo.sessionauth.cache.CacheCodec;
import com.demo.sessionauth.cache.KeyValueCache;
import com.demo.sessionauth.exception.AuthErrorCode;
import com.demo.sessionauth.exception.AuthException;
import com.demo.sessionauth.exception.StoreUnavailableException;
import com.demo.sessionauth.properties.SessionAuthProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;

/**
 * 基于 {@link KeyValueCache} 的密码重置令牌存储。
 * <p>
 * 键空间：
 * - {@code pwd:reset:<sha256>}：令牌记录（JSON），TTL = 令牌有效期；消费后改为短暂保留
 * - {@code pwd:reset:user:<userId>}：该用户当前令牌的 sha256
 * - {@code pwd:attempt:<identifier>}：窗口内的请求次数
 */
public class CacheResetTokenStore implements ResetTokenStore {

    private static final Logger log = LoggerFactory.getLogger(CacheResetTokenStore.class);

    static final String RESET_PREFIX = "pwd:reset:";
    static final String USER_PREFIX = "pwd:reset:user:";
    static final String ATTEMPT_PREFIX = "pwd:attempt:";

    /**
     * 存储中的令牌记录，不含原文。
     */
    public record Entry(String userId, Instant expiresAt, boolean used, Instant createdAt) {
    }

    private final KeyValueCache cache;
    private final CacheCodec codec;
    private final SessionAuthProperties.PasswordReset settings;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public CacheResetTokenStore(KeyValueCache cache, CacheCodec codec,
                                SessionAuthProperties.PasswordReset settings, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public ResetToken create(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        revoke(userId);

        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        String token = HexFormat.of().formatHex(bytes);
        String hashed = sha256(token);

        Instant now = clock.instant();
        Duration ttl = settings.getTokenTtl();
        Instant expiresAt = now.plus(ttl);
        cache.set(RESET_PREFIX + hashed, codec.write(new Entry(userId, expiresAt, false, now)), ttl);
        cache.set(USER_PREFIX + userId, hashed, ttl);

        log.info("Password reset token created for user {}, expires in {}", userId, ttl);
        return new ResetToken(token, userId, expiresAt);
    }

    @Override
    public String consume(String token) {
        if (!StringUtils.hasText(token)) {
            throw new AuthException(AuthErrorCode.RESET_TOKEN_INVALID);
        }
        String hashed = sha256(token);
        String key = RESET_PREFIX + hashed;

        Entry entry = codec.read(cache.get(key), Entry.class);
        if (entry == null) {
            throw new AuthException(AuthErrorCode.RESET_TOKEN_INVALID);
        }
        if (entry.used()) {
            throw new AuthException(AuthErrorCode.RESET_TOKEN_USED);
        }
        if (!clock.instant().isBefore(entry.expiresAt())) {
            cache.delete(key);
            throw new AuthException(AuthErrorCode.RESET_TOKEN_INVALID);
        }

        // 标记为已使用并短暂保留，重放时能给出明确的错误
        cache.set(key, codec.write(new Entry(entry.userId(), entry.expiresAt(), true, entry.createdAt())),
                settings.getUsedRetention());
        cache.delete(USER_PREFIX + entry.userId());

        log.info("Password reset token consumed for user {}", entry.userId());
        return entry.userId();
    }

    @Override
    public void revoke(String userId) {
        String userKey = USER_PREFIX + userId;
        String hashed = cache.get(userKey);
        if (hashed != null) {
            cache.delete(RESET_PREFIX + hashed);
            cache.delete(userKey);
            log.info("Password reset token revoked for user {}", userId);
        }
    }

    /**
     * 存储不可用时放行。
     */
    @Override
    public boolean tryAttempt(String identifier) {
        String key = ATTEMPT_PREFIX + identifier;
        try {
            int attempts = parseCount(cache.get(key));
            if (attempts >= settings.getMaxAttempts()) {
                log.warn("Password reset rate limit exceeded for {} ({} attempts)", identifier, attempts);
                return false;
            }
            cache.set(key, String.valueOf(attempts + 1), settings.getAttemptWindow());
            return true;
        } catch (StoreUnavailableException e) {
            log.warn("Failed to track password reset attempt for {}: {}", identifier, e.getMessage());
            return true;
        }
    }

    private static int parseCount(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Discarding unreadable attempt counter: {}", value);
            return 0;
        }
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
