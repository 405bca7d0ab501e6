package com.demo.sessionauth.cache;

import com.demo.sessionauth.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 基于 {@link StringRedisTemplate} 的 {@link KeyValueCache} 实现。
 * <p>
 * 命令超时由 Redis 客户端配置（spring.data.redis.timeout）控制；
 * 超时与连接异常都会转换为 {@link StoreUnavailableException}，由上层按策略处理。
 */
public class RedisKeyValueCache implements KeyValueCache {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueCache.class);

    private final StringRedisTemplate redisTemplate;

    public RedisKeyValueCache(StringRedisTemplate redisTemplate) {
        this.redisTemplate = Objects.requireNonNull(redisTemplate, "redisTemplate must not be null");
    }

    @Override
    public String get(String key) {
        return execute("GET", key, () -> redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0 for key " + key);
        }
        execute("SET", key, () -> {
            redisTemplate.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public void delete(String key) {
        execute("DEL", key, () -> redisTemplate.delete(key));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(execute("EXISTS", key, () -> redisTemplate.hasKey(key)));
    }

    @Override
    public Set<String> keys(String pattern) {
        Set<String> keys = execute("KEYS", pattern, () -> redisTemplate.keys(pattern));
        return keys == null ? Set.of() : keys;
    }

    @Override
    public Duration ttl(String key) {
        Long millis = execute("PTTL", key, () -> redisTemplate.getExpire(key, TimeUnit.MILLISECONDS));
        // -2：key 不存在；-1：未设置过期
        if (millis == null || millis < 0) {
            return null;
        }
        return Duration.ofMillis(millis);
    }

    private <T> T execute(String command, String key, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            log.error("Redis {} failed for key {}: {}", command, key, e.getMessage());
            throw new StoreUnavailableException("Redis " + command + " failed", e);
        }
    }
}
