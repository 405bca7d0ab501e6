package com.demo.sessionauth.store;

import com.demo.sessionauth.cache.KeyValueCache;

import java.time.Duration;
import java.util.Objects;

/**
 * 基于 {@link KeyValueCache} 的 Refresh Token 存储。
 * <p>
 * 键空间：{@code refresh:<userId>:<sessionId>}，值为 refresh token 原文，TTL = refresh token 有效期。
 */
public class CacheRefreshTokenStore implements RefreshTokenStore {

    static final String PREFIX = "refresh:";

    private final KeyValueCache cache;

    public CacheRefreshTokenStore(KeyValueCache cache) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    @Override
    public void save(String userId, String sessionId, String token, Duration ttl) {
        cache.set(key(userId, sessionId), token, ttl);
    }

    @Override
    public String find(String userId, String sessionId) {
        return cache.get(key(userId, sessionId));
    }

    @Override
    public void revoke(String userId, String sessionId) {
        cache.delete(key(userId, sessionId));
    }

    @Override
    public int revokeAll(String userId) {
        String userPrefix = PREFIX + userId + ":";
        int revoked = 0;
        for (String key : cache.keys(KeyValueCache.escapePattern(userPrefix) + "*")) {
            // userId 本身可能含 ':'，"a" 的模式会匹配到 "a:b" 的 key
            if (key.indexOf(':', userPrefix.length()) >= 0) {
                continue;
            }
            cache.delete(key);
            revoked++;
        }
        return revoked;
    }

    private static String key(String userId, String sessionId) {
        return PREFIX + userId + ":" + sessionId;
    }
}
