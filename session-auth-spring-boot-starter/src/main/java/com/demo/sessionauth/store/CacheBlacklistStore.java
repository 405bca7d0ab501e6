package com.demo.sessionauth.store;

import com.demo.sessionauth.cache.CacheCodec;
import com.demo.sessionauth.cache.KeyValueCache;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 基于 {@link KeyValueCache} 的黑名单存储。
 * <p>
 * 键空间：
 * - {@code jwt:blacklist:<token>}：值固定为 "1"，TTL = token 剩余寿命；
 * - {@code jwt:issued:<userId>}：用户近期签发的 token 列表（JSON），TTL 随每次追加刷新。
 */
public class CacheBlacklistStore implements BlacklistStore {

    private static final Logger log = LoggerFactory.getLogger(CacheBlacklistStore.class);

    static final String BLACKLIST_PREFIX = "jwt:blacklist:";
    static final String ISSUED_PREFIX = "jwt:issued:";
    private static final TypeReference<List<String>> TOKEN_LIST = new TypeReference<>() {
    };

    private final KeyValueCache cache;
    private final CacheCodec codec;

    public CacheBlacklistStore(KeyValueCache cache, CacheCodec codec) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public void blacklist(String token, Duration ttl) {
        cache.set(BLACKLIST_PREFIX + token, "1", atLeastOneSecond(ttl));
        log.debug("Token blacklisted: {}", TokenPreview.of(token));
    }

    @Override
    public boolean isBlacklisted(String token) {
        return cache.exists(BLACKLIST_PREFIX + token);
    }

    @Override
    public void track(String userId, String token, Duration ttl) {
        String key = ISSUED_PREFIX + userId;
        List<String> tokens = new ArrayList<>(readTracked(key));
        if (!tokens.contains(token)) {
            tokens.add(token);
        }
        // 读-改-写不加锁：并发签发时可能丢失一条记录，只影响批量拉黑的覆盖面
        cache.set(key, codec.write(tokens), longest(ttl, cache.ttl(key)));
    }

    @Override
    public List<String> trackedTokens(String userId) {
        return List.copyOf(readTracked(ISSUED_PREFIX + userId));
    }

    @Override
    public void untrack(String userId, Collection<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return;
        }
        String key = ISSUED_PREFIX + userId;
        Set<String> removed = new HashSet<>(tokens);
        List<String> remaining = readTracked(key).stream()
                .filter(t -> !removed.contains(t))
                .toList();
        if (remaining.isEmpty()) {
            cache.delete(key);
            return;
        }
        Duration ttl = cache.ttl(key);
        cache.set(key, codec.write(remaining), ttl == null ? Duration.ofSeconds(1) : atLeastOneSecond(ttl));
    }

    private List<String> readTracked(String key) {
        List<String> tokens = codec.read(cache.get(key), TOKEN_LIST);
        return tokens == null ? List.of() : tokens;
    }

    private static Duration longest(Duration a, Duration b) {
        if (b == null || a.compareTo(b) >= 0) {
            return atLeastOneSecond(a);
        }
        return b;
    }

    private static Duration atLeastOneSecond(Duration ttl) {
        if (ttl == null || ttl.compareTo(Duration.ofSeconds(1)) < 0) {
            return Duration.ofSeconds(1);
        }
        return ttl;
    }
}
