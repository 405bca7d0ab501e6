package com.demo.sessionauth.audit;

import com.demo.sessionauth.cache.CacheCodec;
import com.demo.sessionauth.cache.KeyValueCache;
import com.demo.sessionauth.exception.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 认证事件日志。
 * <p>
 * 键：{@code auth:event:<userId>:<epochMillis>}，固定 TTL。写入是尽力而为的：
 * 失败只记日志，不影响登录/登出主流程。
 */
public class AuthEventLog {

    private static final Logger log = LoggerFactory.getLogger(AuthEventLog.class);

    static final String EVENT_PREFIX = "auth:event:";
    private static final int MAX_KEY_ATTEMPTS = 16;

    private final KeyValueCache cache;
    private final CacheCodec codec;
    private final Duration ttl;
    private final boolean enabled;
    private final Clock clock;

    public AuthEventLog(KeyValueCache cache, CacheCodec codec, Duration ttl, boolean enabled, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.enabled = enabled;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void record(AuthEvent event) {
        if (!enabled || event == null) {
            return;
        }
        try {
            String key = nextKey(event.userId());
            cache.set(key, codec.write(event), ttl);
            log.debug("Auth event tracked: type={}, userId={}, sessionId={}",
                    event.eventType(), event.userId(), event.sessionId());
        } catch (RuntimeException e) {
            log.warn("Failed to track auth event {}: {}", event.eventType(), e.getMessage());
        }
    }

    /**
     * 最近的事件，按时间倒序。
     */
    public List<AuthEvent> recent(String userId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        try {
            String userPrefix = EVENT_PREFIX + userId + ":";
            List<String> keys = new ArrayList<>();
            for (String key : cache.keys(KeyValueCache.escapePattern(userPrefix) + "*")) {
                // 只认 <userPrefix><millis>，排除形如 <userId>:xxx 的其他用户
                if (isMillis(key, userPrefix.length())) {
                    keys.add(key);
                }
            }
            // 按数字后缀排序，字符串排序在毫秒位数变化时会错位
            keys.sort(Comparator.comparingLong(AuthEventLog::suffix).reversed());

            List<AuthEvent> events = new ArrayList<>();
            for (String key : keys) {
                if (events.size() >= limit) break;
                AuthEvent event = codec.read(cache.get(key), AuthEvent.class);
                if (event != null) {
                    events.add(event);
                }
            }
            return events;
        } catch (StoreUnavailableException e) {
            log.warn("Failed to read auth events for user {}: {}", userId, e.getMessage());
            return List.of();
        }
    }

    // 同一毫秒内的多条事件顺延后缀，避免互相覆盖
    private String nextKey(String userId) {
        long millis = clock.millis();
        String key = EVENT_PREFIX + userId + ":" + millis;
        for (int i = 1; i < MAX_KEY_ATTEMPTS && cache.exists(key); i++) {
            key = EVENT_PREFIX + userId + ":" + (millis + i);
        }
        return key;
    }

    private static boolean isMillis(String key, int from) {
        if (from >= key.length()) {
            return false;
        }
        for (int i = from; i < key.length(); i++) {
            if (!Character.isDigit(key.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static long suffix(String key) {
        int idx = key.lastIndexOf(':');
        try {
            return Long.parseLong(key.substring(idx + 1));
        } catch (NumberFormatException e) {
            return Long.MIN_VALUE;
        }
    }
}
