package com.demo.sessionauth.session;

import com.demo.sessionauth.audit.AuthEvent;
import com.demo.sessionauth.audit.AuthEventLog;
import com.demo.sessionauth.audit.AuthEventType;
import com.demo.sessionauth.cache.CacheCodec;
import com.demo.sessionauth.cache.KeyValueCache;
import com.demo.sessionauth.properties.SessionAuthProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 基于 {@link KeyValueCache} 的会话存储。
 * <p>
 * 键空间：
 * - {@code session:<sessionId>}：会话 JSON，TTL = 会话有效期；
 * - {@code session:user:<userId>}：该用户的会话 id 列表（按创建顺序），TTL = 会话有效期。
 * <p>
 * 会话索引的读-改-写不加锁。同一用户并发登录时列表可能暂时多出一条，下一次写入时自动收敛。
 */
public class CacheSessionStore implements SessionRepository {

    private static final Logger log = LoggerFactory.getLogger(CacheSessionStore.class);

    static final String SESSION_PREFIX = "session:";
    static final String USER_SESSION_PREFIX = "session:user:";
    private static final TypeReference<List<String>> ID_LIST = new TypeReference<>() {
    };
    private static final Duration MIN_TTL = Duration.ofSeconds(1);

    private final KeyValueCache cache;
    private final CacheCodec codec;
    private final AuthEventLog eventLog;
    private final Duration ttl;
    private final boolean rolling;
    private final int maxSessions;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public CacheSessionStore(KeyValueCache cache,
                             CacheCodec codec,
                             AuthEventLog eventLog,
                             SessionAuthProperties.Session settings,
                             Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.eventLog = Objects.requireNonNull(eventLog, "eventLog must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");

        if (settings.getTtl() == null || settings.getTtl().compareTo(MIN_TTL) < 0) {
            throw new IllegalArgumentException("session-auth.session.ttl must be >= 1s");
        }
        if (settings.getMaxSessions() < 1) {
            throw new IllegalArgumentException("session-auth.session.max-sessions must be >= 1");
        }
        this.ttl = settings.getTtl();
        this.rolling = settings.isRolling();
        this.maxSessions = settings.getMaxSessions();
    }

    // =========================
    // 创建
    // =========================

    @Override
    public UserSession createSession(String userId, DeviceInfo deviceInfo, String deviceId) {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        Instant now = clock.instant();
        UserSession session = new UserSession(generateSessionId(), userId, deviceId, deviceInfo, now, now.plus(ttl));

        save(session, ttl);
        manageUserSessionLimit(userId, session.getSessionId());

        eventLog.record(new AuthEvent(
                userId,
                session.getSessionId(),
                AuthEventType.LOGIN.value(),
                true,
                deviceInfo == null ? null : deviceInfo.ip(),
                deviceInfo == null ? null : deviceInfo.userAgent(),
                now,
                deviceId == null ? Map.of() : Map.of("deviceId", deviceId)
        ));

        log.info("Session created: sessionId={}, userId={}, deviceId={}", session.getSessionId(), userId, deviceId);
        return session;
    }

    /**
     * 把新会话追加到用户索引；超出上限时按创建顺序淘汰最早的会话，只保留最近的 maxSessions 个。
     * <p>
     * 淘汰依据是创建顺序而不是最近活跃时间：一个很久没用但创建较晚的会话可能比常用的旧会话活得更久。
     */
    public void manageUserSessionLimit(String userId, String newSessionId) {
        List<String> sessionIds = new ArrayList<>(readIndex(userId));
        sessionIds.add(newSessionId);

        if (sessionIds.size() > maxSessions) {
            List<String> evicted = List.copyOf(sessionIds.subList(0, sessionIds.size() - maxSessions));
            for (String sessionId : evicted) {
                destroy(sessionId, AuthEventType.EVICTED);
            }
            sessionIds = new ArrayList<>(sessionIds.subList(sessionIds.size() - maxSessions, sessionIds.size()));
            log.info("Session limit reached for user {}, evicted {} session(s)", userId, evicted.size());
        }
        writeIndex(userId, sessionIds);
    }

    // =========================
    // 读取 / 续期
    // =========================

    @Override
    public Optional<UserSession> getSession(String sessionId) {
        Optional<UserSession> found = peekSession(sessionId);
        if (found.isEmpty()) {
            return found;
        }
        if (found.get().isExpired(clock.instant())) {
            // 惰性过期：读到即清理
            destroy(sessionId, AuthEventType.EXPIRED);
            return Optional.empty();
        }
        return rolling ? touchSession(sessionId) : found;
    }

    @Override
    public Optional<UserSession> peekSession(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(codec.read(cache.get(SESSION_PREFIX + sessionId), UserSession.class));
    }

    @Override
    public Optional<UserSession> touchSession(String sessionId) {
        Optional<UserSession> found = peekSession(sessionId);
        if (found.isEmpty()) {
            return found;
        }
        UserSession session = found.get();
        Instant now = clock.instant();
        if (session.isExpired(now)) {
            return Optional.empty();
        }

        session.setLastActiveAt(now);
        Duration entryTtl;
        if (rolling) {
            session.setExpiresAt(now.plus(ttl));
            entryTtl = ttl;
        } else {
            // 非滚动：过期时间不变，缓存 TTL 取剩余寿命
            entryTtl = atLeastOneSecond(Duration.between(now, session.getExpiresAt()));
        }
        save(session, entryTtl);
        return Optional.of(session);
    }

    @Override
    public List<UserSession> getUserSessions(String userId) {
        List<UserSession> sessions = new ArrayList<>();
        for (String sessionId : readIndex(userId)) {
            getSession(sessionId)
                    .filter(UserSession::isActive)
                    .ifPresent(sessions::add);
        }
        return sessions;
    }

    @Override
    public boolean markDeviceVerified(String sessionId) {
        Optional<UserSession> found = peekSession(sessionId);
        if (found.isEmpty()) {
            return false;
        }
        UserSession session = found.get();
        Instant now = clock.instant();
        if (session.isExpired(now)) {
            return false;
        }
        session.setDeviceVerified(true);
        save(session, atLeastOneSecond(Duration.between(now, session.getExpiresAt())));
        log.info("Device verified for session {}", sessionId);
        return true;
    }

    // =========================
    // 销毁
    // =========================

    @Override
    public void destroySession(String sessionId) {
        destroy(sessionId, AuthEventType.LOGOUT);
    }

    @Override
    public void destroySession(String sessionId, AuthEventType reason) {
        destroy(sessionId, Objects.requireNonNull(reason, "reason must not be null"));
    }

    @Override
    public void destroyAllUserSessions(String userId, String excludeSessionId) {
        for (String sessionId : readIndex(userId)) {
            if (!sessionId.equals(excludeSessionId)) {
                destroySession(sessionId);
            }
        }

        if (StringUtils.hasText(excludeSessionId) && peekSession(excludeSessionId).isPresent()) {
            writeIndex(userId, List.of(excludeSessionId));
        } else {
            cache.delete(USER_SESSION_PREFIX + userId);
        }
        log.info("All sessions destroyed for user {} (kept: {})", userId, excludeSessionId);
    }

    @Override
    public int cleanupExpiredSessions() {
        Instant now = clock.instant();
        int cleaned = 0;
        for (String key : cache.keys(SESSION_PREFIX + "*")) {
            if (key.startsWith(USER_SESSION_PREFIX)) {
                continue;
            }
            String sessionId = key.substring(SESSION_PREFIX.length());
            try {
                UserSession session = codec.read(cache.get(key), UserSession.class);
                if (session != null && session.isExpired(now)) {
                    destroy(sessionId, AuthEventType.EXPIRED);
                    cleaned++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to clean up session {}: {}", sessionId, e.getMessage());
            }
        }
        log.debug("Session cleanup completed, cleaned={}", cleaned);
        return cleaned;
    }

    // =========================
    // 统计 / 审计
    // =========================

    @Override
    public SessionStats getSessionStats() {
        Instant now = clock.instant();
        int total = 0;
        int active = 0;
        int expired = 0;
        for (String key : cache.keys(SESSION_PREFIX + "*")) {
            if (key.startsWith(USER_SESSION_PREFIX)) {
                continue;
            }
            UserSession session = codec.read(cache.get(key), UserSession.class);
            if (session == null) {
                continue;
            }
            total++;
            if (session.isActive() && !session.isExpired(now)) {
                active++;
            } else {
                expired++;
            }
        }
        return new SessionStats(total, active, expired);
    }

    @Override
    public List<AuthEvent> getUserAuthEvents(String userId, int limit) {
        return eventLog.recent(userId, limit);
    }

    // =========================
    // 内部辅助方法
    // =========================

    private void destroy(String sessionId, AuthEventType reason) {
        Optional<UserSession> found = peekSession(sessionId);
        if (found.isPresent()) {
            UserSession session = found.get();
            removeFromIndex(session.getUserId(), sessionId);
            eventLog.record(new AuthEvent(
                    session.getUserId(), sessionId, reason.value(), true,
                    null, null, clock.instant(), Map.of()));
        }
        cache.delete(SESSION_PREFIX + sessionId);
        log.info("Session destroyed: sessionId={}, reason={}", sessionId, reason.value());
    }

    private void save(UserSession session, Duration entryTtl) {
        cache.set(SESSION_PREFIX + session.getSessionId(), codec.write(session), entryTtl);
    }

    private List<String> readIndex(String userId) {
        List<String> ids = codec.read(cache.get(USER_SESSION_PREFIX + userId), ID_LIST);
        return ids == null ? List.of() : ids;
    }

    private void writeIndex(String userId, List<String> sessionIds) {
        cache.set(USER_SESSION_PREFIX + userId, codec.write(sessionIds), ttl);
    }

    private void removeFromIndex(String userId, String sessionId) {
        List<String> remaining = readIndex(userId).stream()
                .filter(id -> !id.equals(sessionId))
                .toList();
        if (remaining.isEmpty()) {
            cache.delete(USER_SESSION_PREFIX + userId);
        } else {
            writeIndex(userId, remaining);
        }
    }

    private String generateSessionId() {
        byte[] bytes = new byte[32];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static Duration atLeastOneSecond(Duration d) {
        return d.compareTo(MIN_TTL) < 0 ? MIN_TTL : d;
    }
}
