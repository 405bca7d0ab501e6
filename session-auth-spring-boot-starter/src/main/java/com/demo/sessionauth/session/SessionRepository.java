package com.demo.sessionauth.session;

import com.demo.sessionauth.audit.AuthEvent;
import com.demo.sessionauth.audit.AuthEventType;

import java.util.List;
import java.util.Optional;

/**
 * 服务端会话存储。
 * <p>
 * 读取类操作在存储不可用时抛出 {@link com.demo.sessionauth.exception.StoreUnavailableException}，
 * 由调用方决定如何处理（认证路径上一律按失败处理）。
 */
public interface SessionRepository {

    /**
     * 创建会话并执行每用户会话数上限（超出时淘汰最早创建的会话）。
     *
     * @param deviceInfo 可为 null
     * @param deviceId   可为 null
     */
    UserSession createSession(String userId, DeviceInfo deviceInfo, String deviceId);

    /**
     * 读取会话：已过期的会话当场销毁并视为不存在；开启滚动续期时顺带 touch。
     */
    Optional<UserSession> getSession(String sessionId);

    /**
     * 原样读取，不做过期清理也不续期。
     */
    Optional<UserSession> peekSession(String sessionId);

    /**
     * 更新 lastActiveAt；滚动模式下同时把 expiresAt 延长到 now + ttl。
     *
     * @return 更新后的会话；会话不存在或已过期时为空
     */
    Optional<UserSession> touchSession(String sessionId);

    /**
     * 幂等：会话不存在时什么也不做。
     */
    void destroySession(String sessionId);

    /**
     * 同 {@link #destroySession(String)}，审计事件类型由调用方指定（如过期、淘汰）。
     */
    void destroySession(String sessionId, AuthEventType reason);

    List<UserSession> getUserSessions(String userId);

    /**
     * @param excludeSessionId 保留的会话，可为 null
     */
    void destroyAllUserSessions(String userId, String excludeSessionId);

    /**
     * 全量扫描并销毁已过期会话，供定时任务调用。
     *
     * @return 清理数量
     */
    int cleanupExpiredSessions();

    SessionStats getSessionStats();

    /**
     * @return 会话不存在时返回 false
     */
    boolean markDeviceVerified(String sessionId);

    List<AuthEvent> getUserAuthEvents(String userId, int limit);
}
