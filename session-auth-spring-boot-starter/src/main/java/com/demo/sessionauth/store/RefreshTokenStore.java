package com.demo.sessionauth.store;

import java.time.Duration;

/**
 * Refresh Token 服务端存储。
 * <p>
 * 每个 (userId, sessionId) 只保留一条记录；提交的 refresh token 必须与存储值完全一致才算有效，
 * 以此防止已被轮换掉的旧 token 被重放。
 */
public interface RefreshTokenStore {

    /**
     * 保存（覆盖）该会话当前的 refresh token。
     */
    void save(String userId, String sessionId, String token, Duration ttl);

    /**
     * @return 存储中的 token；不存在时返回 null
     */
    String find(String userId, String sessionId);

    /**
     * 删除该会话的 refresh token（幂等）。
     */
    void revoke(String userId, String sessionId);

    /**
     * 删除该用户所有会话的 refresh token（幂等）。
     *
     * @return 实际删除的条数
     */
    int revokeAll(String userId);
}
