package com.demo.sessionauth.store;

/**
 * 密码重置令牌的生命周期：签发、一次性消费、吊销，以及按标识限流。
 * <p>
 * 每个用户同一时间只有一个有效令牌，重新签发会使旧令牌失效。
 * 密码哈希与重置策略由业务侧负责。
 */
public interface ResetTokenStore {

    ResetToken create(String userId);

    /**
     * 校验并消费令牌。
     *
     * @return 令牌所属的 userId
     * @throws com.demo.sessionauth.exception.AuthException RESET_TOKEN_INVALID（不存在或已过期）、
     *                                                      RESET_TOKEN_USED（已被使用）
     */
    String consume(String token);

    /**
     * 吊销该用户未使用的令牌（幂等）。
     */
    void revoke(String userId);

    /**
     * 记录一次重置请求。
     *
     * @param identifier 限流维度，如邮箱或客户端地址
     * @return 窗口内次数已达上限时返回 false
     */
    boolean tryAttempt(String identifier);
}
