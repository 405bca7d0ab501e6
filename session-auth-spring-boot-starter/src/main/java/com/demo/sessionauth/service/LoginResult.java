package com.demo.sessionauth.service;

import java.time.Duration;

/**
 * 登录结果。
 *
 * @param accessTokenTtl 用于设置 Cookie 的 Max-Age 或返回给客户端的 expiresIn
 */
public record LoginResult(
        String userId,
        String sessionId,
        String accessToken,
        String refreshToken,
        Duration accessTokenTtl
) {
}
