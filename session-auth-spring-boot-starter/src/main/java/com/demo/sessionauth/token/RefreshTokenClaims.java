package com.demo.sessionauth.token;

import java.time.Instant;

/**
 * 校验通过的 refresh token 声明。refresh token 不携带授权数据。
 */
public record RefreshTokenClaims(
        String userId,
        String sessionId,
        String nonce,
        Instant issuedAt,
        Instant expiresAt
) {
}
