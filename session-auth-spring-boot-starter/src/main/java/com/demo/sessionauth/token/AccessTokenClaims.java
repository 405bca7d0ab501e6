package com.demo.sessionauth.token;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * 校验通过的 access token 声明。
 */
public record AccessTokenClaims(
        String tokenId,
        String userId,
        String sessionId,
        Set<String> roles,
        Set<String> permissions,
        Map<String, Object> userData,
        Instant issuedAt,
        Instant expiresAt
) {

    public boolean hasSession() {
        return sessionId != null && !sessionId.isBlank();
    }
}
