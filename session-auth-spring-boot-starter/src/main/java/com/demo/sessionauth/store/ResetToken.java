package com.demo.sessionauth.store;

import java.time.Instant;

/**
 * 新签发的密码重置令牌。
 *
 * @param token 原文，只在签发时返回一次，存储中只保留其 SHA-256
 */
public record ResetToken(String token, String userId, Instant expiresAt) {

    @Override
    public String toString() {
        return "ResetToken[token=" + TokenPreview.of(token) + ", userId=" + userId + ", expiresAt=" + expiresAt + "]";
    }
}
