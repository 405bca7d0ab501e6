package com.demo.sessionauth.token;

/**
 * token 校验能力。
 */
public interface TokenVerifier {

    /**
     * 校验 access token：签名/有效期 → 黑名单 → 类型。
     */
    TokenVerification<AccessTokenClaims> verifyAccessToken(String token);

    /**
     * @param allowExpired 为 true 时，仅“已过期”这一项缺陷可被容忍；签名、黑名单与类型照常校验
     */
    TokenVerification<AccessTokenClaims> verifyAccessToken(String token, boolean allowExpired);

    /**
     * 校验 refresh token：签名/有效期/类型，且必须与服务端存储的值完全一致。
     */
    TokenVerification<RefreshTokenClaims> verifyRefreshToken(String token);
}
