package com.demo.sessionauth.token;

import java.time.Duration;
import java.util.Optional;

/**
 * token 签发、刷新与吊销能力。
 */
public interface TokenIssuer {

    /**
     * 签发 access token。无副作用。
     *
     * @throws com.demo.sessionauth.exception.TokenCreationException 签名失败时
     */
    String createAccessToken(AccessTokenPayload payload);

    /**
     * 签发 refresh token 并持久化；持久化失败则不返回 token。
     *
     * @throws com.demo.sessionauth.exception.RefreshTokenCreationException 持久化失败时
     */
    String createRefreshToken(String userId, String sessionId);

    /**
     * 用 refresh token 换取新的 token 对。任何预期内的失败都返回 empty，不抛异常。
     */
    Optional<TokenPair> refreshTokens(String refreshToken, RefreshOptions options);

    /**
     * 拉黑 access token 直到其自然过期；已过期的 token 直接视为成功。
     *
     * @throws com.demo.sessionauth.exception.InvalidTokenFormatException 无法解码或缺少 exp 时
     */
    void blacklistToken(String token);

    void revokeRefreshToken(String refreshToken);

    void revokeRefreshToken(String userId, String sessionId);

    int revokeAllRefreshTokens(String userId);

    /**
     * 记录用户签发过的 access token，供 {@link #blacklistUserTokens(String)} 使用。
     */
    void trackIssuedToken(String userId, String token);

    /**
     * 拉黑用户近期签发的全部 access token。单个失败只记录日志并跳过。
     *
     * @return 成功拉黑的数量
     */
    int blacklistUserTokens(String userId);

    /**
     * 清理用户记录中已无效（已过期或无法解码）的 token。
     *
     * @return 清理数量
     */
    int cleanupTrackedTokens(String userId);

    Duration accessTokenTtl();

    Duration refreshTokenTtl();
}
