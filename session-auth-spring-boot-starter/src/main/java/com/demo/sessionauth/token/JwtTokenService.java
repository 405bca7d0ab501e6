package com.demo.sessionauth.token;

import com.demo.sessionauth.exception.AuthException;
import com.demo.sessionauth.exception.InvalidTokenFormatException;
import com.demo.sessionauth.exception.RefreshTokenCreationException;
import com.demo.sessionauth.exception.SigningMisconfiguredException;
import com.demo.sessionauth.exception.StoreUnavailableException;
import com.demo.sessionauth.exception.TokenCreationException;
import com.demo.sessionauth.store.BlacklistFailurePolicy;
import com.demo.sessionauth.store.BlacklistStore;
import com.demo.sessionauth.store.RefreshTokenStore;
import com.demo.sessionauth.store.TokenPreview;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * JWT token 服务：签发、校验、刷新轮换与吊销。
 * <p>
 * 存储交互：
 * - 黑名单：{@link BlacklistStore}，每次校验 access token 都实时查询；
 * - refresh token：{@link RefreshTokenStore}，每个会话只保留一条，提交值必须与存储值完全一致。
 * <p>
 * 轮换不是原子操作：先删旧记录再写新记录。中途失败最多导致该会话没有可用的 refresh token
 * （需要重新登录），不会出现两个同时有效的 refresh token。
 */
public class JwtTokenService implements TokenIssuer, TokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenService.class);

    private static final Duration MIN_BLACKLIST_TTL = Duration.ofSeconds(1);

    private final JwtCodec accessCodec;
    private final JwtCodec refreshCodec;
    private final BlacklistStore blacklistStore;
    private final RefreshTokenStore refreshTokenStore;
    private final BlacklistFailurePolicy failurePolicy;
    private final boolean rotateByDefault;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    public JwtTokenService(JwtCodec accessCodec,
                           JwtCodec refreshCodec,
                           BlacklistStore blacklistStore,
                           RefreshTokenStore refreshTokenStore,
                           BlacklistFailurePolicy failurePolicy,
                           boolean rotateByDefault,
                           Clock clock) {
        this.accessCodec = Objects.requireNonNull(accessCodec, "accessCodec must not be null");
        this.refreshCodec = Objects.requireNonNull(refreshCodec, "refreshCodec must not be null");
        this.blacklistStore = Objects.requireNonNull(blacklistStore, "blacklistStore must not be null");
        this.refreshTokenStore = Objects.requireNonNull(refreshTokenStore, "refreshTokenStore must not be null");
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy must not be null");
        this.rotateByDefault = rotateByDefault;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // =========================
    // 签发
    // =========================

    @Override
    public String createAccessToken(AccessTokenPayload payload) {
        Objects.requireNonNull(payload, "payload must not be null");
        if (!StringUtils.hasText(payload.userId())) {
            throw new IllegalArgumentException("userId must not be blank");
        }

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put(JwtCodec.CLAIM_USER_ID, payload.userId());
        if (StringUtils.hasText(payload.sessionId())) {
            claims.put(JwtCodec.CLAIM_SESSION_ID, payload.sessionId());
        }
        claims.put(JwtCodec.CLAIM_ROLES, new ArrayList<>(payload.roles()));
        claims.put(JwtCodec.CLAIM_PERMISSIONS, new ArrayList<>(payload.permissions()));
        claims.put(JwtCodec.CLAIM_USER_DATA, payload.userData());
        claims.put(JwtCodec.CLAIM_TYPE, TokenType.ACCESS.claimValue());

        String token = sign(accessCodec, payload.userId(), UUID.randomUUID().toString(), claims);
        log.debug("Access token created for user {}", payload.userId());
        return token;
    }

    @Override
    public String createRefreshToken(String userId, String sessionId) {
        if (!StringUtils.hasText(userId) || !StringUtils.hasText(sessionId)) {
            throw new IllegalArgumentException("userId and sessionId must not be blank");
        }

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put(JwtCodec.CLAIM_USER_ID, userId);
        claims.put(JwtCodec.CLAIM_SESSION_ID, sessionId);
        claims.put(JwtCodec.CLAIM_TYPE, TokenType.REFRESH.claimValue());
        claims.put(JwtCodec.CLAIM_NONCE, nonce());

        String token = sign(refreshCodec, userId, null, claims);
        try {
            refreshTokenStore.save(userId, sessionId, token, refreshCodec.ttl());
        } catch (RuntimeException e) {
            log.error("Failed to persist refresh token for user {} session {}: {}", userId, sessionId, e.getMessage());
            throw new RefreshTokenCreationException("Refresh token creation failed", e);
        }
        log.debug("Refresh token created for user {} session {}", userId, sessionId);
        return token;
    }

    // =========================
    // 校验
    // =========================

    @Override
    public TokenVerification<AccessTokenClaims> verifyAccessToken(String token) {
        return verifyAccessToken(token, false);
    }

    @Override
    public TokenVerification<AccessTokenClaims> verifyAccessToken(String token, boolean allowExpired) {
        // 1) 签名 + 有效期
        Claims claims;
        try {
            claims = accessCodec.parse(token, allowExpired);
        } catch (ExpiredJwtException e) {
            return TokenVerification.invalid(TokenFailure.EXPIRED, "Token expired");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Access token verification failed: {}", e.getMessage());
            return TokenVerification.invalid(TokenFailure.MALFORMED, e.getMessage());
        }

        // 2) 黑名单：每次都查，不缓存
        try {
            if (blacklistStore.isBlacklisted(token)) {
                return TokenVerification.invalid(TokenFailure.BLACKLISTED, "Token is blacklisted");
            }
        } catch (StoreUnavailableException e) {
            if (failurePolicy == BlacklistFailurePolicy.FAIL_CLOSED) {
                log.warn("Blacklist check unavailable, rejecting token (fail-closed)");
                return TokenVerification.invalid(TokenFailure.STORE_UNAVAILABLE, "Revocation status unavailable");
            }
            log.warn("Blacklist check unavailable, accepting token (fail-open)");
        }

        // 3) 类型
        if (!TokenType.ACCESS.claimValue().equals(JwtCodec.stringClaim(claims, JwtCodec.CLAIM_TYPE))) {
            return TokenVerification.invalid(TokenFailure.WRONG_TYPE, "Invalid token type");
        }

        String userId = firstNonBlank(JwtCodec.stringClaim(claims, JwtCodec.CLAIM_USER_ID), claims.getSubject());
        if (userId == null) {
            return TokenVerification.invalid(TokenFailure.MALFORMED, "Missing userId");
        }

        return TokenVerification.valid(new AccessTokenClaims(
                claims.getId(),
                userId,
                JwtCodec.stringClaim(claims, JwtCodec.CLAIM_SESSION_ID),
                JwtCodec.stringSetClaim(claims, JwtCodec.CLAIM_ROLES),
                JwtCodec.stringSetClaim(claims, JwtCodec.CLAIM_PERMISSIONS),
                JwtCodec.mapClaim(claims, JwtCodec.CLAIM_USER_DATA),
                toInstant(claims.getIssuedAt()),
                toInstant(claims.getExpiration())
        ));
    }

    @Override
    public TokenVerification<RefreshTokenClaims> verifyRefreshToken(String token) {
        Claims claims;
        try {
            claims = refreshCodec.parse(token, false);
        } catch (ExpiredJwtException e) {
            return TokenVerification.invalid(TokenFailure.EXPIRED, "Token expired");
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Refresh token verification failed: {}", e.getMessage());
            return TokenVerification.invalid(TokenFailure.MALFORMED, e.getMessage());
        }

        if (!TokenType.REFRESH.claimValue().equals(JwtCodec.stringClaim(claims, JwtCodec.CLAIM_TYPE))) {
            return TokenVerification.invalid(TokenFailure.WRONG_TYPE, "Invalid token type");
        }

        String userId = JwtCodec.stringClaim(claims, JwtCodec.CLAIM_USER_ID);
        String sessionId = JwtCodec.stringClaim(claims, JwtCodec.CLAIM_SESSION_ID);
        if (userId == null || sessionId == null) {
            return TokenVerification.invalid(TokenFailure.MALFORMED, "Missing userId or sessionId");
        }

        // 与存储值逐字比较：key 不存在（过期/吊销）与旧 token 重放都判为无效
        String stored;
        try {
            stored = refreshTokenStore.find(userId, sessionId);
        } catch (StoreUnavailableException e) {
            return TokenVerification.invalid(TokenFailure.STORE_UNAVAILABLE, "Refresh token store unavailable");
        }
        if (!token.equals(stored)) {
            return TokenVerification.invalid(TokenFailure.NOT_STORED, "Token not found in store");
        }

        return TokenVerification.valid(new RefreshTokenClaims(
                userId,
                sessionId,
                JwtCodec.stringClaim(claims, JwtCodec.CLAIM_NONCE),
                toInstant(claims.getIssuedAt()),
                toInstant(claims.getExpiration())
        ));
    }

    // =========================
    // 刷新
    // =========================

    @Override
    public Optional<TokenPair> refreshTokens(String refreshToken, RefreshOptions options) {
        RefreshOptions opts = options == null ? RefreshOptions.of(null, null, null) : options;
        try {
            TokenVerification<RefreshTokenClaims> verification = verifyRefreshToken(refreshToken);
            if (!verification.valid()) {
                log.debug("Refresh rejected: {}", verification.reason());
                return Optional.empty();
            }
            RefreshTokenClaims claims = verification.claims();

            String accessToken = createAccessToken(new AccessTokenPayload(
                    claims.userId(), claims.sessionId(), opts.roles(), opts.permissions(), opts.userData()));

            boolean rotate = opts.rotate() != null ? opts.rotate() : rotateByDefault;
            String nextRefreshToken = refreshToken;
            if (rotate) {
                refreshTokenStore.revoke(claims.userId(), claims.sessionId());
                nextRefreshToken = createRefreshToken(claims.userId(), claims.sessionId());
            }
            return Optional.of(new TokenPair(accessToken, nextRefreshToken));
        } catch (SigningMisconfiguredException e) {
            throw e;
        } catch (AuthException e) {
            log.error("Token refresh failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    // =========================
    // 吊销
    // =========================

    @Override
    public void blacklistToken(String token) {
        Instant expiresAt = expiryOf(token);
        Instant now = clock.instant();
        if (!expiresAt.isAfter(now)) {
            // 已自然过期，无需拉黑
            log.debug("Token already expired, skip blacklisting: {}", TokenPreview.of(token));
            return;
        }
        Duration ttl = Duration.between(now, expiresAt);
        blacklistStore.blacklist(token, ttl.compareTo(MIN_BLACKLIST_TTL) < 0 ? MIN_BLACKLIST_TTL : ttl);
    }

    @Override
    public void revokeRefreshToken(String refreshToken) {
        Map<String, Object> payload = JwtCodec.decodeUnverified(refreshToken);
        String userId = JwtCodec.stringClaim(payload, JwtCodec.CLAIM_USER_ID);
        String sessionId = JwtCodec.stringClaim(payload, JwtCodec.CLAIM_SESSION_ID);
        if (!TokenType.REFRESH.claimValue().equals(JwtCodec.stringClaim(payload, JwtCodec.CLAIM_TYPE))
                || userId == null || sessionId == null) {
            throw new InvalidTokenFormatException("Invalid refresh token");
        }
        revokeRefreshToken(userId, sessionId);
    }

    @Override
    public void revokeRefreshToken(String userId, String sessionId) {
        refreshTokenStore.revoke(userId, sessionId);
        log.debug("Refresh token revoked for user {} session {}", userId, sessionId);
    }

    @Override
    public int revokeAllRefreshTokens(String userId) {
        int revoked = refreshTokenStore.revokeAll(userId);
        log.debug("Revoked {} refresh tokens for user {}", revoked, userId);
        return revoked;
    }

    @Override
    public void trackIssuedToken(String userId, String token) {
        Instant expiresAt = expiryOf(token);
        Instant now = clock.instant();
        if (expiresAt.isAfter(now)) {
            blacklistStore.track(userId, token, Duration.between(now, expiresAt));
        }
    }

    @Override
    public int blacklistUserTokens(String userId) {
        int blacklisted = 0;
        for (String token : blacklistStore.trackedTokens(userId)) {
            try {
                blacklistToken(token);
                blacklisted++;
            } catch (AuthException e) {
                log.warn("Failed to blacklist individual token {}: {}", TokenPreview.of(token), e.getMessage());
            }
        }
        log.debug("Blacklisted {} tokens for user {}", blacklisted, userId);
        return blacklisted;
    }

    @Override
    public int cleanupTrackedTokens(String userId) {
        Instant now = clock.instant();
        List<String> stale = new ArrayList<>();
        for (String token : blacklistStore.trackedTokens(userId)) {
            try {
                if (!expiryOf(token).isAfter(now)) {
                    stale.add(token);
                }
            } catch (InvalidTokenFormatException e) {
                stale.add(token);
            }
        }
        blacklistStore.untrack(userId, stale);
        return stale.size();
    }

    @Override
    public Duration accessTokenTtl() {
        return accessCodec.ttl();
    }

    @Override
    public Duration refreshTokenTtl() {
        return refreshCodec.ttl();
    }

    // =========================
    // 内部辅助方法
    // =========================

    private static String sign(JwtCodec codec, String subject, String tokenId, Map<String, Object> claims) {
        try {
            return codec.sign(subject, tokenId, claims);
        } catch (JwtException | IllegalArgumentException e) {
            log.error("Failed to sign token: {}", e.getMessage());
            throw new TokenCreationException("Token creation failed", e);
        }
    }

    private static Instant expiryOf(String token) {
        Instant exp = JwtCodec.instantClaim(JwtCodec.decodeUnverified(token), Claims.EXPIRATION);
        if (exp == null) {
            throw new InvalidTokenFormatException("Token has no exp claim");
        }
        return exp;
    }

    private String nonce() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    private static Instant toInstant(java.util.Date date) {
        return date == null ? null : date.toInstant();
    }

    private static String firstNonBlank(String a, String b) {
        if (StringUtils.hasText(a)) return a;
        return StringUtils.hasText(b) ? b : null;
    }
}
