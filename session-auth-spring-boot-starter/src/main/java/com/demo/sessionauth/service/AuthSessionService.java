package com.demo.sessionauth.service;

import com.demo.sessionauth.exception.AuthErrorCode;
import com.demo.sessionauth.exception.AuthException;
import com.demo.sessionauth.exception.StoreUnavailableException;
import com.demo.sessionauth.rbac.RoleRegistry;
import com.demo.sessionauth.session.DeviceInfo;
import com.demo.sessionauth.session.SessionRepository;
import com.demo.sessionauth.session.UserSession;
import com.demo.sessionauth.spi.AuthUser;
import com.demo.sessionauth.spi.AuthUserService;
import com.demo.sessionauth.spi.PasswordHasher;
import com.demo.sessionauth.token.AccessTokenClaims;
import com.demo.sessionauth.token.AccessTokenPayload;
import com.demo.sessionauth.token.RefreshOptions;
import com.demo.sessionauth.token.RefreshTokenClaims;
import com.demo.sessionauth.token.TokenFailure;
import com.demo.sessionauth.token.TokenIssuer;
import com.demo.sessionauth.token.TokenPair;
import com.demo.sessionauth.token.TokenVerification;
import com.demo.sessionauth.token.TokenVerifier;
import com.demo.sessionauth.util.Copies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 登录 / 刷新 / 登出门面，把 token、会话与用户加载串起来。
 * <p>
 * 失败统一抛 {@link AuthException}，由 AuthExceptionHandler 渲染。
 */
public class AuthSessionService {

    private static final Logger log = LoggerFactory.getLogger(AuthSessionService.class);

    private final AuthUserService authUserService;
    private final PasswordHasher passwordHasher;
    private final SessionRepository sessionRepository;
    private final TokenIssuer tokenIssuer;
    private final TokenVerifier tokenVerifier;
    private final boolean trackIssuedTokens;
    private final RoleRegistry roleRegistry;

    public AuthSessionService(AuthUserService authUserService,
                              PasswordHasher passwordHasher,
                              SessionRepository sessionRepository,
                              TokenIssuer tokenIssuer,
                              TokenVerifier tokenVerifier,
                              boolean trackIssuedTokens) {
        this(authUserService, passwordHasher, sessionRepository, tokenIssuer, tokenVerifier, trackIssuedTokens, null);
    }

    /**
     * @param roleRegistry 可为 null；提供时 token 中的角色/权限合并注册表中的数据
     */
    public AuthSessionService(AuthUserService authUserService,
                              PasswordHasher passwordHasher,
                              SessionRepository sessionRepository,
                              TokenIssuer tokenIssuer,
                              TokenVerifier tokenVerifier,
                              boolean trackIssuedTokens,
                              RoleRegistry roleRegistry) {
        this.authUserService = Objects.requireNonNull(authUserService, "authUserService must not be null");
        this.passwordHasher = Objects.requireNonNull(passwordHasher, "passwordHasher must not be null");
        this.sessionRepository = Objects.requireNonNull(sessionRepository, "sessionRepository must not be null");
        this.tokenIssuer = Objects.requireNonNull(tokenIssuer, "tokenIssuer must not be null");
        this.tokenVerifier = Objects.requireNonNull(tokenVerifier, "tokenVerifier must not be null");
        this.trackIssuedTokens = trackIssuedTokens;
        this.roleRegistry = roleRegistry;
    }

    // ===== 登录 =====

    /**
     * @param deviceInfo 可为 null
     * @param deviceId   可为 null
     */
    public LoginResult login(String username, String password, DeviceInfo deviceInfo, String deviceId) {
        if (!StringUtils.hasText(username) || password == null) {
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }
        AuthUser user = authUserService.loadByUsername(username);
        // 用户不存在、被禁用、密码错误对外不做区分
        if (user == null || !user.enabled() || !passwordHasher.verify(password, user.passwordHash())) {
            log.info("Login failed for username {}", username);
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS);
        }

        UserSession session = sessionRepository.createSession(user.id(), deviceInfo, deviceId);
        String sessionId = session.getSessionId();

        String accessToken;
        String refreshToken;
        try {
            Grants grants = grantsOf(user);
            accessToken = tokenIssuer.createAccessToken(new AccessTokenPayload(
                    user.id(), sessionId, grants.roles(), grants.permissions(), user.userData()));
            refreshToken = tokenIssuer.createRefreshToken(user.id(), sessionId);
        } catch (RuntimeException e) {
            // 没有 token 的会话没有意义
            sessionRepository.destroySession(sessionId);
            throw e;
        }
        track(user.id(), accessToken);

        log.info("User {} logged in, sessionId={}", user.id(), sessionId);
        return new LoginResult(user.id(), sessionId, accessToken, refreshToken, tokenIssuer.accessTokenTtl());
    }

    // ===== 刷新 =====

    /**
     * 用 refresh token 换新的 token 对。角色/权限以重新加载的用户记录为准。
     */
    public TokenPair refresh(String refreshToken) {
        TokenVerification<RefreshTokenClaims> verification = tokenVerifier.verifyRefreshToken(refreshToken);
        if (!verification.valid()) {
            log.debug("Refresh rejected: {}", verification.failure());
            throw new AuthException(AuthErrorCode.REFRESH_TOKEN_INVALID);
        }
        RefreshTokenClaims claims = verification.claims();

        if (sessionRepository.getSession(claims.sessionId()).isEmpty()) {
            tokenIssuer.revokeRefreshToken(claims.userId(), claims.sessionId());
            throw new AuthException(AuthErrorCode.SESSION_MISSING);
        }

        AuthUser user = authUserService.loadByUserId(claims.userId());
        if (user == null || !user.enabled()) {
            tokenIssuer.revokeRefreshToken(claims.userId(), claims.sessionId());
            throw new AuthException(AuthErrorCode.REFRESH_TOKEN_INVALID);
        }

        Grants grants = grantsOf(user);
        Optional<TokenPair> pair = tokenIssuer.refreshTokens(refreshToken,
                RefreshOptions.of(grants.roles(), grants.permissions(), user.userData()));
        if (pair.isEmpty()) {
            throw new AuthException(AuthErrorCode.REFRESH_TOKEN_INVALID);
        }
        track(user.id(), pair.get().accessToken());
        return pair.get();
    }

    // ===== 登出 =====

    /**
     * 拉黑 access token、吊销该会话的 refresh token 并销毁会话。
     * 已过期的 access token 也可以登出；已登出的 token 再次登出不报错。
     */
    public void logout(String accessToken) {
        TokenVerification<AccessTokenClaims> verification = tokenVerifier.verifyAccessToken(accessToken, true);
        if (!verification.valid()) {
            if (verification.failure() == TokenFailure.BLACKLISTED) {
                return;
            }
            throw new AuthException(verification.failure().errorCode());
        }
        AccessTokenClaims claims = verification.claims();

        tokenIssuer.blacklistToken(accessToken);
        if (claims.hasSession()) {
            tokenIssuer.revokeRefreshToken(claims.userId(), claims.sessionId());
            sessionRepository.destroySession(claims.sessionId());
        }
        log.info("User {} logged out, sessionId={}", claims.userId(), claims.sessionId());
    }

    /**
     * 注销该用户的所有会话。
     *
     * @param keepSessionId 保留的会话（"除当前设备外全部下线"），可为 null
     * @return 被注销的会话数
     */
    public int logoutEverywhere(String userId, String keepSessionId) {
        if (!StringUtils.hasText(userId)) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        List<UserSession> sessions = sessionRepository.getUserSessions(userId);
        int revoked = 0;
        for (UserSession s : sessions) {
            if (!s.getSessionId().equals(keepSessionId)) {
                tokenIssuer.revokeRefreshToken(userId, s.getSessionId());
                revoked++;
            }
        }

        if (keepSessionId == null) {
            tokenIssuer.revokeAllRefreshTokens(userId);
            // 不保留任何会话时顺带拉黑近期签发的 access token
            tokenIssuer.blacklistUserTokens(userId);
        }
        tokenIssuer.cleanupTrackedTokens(userId);

        sessionRepository.destroyAllUserSessions(userId, keepSessionId);
        log.info("User {} logged out everywhere, kept={}, revoked={}", userId, keepSessionId, revoked);
        return revoked;
    }

    private record Grants(Set<String> roles, Set<String> permissions) {
    }

    /**
     * 用户记录中的角色/权限，并上注册表中分配给该用户的角色及其权限。
     * 注册表不可用时只用用户记录。
     */
    private Grants grantsOf(AuthUser user) {
        if (roleRegistry == null) {
            return new Grants(user.roles(), user.permissions());
        }
        try {
            Set<String> roles = Copies.union(user.roles(), roleRegistry.getUserRoles(user.id()));
            Set<String> permissions = Copies.union(user.permissions(), roleRegistry.resolvePermissions(roles));
            return new Grants(roles, permissions);
        } catch (StoreUnavailableException e) {
            log.warn("Role registry unavailable for user {}, using user record only: {}", user.id(), e.getMessage());
            return new Grants(user.roles(), user.permissions());
        }
    }

    private void track(String userId, String accessToken) {
        if (!trackIssuedTokens) {
            return;
        }
        try {
            tokenIssuer.trackIssuedToken(userId, accessToken);
        } catch (RuntimeException e) {
            log.warn("Failed to track issued token for user {}: {}", userId, e.getMessage());
        }
    }
}
