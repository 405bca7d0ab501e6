package com.demo.sessionauth.middleware;

import com.demo.sessionauth.audit.AuthEventType;
import com.demo.sessionauth.exception.AuthErrorCode;
import com.demo.sessionauth.exception.StoreUnavailableException;
import com.demo.sessionauth.rbac.Authorizer;
import com.demo.sessionauth.session.SessionRepository;
import com.demo.sessionauth.session.UserSession;
import com.demo.sessionauth.token.AccessTokenClaims;
import com.demo.sessionauth.token.TokenVerification;
import com.demo.sessionauth.token.TokenVerifier;
import com.demo.sessionauth.util.Copies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiPredicate;

/**
 * 请求认证状态机。
 * <p>
 * 流程：取凭证 → 校验 access token（含黑名单）→ 校验会话（可跳过）→ 构造 {@link AuthContext}
 * → 角色（OR）→ 权限（AND）→ 挂到请求上。
 * <p>
 * 可选认证（required=false）下，凭证缺失、无效、会话缺失/过期都按匿名放行；
 * 但已认证用户的角色/权限不足仍返回 403。
 * <p>
 * 其余守卫（管理员、自定义断言、设备校验、IP 白名单）都是同一状态机的参数化，或读取它挂在请求上的上下文。
 */
public class AuthMiddleware {

    private static final Logger log = LoggerFactory.getLogger(AuthMiddleware.class);

    /** 请求属性：认证上下文 */
    public static final String ATTR_AUTH_CONTEXT = AuthMiddleware.class.getName() + ".CONTEXT";
    /** 请求属性：会话（token 绑定了会话且未跳过校验时才有） */
    public static final String ATTR_SESSION = AuthMiddleware.class.getName() + ".SESSION";

    private static final String USER_AGENT = "User-Agent";
    private static final String UNKNOWN = "unknown";

    private final TokenVerifier tokenVerifier;
    private final SessionRepository sessionRepository;
    private final Authorizer authorizer;
    private final CredentialExtractor credentialExtractor;
    private final String adminRole;
    private final List<String> moderatorRoles;
    private final Clock clock;

    public AuthMiddleware(TokenVerifier tokenVerifier,
                          SessionRepository sessionRepository,
                          Authorizer authorizer,
                          CredentialExtractor credentialExtractor,
                          String adminRole,
                          Collection<String> moderatorRoles,
                          Clock clock) {
        this.tokenVerifier = Objects.requireNonNull(tokenVerifier, "tokenVerifier must not be null");
        this.sessionRepository = Objects.requireNonNull(sessionRepository, "sessionRepository must not be null");
        this.authorizer = Objects.requireNonNull(authorizer, "authorizer must not be null");
        this.credentialExtractor = Objects.requireNonNull(credentialExtractor, "credentialExtractor must not be null");
        this.adminRole = Objects.requireNonNull(adminRole, "adminRole must not be null");
        this.moderatorRoles = List.copyOf(Objects.requireNonNull(moderatorRoles, "moderatorRoles must not be null"));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // =========================
    // 认证
    // =========================

    public AuthGuard authenticate(AuthOptions options) {
        AuthOptions opts = options == null ? AuthOptions.defaults() : options;
        return request -> evaluate(request, opts);
    }

    public AuthGuard requireAuth() {
        return requireAuth(AuthOptions.defaults());
    }

    public AuthGuard requireAuth(AuthOptions options) {
        return authenticate(base(options).required(true).build());
    }

    public AuthGuard optionalAuth() {
        return optionalAuth(AuthOptions.defaults());
    }

    public AuthGuard optionalAuth(AuthOptions options) {
        return authenticate(base(options).required(false).build());
    }

    public AuthGuard requireRoles(String... roles) {
        return requireRoles(Arrays.asList(roles), AuthOptions.defaults());
    }

    public AuthGuard requireRoles(Collection<String> roles, AuthOptions options) {
        return authenticate(base(options).roles(roles).required(true).build());
    }

    public AuthGuard requirePermissions(String... permissions) {
        return requirePermissions(Arrays.asList(permissions), AuthOptions.defaults());
    }

    public AuthGuard requirePermissions(Collection<String> permissions, AuthOptions options) {
        return authenticate(base(options).permissions(permissions).required(true).build());
    }

    public AuthGuard requireAdmin() {
        return requireRoles(List.of(adminRole), AuthOptions.defaults());
    }

    public AuthGuard requireModerator() {
        return requireRoles(moderatorRoles, AuthOptions.defaults());
    }

    // =========================
    // 基于已有上下文的守卫
    // =========================

    /**
     * 自定义授权：需要前置守卫已写入 {@link AuthContext}。
     */
    public AuthGuard authorize(BiPredicate<AuthContext, AuthRequest> predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        return request -> {
            AuthContext context = contextOf(request);
            if (context == null) {
                return AuthDecision.rejected(AuthErrorCode.AUTHENTICATION_REQUIRED);
            }
            try {
                if (!predicate.test(context, request)) {
                    return AuthDecision.rejected(AuthErrorCode.ACCESS_DENIED);
                }
                return AuthDecision.authorized(context, sessionOf(request));
            } catch (RuntimeException e) {
                log.error("Authorization error: {}", e.getMessage(), e);
                return AuthDecision.rejected(AuthErrorCode.AUTHENTICATION_FAILED, "Authorization failed");
            }
        };
    }

    /**
     * 要求当前会话的设备已通过校验。
     *
     * @param allowNewDevice 为 true 时未校验的设备也放行
     */
    public AuthGuard requireVerifiedDevice(boolean allowNewDevice) {
        return request -> {
            AuthContext context = contextOf(request);
            if (context == null || context.sessionId() == null) {
                return AuthDecision.rejected(AuthErrorCode.SESSION_MISSING, "Session required");
            }
            try {
                // 前置守卫已续期过的会话直接复用，这里只读不写
                UserSession session = sessionOf(request);
                if (session == null || !context.sessionId().equals(session.getSessionId())) {
                    session = sessionRepository.peekSession(context.sessionId())
                            .filter(s -> !s.isExpired(clock.instant()))
                            .orElse(null);
                }
                if (session == null) {
                    return AuthDecision.rejected(AuthErrorCode.SESSION_MISSING);
                }
                if (!session.isDeviceVerified() && !allowNewDevice) {
                    return AuthDecision.rejected(AuthErrorCode.DEVICE_NOT_VERIFIED);
                }
                return AuthDecision.authorized(context, session);
            } catch (RuntimeException e) {
                log.error("Device verification error: {}", e.getMessage(), e);
                return AuthDecision.rejected(AuthErrorCode.AUTHENTICATION_FAILED, "Device verification failed");
            }
        };
    }

    /**
     * 客户端地址必须在白名单内（精确匹配）。
     */
    public AuthGuard requireWhitelistedIp(Collection<String> allowedIps) {
        Set<String> allowed = Copies.stringSet(Objects.requireNonNull(allowedIps, "allowedIps must not be null"));
        return request -> {
            String clientIp = request.remoteAddress();
            if (clientIp == null || !allowed.contains(clientIp)) {
                log.debug("Rejected request from non-whitelisted address {}", clientIp);
                return AuthDecision.rejected(AuthErrorCode.IP_NOT_ALLOWED);
            }
            AuthContext context = contextOf(request);
            return context == null ? AuthDecision.anonymous() : AuthDecision.authorized(context, sessionOf(request));
        };
    }

    public static AuthContext contextOf(AuthRequest request) {
        Object value = request.getAttribute(ATTR_AUTH_CONTEXT);
        return value instanceof AuthContext context ? context : null;
    }

    public static UserSession sessionOf(AuthRequest request) {
        Object value = request.getAttribute(ATTR_SESSION);
        return value instanceof UserSession session ? session : null;
    }

    // =========================
    // 状态机
    // =========================

    private AuthDecision evaluate(AuthRequest request, AuthOptions opts) {
        try {
            // 1) 取凭证
            String token = credentialExtractor.extract(request);
            if (token == null) {
                return fail(opts, AuthErrorCode.NO_TOKEN);
            }

            // 2) 校验 token（签名、有效期、黑名单、类型）
            TokenVerification<AccessTokenClaims> verification = tokenVerifier.verifyAccessToken(token, opts.allowExpired());
            if (!verification.valid()) {
                log.debug("Access token rejected: {}", verification.failure());
                return fail(opts, verification.failure().errorCode());
            }
            AccessTokenClaims claims = verification.claims();

            // 3) 会话
            UserSession session = null;
            if (!opts.skipSessionValidation() && claims.hasSession()) {
                Optional<UserSession> found;
                try {
                    found = sessionRepository.peekSession(claims.sessionId());
                } catch (StoreUnavailableException e) {
                    // 会话是登录状态的唯一依据，查不到一律按失败处理
                    log.error("Session lookup failed for {}: {}", claims.sessionId(), e.getMessage());
                    return fail(opts, AuthErrorCode.SESSION_UNAVAILABLE);
                }
                if (found.isEmpty()) {
                    return fail(opts, AuthErrorCode.SESSION_MISSING);
                }
                session = found.get();

                if (session.isExpired(clock.instant())) {
                    destroyQuietly(claims.sessionId());
                    return fail(opts, AuthErrorCode.SESSION_EXPIRED);
                }
                session = touchQuietly(session);
            }

            // 4) 上下文
            AuthContext context = new AuthContext(
                    claims.userId(),
                    claims.sessionId(),
                    claims.roles(),
                    claims.permissions(),
                    claims.userData(),
                    session == null ? null : session.getDeviceId(),
                    orUnknown(request.remoteAddress()),
                    orUnknown(request.header(USER_AGENT))
            );

            // 5) 角色 OR / 权限 AND
            if (!opts.roles().isEmpty() && !authorizer.hasAnyRole(context.roles(), opts.roles())) {
                return AuthDecision.rejected(AuthErrorCode.INSUFFICIENT_ROLE);
            }
            if (!opts.permissions().isEmpty() && !authorizer.hasAllPermissions(context.permissions(), opts.permissions())) {
                return AuthDecision.rejected(AuthErrorCode.INSUFFICIENT_PERMISSION);
            }

            // 6) 挂到请求上
            request.setAttribute(ATTR_AUTH_CONTEXT, context);
            if (session != null) {
                request.setAttribute(ATTR_SESSION, session);
            }
            log.debug("Authentication successful: userId={}, sessionId={}, roles={}",
                    context.userId(), context.sessionId(), context.roles());
            return AuthDecision.authorized(context, session);

        } catch (RuntimeException e) {
            log.error("Authentication middleware error: {}", e.getMessage(), e);
            return opts.required()
                    ? AuthDecision.rejected(AuthErrorCode.AUTHENTICATION_FAILED)
                    : AuthDecision.anonymous();
        }
    }

    private static AuthDecision fail(AuthOptions opts, AuthErrorCode code) {
        return opts.required() ? AuthDecision.rejected(code) : AuthDecision.anonymous();
    }

    private void destroyQuietly(String sessionId) {
        try {
            sessionRepository.destroySession(sessionId, AuthEventType.EXPIRED);
        } catch (StoreUnavailableException e) {
            log.warn("Failed to destroy expired session {}: {}", sessionId, e.getMessage());
        }
    }

    private UserSession touchQuietly(UserSession session) {
        try {
            return sessionRepository.touchSession(session.getSessionId()).orElse(session);
        } catch (StoreUnavailableException e) {
            log.warn("Failed to touch session {}: {}", session.getSessionId(), e.getMessage());
            return session;
        }
    }

    private static AuthOptions.Builder base(AuthOptions options) {
        return (options == null ? AuthOptions.defaults() : options).toBuilder();
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
