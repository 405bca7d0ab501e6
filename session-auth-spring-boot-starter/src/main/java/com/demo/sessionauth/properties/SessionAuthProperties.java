package com.demo.sessionauth.properties;

import com.demo.sessionauth.store.BlacklistFailurePolicy;
import com.demo.sessionauth.token.SigningAlgorithm;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 认证与会话配置，绑定前缀 {@code session-auth.*}。
 */
@ConfigurationProperties(prefix = "session-auth")
public class SessionAuthProperties {

    private final Jwt jwt = new Jwt();
    private final Session session = new Session();
    private final Blacklist blacklist = new Blacklist();
    private final Middleware middleware = new Middleware();
    private final Filter filter = new Filter();
    private final Rbac rbac = new Rbac();
    private final PasswordReset passwordReset = new PasswordReset();

    public Jwt getJwt() {
        return jwt;
    }

    public Session getSession() {
        return session;
    }

    public Blacklist getBlacklist() {
        return blacklist;
    }

    public Middleware getMiddleware() {
        return middleware;
    }

    public Filter getFilter() {
        return filter;
    }

    public Rbac getRbac() {
        return rbac;
    }

    public PasswordReset getPasswordReset() {
        return passwordReset;
    }

    /**
     * JWT 配置：access / refresh 各自独立的密钥、算法与有效期。
     */
    public static class Jwt {

        private final TokenSettings access = new TokenSettings(Duration.ofHours(1));

        private final TokenSettings refresh = new TokenSettings(Duration.ofDays(7));

        /**
         * 时钟偏移容忍：用于校验 exp/nbf 的容错。
         */
        private Duration clockSkew = Duration.ZERO;

        /**
         * 刷新时是否轮换 Refresh Token（作废旧的、签发新的）。
         */
        private boolean rotateRefreshTokens = true;

        public TokenSettings getAccess() {
            return access;
        }

        public TokenSettings getRefresh() {
            return refresh;
        }

        public Duration getClockSkew() {
            return clockSkew;
        }

        public void setClockSkew(Duration clockSkew) {
            this.clockSkew = clockSkew;
        }

        public boolean isRotateRefreshTokens() {
            return rotateRefreshTokens;
        }

        public void setRotateRefreshTokens(boolean rotateRefreshTokens) {
            this.rotateRefreshTokens = rotateRefreshTokens;
        }
    }

    /**
     * 单类 token 的签名配置。
     */
    public static class TokenSettings {

        /**
         * 签名密钥。
         *
         * <p>要求：UTF-8 编码后长度不小于算法要求（HS256 ≥ 32 bytes，HS384 ≥ 48，HS512 ≥ 64）。</p>
         * <p>建议通过环境变量/配置中心注入，避免明文提交到仓库。</p>
         */
        private String secret;

        private Duration ttl;

        private SigningAlgorithm algorithm = SigningAlgorithm.HS256;

        /**
         * 签发者，配置后在每次校验时强制匹配。
         */
        private String issuer;

        /**
         * 接收方，配置后在每次校验时强制匹配。
         */
        private String audience;

        public TokenSettings() {
        }

        public TokenSettings(Duration ttl) {
            this.ttl = ttl;
        }

        public String getSecret() {
            return secret;
        }

        public void setSecret(String secret) {
            this.secret = secret;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public SigningAlgorithm getAlgorithm() {
            return algorithm;
        }

        public void setAlgorithm(SigningAlgorithm algorithm) {
            this.algorithm = algorithm;
        }

        public String getIssuer() {
            return issuer;
        }

        public void setIssuer(String issuer) {
            this.issuer = issuer;
        }

        public String getAudience() {
            return audience;
        }

        public void setAudience(String audience) {
            this.audience = audience;
        }
    }

    public static class Session {

        private Duration ttl = Duration.ofHours(24);

        /**
         * 滚动会话：每次访问都把过期时间顺延一个 ttl。
         */
        private boolean rolling = true;

        /**
         * 单用户最多保留的会话数，超出时按创建顺序淘汰最早的会话。
         */
        private int maxSessions = 5;

        private boolean eventLogging = true;

        private Duration eventTtl = Duration.ofHours(24);

        private boolean cleanupEnabled = false;

        private Duration cleanupInterval = Duration.ofMinutes(15);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public boolean isRolling() {
            return rolling;
        }

        public void setRolling(boolean rolling) {
            this.rolling = rolling;
        }

        public int getMaxSessions() {
            return maxSessions;
        }

        public void setMaxSessions(int maxSessions) {
            this.maxSessions = maxSessions;
        }

        public boolean isEventLogging() {
            return eventLogging;
        }

        public void setEventLogging(boolean eventLogging) {
            this.eventLogging = eventLogging;
        }

        public Duration getEventTtl() {
            return eventTtl;
        }

        public void setEventTtl(Duration eventTtl) {
            this.eventTtl = eventTtl;
        }

        public boolean isCleanupEnabled() {
            return cleanupEnabled;
        }

        public void setCleanupEnabled(boolean cleanupEnabled) {
            this.cleanupEnabled = cleanupEnabled;
        }

        public Duration getCleanupInterval() {
            return cleanupInterval;
        }

        public void setCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
        }
    }

    public static class Blacklist {

        private BlacklistFailurePolicy failurePolicy = BlacklistFailurePolicy.FAIL_OPEN;

        /**
         * 是否记录用户近期签发的 access token，用于“拉黑该用户全部 token”。
         */
        private boolean trackIssuedTokens = true;

        public BlacklistFailurePolicy getFailurePolicy() {
            return failurePolicy;
        }

        public void setFailurePolicy(BlacklistFailurePolicy failurePolicy) {
            this.failurePolicy = failurePolicy;
        }

        public boolean isTrackIssuedTokens() {
            return trackIssuedTokens;
        }

        public void setTrackIssuedTokens(boolean trackIssuedTokens) {
            this.trackIssuedTokens = trackIssuedTokens;
        }
    }

    /**
     * 凭证提取与内置守卫的参数。
     */
    public static class Middleware {

        private String cookieName = "Authorization";

        private String queryParameter = "token";

        private String adminRole = "admin";

        private List<String> moderatorRoles = new ArrayList<>(List.of("admin", "moderator"));

        public String getCookieName() {
            return cookieName;
        }

        public void setCookieName(String cookieName) {
            this.cookieName = cookieName;
        }

        public String getQueryParameter() {
            return queryParameter;
        }

        public void setQueryParameter(String queryParameter) {
            this.queryParameter = queryParameter;
        }

        public String getAdminRole() {
            return adminRole;
        }

        public void setAdminRole(String adminRole) {
            this.adminRole = adminRole;
        }

        public List<String> getModeratorRoles() {
            return moderatorRoles;
        }

        public void setModeratorRoles(List<String> moderatorRoles) {
            this.moderatorRoles = moderatorRoles;
        }
    }

    /**
     * Servlet 过滤器注册参数。
     */
    public static class Filter {

        private boolean enabled = true;

        private List<String> urlPatterns = new ArrayList<>(List.of("/*"));

        /**
         * 过滤器层面是否强制认证。默认 false：有合法凭证则写入上下文，没有则匿名放行，
         * 由 {@code @RequireAuth} 或业务规则决定是否拒绝。
         */
        private boolean required = false;

        private boolean skipSessionValidation = false;

        private int order = -100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getUrlPatterns() {
            return urlPatterns;
        }

        public void setUrlPatterns(List<String> urlPatterns) {
            this.urlPatterns = urlPatterns;
        }

        public boolean isRequired() {
            return required;
        }

        public void setRequired(boolean required) {
            this.required = required;
        }

        public boolean isSkipSessionValidation() {
            return skipSessionValidation;
        }

        public void setSkipSessionValidation(boolean skipSessionValidation) {
            this.skipSessionValidation = skipSessionValidation;
        }

        public int getOrder() {
            return order;
        }

        public void setOrder(int order) {
            this.order = order;
        }
    }

    /**
     * 角色注册表。开启后登录/刷新时按角色解析权限。
     */
    public static class Rbac {

        private boolean enabled = false;

        /**
         * 角色、权限与用户角色关系的缓存存活时间；每次写入都会重置。
         */
        private Duration ttl = Duration.ofDays(365);

        /**
         * 启动时写入内置的 user / moderator / admin 角色。
         */
        private boolean initializeDefaults = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public boolean isInitializeDefaults() {
            return initializeDefaults;
        }

        public void setInitializeDefaults(boolean initializeDefaults) {
            this.initializeDefaults = initializeDefaults;
        }
    }

    /**
     * 密码重置令牌。
     */
    public static class PasswordReset {

        private Duration tokenTtl = Duration.ofMinutes(30);

        /**
         * 已使用的令牌保留多久，期间重复使用返回“已使用”而不是“无效”。
         */
        private Duration usedRetention = Duration.ofMinutes(1);

        private int maxAttempts = 5;

        private Duration attemptWindow = Duration.ofMinutes(15);

        public Duration getTokenTtl() {
            return tokenTtl;
        }

        public void setTokenTtl(Duration tokenTtl) {
            this.tokenTtl = tokenTtl;
        }

        public Duration getUsedRetention() {
            return usedRetention;
        }

        public void setUsedRetention(Duration usedRetention) {
            this.usedRetention = usedRetention;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getAttemptWindow() {
            return attemptWindow;
        }

        public void setAttemptWindow(Duration attemptWindow) {
            this.attemptWindow = attemptWindow;
        }
    }
}
