package com.demo.sessionauth.autoconfigure;

import com.demo.sessionauth.aop.RequireAuthAspect;
import com.demo.sessionauth.audit.AuthEventLog;
import com.demo.sessionauth.cache.CacheCodec;
import com.demo.sessionauth.cache.KeyValueCache;
import com.demo.sessionauth.cache.RedisKeyValueCache;
import com.demo.sessionauth.exception.StoreUnavailableException;
import com.demo.sessionauth.filter.SessionAuthFilter;
import com.demo.sessionauth.middleware.AuthMiddleware;
import com.demo.sessionauth.middleware.AuthOptions;
import com.demo.sessionauth.middleware.CredentialExtractor;
import com.demo.sessionauth.properties.SessionAuthProperties;
import com.demo.sessionauth.rbac.Authorizer;
import com.demo.sessionauth.rbac.CacheRoleRegistry;
import com.demo.sessionauth.rbac.DefaultAuthorizer;
import com.demo.sessionauth.rbac.RoleRegistry;
import com.demo.sessionauth.security.BCryptPasswordHasher;
import com.demo.sessionauth.service.AuthSessionService;
import com.demo.sessionauth.session.CacheSessionStore;
import com.demo.sessionauth.session.SessionMaintenanceScheduler;
import com.demo.sessionauth.session.SessionRepository;
import com.demo.sessionauth.spi.AuthUserService;
import com.demo.sessionauth.spi.PasswordHasher;
import com.demo.sessionauth.store.BlacklistStore;
import com.demo.sessionauth.store.CacheBlacklistStore;
import com.demo.sessionauth.store.CacheRefreshTokenStore;
import com.demo.sessionauth.store.CacheResetTokenStore;
import com.demo.sessionauth.store.RefreshTokenStore;
import com.demo.sessionauth.store.ResetTokenStore;
import com.demo.sessionauth.token.JwtCodec;
import com.demo.sessionauth.token.JwtTokenService;
import com.demo.sessionauth.token.TokenIssuer;
import com.demo.sessionauth.token.TokenVerifier;
import com.demo.sessionauth.web.AuthCookies;
import com.demo.sessionauth.web.AuthExceptionHandler;
import com.demo.sessionauth.web.response.JsonResponseWriter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.aspectj.lang.annotation.Aspect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * 会话鉴权自动配置。
 * <p>
 * 所有组件在这里一次性构造并通过构造器注入，均为 {@code @ConditionalOnMissingBean}，业务可逐个替换。
 * 时钟优先使用容器中的 {@link Clock}，没有则使用 UTC 系统时钟。
 */
@AutoConfiguration(after = RedisAutoConfiguration.class)
@EnableConfigurationProperties(SessionAuthProperties.class)
public class SessionAuthAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthAutoConfiguration.class);

    // ===== 存储 =====

    @Bean
    @ConditionalOnMissingBean
    public CacheCodec sessionAuthCacheCodec() {
        return new CacheCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyValueCache keyValueCache(StringRedisTemplate redisTemplate) {
        return new RedisKeyValueCache(redisTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public BlacklistStore blacklistStore(KeyValueCache cache, CacheCodec codec) {
        return new CacheBlacklistStore(cache, codec);
    }

    @Bean
    @ConditionalOnMissingBean
    public RefreshTokenStore refreshTokenStore(KeyValueCache cache) {
        return new CacheRefreshTokenStore(cache);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResetTokenStore resetTokenStore(KeyValueCache cache, CacheCodec codec, SessionAuthProperties props,
                                           ObjectProvider<Clock> clockProvider) {
        return new CacheResetTokenStore(cache, codec, props.getPasswordReset(), clock(clockProvider));
    }

    // ===== token =====

    @Bean
    @ConditionalOnMissingBean(TokenIssuer.class)
    public JwtTokenService jwtTokenService(SessionAuthProperties props,
                                           BlacklistStore blacklistStore,
                                           RefreshTokenStore refreshTokenStore,
                                           ObjectProvider<Clock> clockProvider) {
        Clock clock = clock(clockProvider);
        SessionAuthProperties.Jwt jwt = props.getJwt();
        // 配置错误在这里抛出，直接中止启动
        JwtCodec access = new JwtCodec("access", jwt.getAccess(), jwt.getClockSkew(), clock);
        JwtCodec refresh = new JwtCodec("refresh", jwt.getRefresh(), jwt.getClockSkew(), clock);
        return new JwtTokenService(access, refresh, blacklistStore, refreshTokenStore,
                props.getBlacklist().getFailurePolicy(), jwt.isRotateRefreshTokens(), clock);
    }

    // ===== 会话 =====

    @Bean
    @ConditionalOnMissingBean
    public AuthEventLog authEventLog(KeyValueCache cache, CacheCodec codec, SessionAuthProperties props,
                                     ObjectProvider<Clock> clockProvider) {
        SessionAuthProperties.Session session = props.getSession();
        return new AuthEventLog(cache, codec, session.getEventTtl(), session.isEventLogging(), clock(clockProvider));
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionRepository sessionRepository(KeyValueCache cache, CacheCodec codec, AuthEventLog eventLog,
                                               SessionAuthProperties props, ObjectProvider<Clock> clockProvider) {
        return new CacheSessionStore(cache, codec, eventLog, props.getSession(), clock(clockProvider));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "session-auth.session", name = "cleanup-enabled", havingValue = "true")
    public SessionMaintenanceScheduler sessionMaintenanceScheduler(SessionRepository sessionRepository,
                                                                   SessionAuthProperties props) {
        return new SessionMaintenanceScheduler(sessionRepository, props.getSession().getCleanupInterval());
    }

    // ===== 授权 / 中间件 =====

    @Bean
    @ConditionalOnMissingBean
    public Authorizer authorizer() {
        return new DefaultAuthorizer();
    }

    @Bean
    @ConditionalOnMissingBean
    public PasswordHasher passwordHasher() {
        return new BCryptPasswordHasher();
    }

    @Bean
    @ConditionalOnMissingBean
    public CredentialExtractor credentialExtractor(SessionAuthProperties props) {
        SessionAuthProperties.Middleware mw = props.getMiddleware();
        return new CredentialExtractor(mw.getQueryParameter(), mw.getCookieName());
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthMiddleware authMiddleware(TokenVerifier tokenVerifier,
                                         SessionRepository sessionRepository,
                                         Authorizer authorizer,
                                         CredentialExtractor credentialExtractor,
                                         SessionAuthProperties props,
                                         ObjectProvider<Clock> clockProvider) {
        SessionAuthProperties.Middleware mw = props.getMiddleware();
        return new AuthMiddleware(tokenVerifier, sessionRepository, authorizer, credentialExtractor,
                mw.getAdminRole(), mw.getModeratorRoles(), clock(clockProvider));
    }

    @Bean
    @ConditionalOnMissingBean
    public AuthCookies authCookies(SessionAuthProperties props) {
        return new AuthCookies(props.getMiddleware().getCookieName());
    }

    /**
     * 业务提供 {@link AuthUserService} 时才装配登录门面。
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(AuthUserService.class)
    public AuthSessionService authSessionService(AuthUserService authUserService,
                                                 PasswordHasher passwordHasher,
                                                 SessionRepository sessionRepository,
                                                 TokenIssuer tokenIssuer,
                                                 TokenVerifier tokenVerifier,
                                                 ObjectProvider<RoleRegistry> roleRegistry,
                                                 SessionAuthProperties props) {
        return new AuthSessionService(authUserService, passwordHasher, sessionRepository, tokenIssuer,
                tokenVerifier, props.getBlacklist().isTrackIssuedTokens(), roleRegistry.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnClass(Aspect.class)
    public RequireAuthAspect requireAuthAspect(Authorizer authorizer) {
        return new RequireAuthAspect(authorizer);
    }

    // ===== 角色注册表 =====

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "session-auth.rbac", name = "enabled", havingValue = "true")
    static class RbacConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RoleRegistry roleRegistry(KeyValueCache cache, CacheCodec codec, SessionAuthProperties props,
                                         ObjectProvider<Clock> clockProvider) {
            return new CacheRoleRegistry(cache, codec, props.getRbac().getTtl(), clock(clockProvider));
        }

        /**
         * 启动后写入内置角色；存储暂不可用时只记日志，不阻止启动。
         */
        @Bean
        @ConditionalOnProperty(prefix = "session-auth.rbac", name = "initialize-defaults", havingValue = "true",
                matchIfMissing = true)
        public ApplicationRunner roleRegistryInitializer(RoleRegistry roleRegistry) {
            return args -> {
                try {
                    roleRegistry.initializeDefaultRoles();
                } catch (StoreUnavailableException e) {
                    log.warn("Skipped default role initialization: {}", e.getMessage());
                }
            };
        }
    }

    // ===== Servlet =====

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    static class ServletConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public JsonResponseWriter jsonResponseWriter(ObjectProvider<ObjectMapper> objectMapper) {
            return new JsonResponseWriter(objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        @ConditionalOnMissingBean
        public AuthExceptionHandler authExceptionHandler(ObjectProvider<Clock> clockProvider) {
            return new AuthExceptionHandler(clock(clockProvider));
        }

        @Bean
        @ConditionalOnMissingBean(name = "sessionAuthFilterRegistration")
        @ConditionalOnProperty(prefix = "session-auth.filter", name = "enabled", havingValue = "true", matchIfMissing = true)
        public FilterRegistrationBean<SessionAuthFilter> sessionAuthFilterRegistration(AuthMiddleware middleware,
                                                                                       JsonResponseWriter writer,
                                                                                       SessionAuthProperties props,
                                                                                       ObjectProvider<Clock> clockProvider) {
            SessionAuthProperties.Filter f = props.getFilter();
            AuthOptions options = AuthOptions.builder()
                    .required(f.isRequired())
                    .skipSessionValidation(f.isSkipSessionValidation())
                    .build();

            FilterRegistrationBean<SessionAuthFilter> registration = new FilterRegistrationBean<>(
                    new SessionAuthFilter(middleware.authenticate(options), writer, clock(clockProvider)));
            registration.setName("sessionAuthFilter");
            registration.setUrlPatterns(f.getUrlPatterns());
            registration.setOrder(f.getOrder());
            return registration;
        }
    }

    private static Clock clock(ObjectProvider<Clock> clockProvider) {
        return clockProvider.getIfAvailable(Clock::systemUTC);
    }
}
