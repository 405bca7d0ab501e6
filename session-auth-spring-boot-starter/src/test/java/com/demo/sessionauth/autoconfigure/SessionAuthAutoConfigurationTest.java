package com.demo.sessionauth.autoconfigure;

import com.demo.sessionauth.aop.RequireAuthAspect;
import com.demo.sessionauth.cache.KeyValueCache;
import com.demo.sessionauth.exception.SigningMisconfiguredException;
import com.demo.sessionauth.filter.SessionAuthFilter;
import com.demo.sessionauth.middleware.AuthMiddleware;
import com.demo.sessionauth.rbac.RoleRegistry;
import com.demo.sessionauth.service.AuthSessionService;
import com.demo.sessionauth.session.SessionMaintenanceScheduler;
import com.demo.sessionauth.session.SessionRepository;
import com.demo.sessionauth.spi.AuthUserService;
import com.demo.sessionauth.store.ResetTokenStore;
import com.demo.sessionauth.support.InMemoryKeyValueCache;
import com.demo.sessionauth.token.JwtTokenService;
import com.demo.sessionauth.token.TokenIssuer;
import com.demo.sessionauth.token.TokenVerifier;
import com.demo.sessionauth.web.AuthCookies;
import com.demo.sessionauth.web.AuthExceptionHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.boot.web.servlet.FilterRegistrationBean;

import java.time.Clock;

import static com.demo.sessionauth.support.TestFixtures.ACCESS_SECRET;
import static com.demo.sessionauth.support.TestFixtures.REFRESH_SECRET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * 会话鉴权自动配置测试。
 * <p>
 * 存储用内存实现替换，不依赖 Redis。
 */
@DisplayName("SessionAuthAutoConfiguration 测试")
class SessionAuthAutoConfigurationTest {

    private static final String[] SECRETS = {
            "session-auth.jwt.access.secret=" + ACCESS_SECRET,
            "session-auth.jwt.refresh.secret=" + REFRESH_SECRET
    };

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SessionAuthAutoConfiguration.class))
            .withBean(KeyValueCache.class, () -> new InMemoryKeyValueCache(Clock.systemUTC()));

    @Nested
    @DisplayName("基础装配")
    class CoreBeans {

        @Test
        @DisplayName("配置密钥后装配全部核心组件，token 服务同时作为签发者和校验者")
        void coreBeansRegistered() {
            runner.withPropertyValues(SECRETS).run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).hasSingleBean(JwtTokenService.class);
                assertThat(context).hasSingleBean(SessionRepository.class);
                assertThat(context).hasSingleBean(AuthMiddleware.class);
                assertThat(context).hasSingleBean(AuthCookies.class);
                assertThat(context).hasSingleBean(RequireAuthAspect.class);
                assertThat(context.getBean(TokenIssuer.class)).isSameAs(context.getBean(TokenVerifier.class));
            });
        }

        @Test
        @DisplayName("非 Web 环境不注册过滤器和异常处理")
        void noServletBeansOutsideWebApp() {
            runner.withPropertyValues(SECRETS).run(context -> {
                assertThat(context).doesNotHaveBean(FilterRegistrationBean.class);
                assertThat(context).doesNotHaveBean(AuthExceptionHandler.class);
            });
        }

        @Test
        @DisplayName("缺少签名密钥时启动失败")
        void missingSecretFailsStartup() {
            runner.withPropertyValues("session-auth.jwt.access.secret=" + ACCESS_SECRET).run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(SigningMisconfiguredException.class);
            });
        }

        @Test
        @DisplayName("密钥长度不足时启动失败")
        void shortSecretFailsStartup() {
            runner.withPropertyValues(
                    "session-auth.jwt.access.secret=too-short",
                    "session-auth.jwt.refresh.secret=" + REFRESH_SECRET
            ).run(context -> assertThat(context).hasFailed());
        }
    }

    @Nested
    @DisplayName("条件装配")
    class ConditionalBeans {

        @Test
        @DisplayName("提供 AuthUserService 时才装配登录门面")
        void loginFacadeRequiresUserService() {
            runner.withPropertyValues(SECRETS)
                    .run(context -> assertThat(context).doesNotHaveBean(AuthSessionService.class));

            runner.withPropertyValues(SECRETS)
                    .withBean(AuthUserService.class, () -> mock(AuthUserService.class))
                    .run(context -> assertThat(context).hasSingleBean(AuthSessionService.class));
        }

        @Test
        @DisplayName("定时清理默认关闭，开启后注册调度器")
        void cleanupScheduler() {
            runner.withPropertyValues(SECRETS)
                    .run(context -> assertThat(context).doesNotHaveBean(SessionMaintenanceScheduler.class));

            runner.withPropertyValues(SECRETS)
                    .withPropertyValues("session-auth.session.cleanup-enabled=true")
                    .run(context -> assertThat(context).hasSingleBean(SessionMaintenanceScheduler.class));
        }

        @Test
        @DisplayName("角色注册表默认关闭；开启后注册，初始化器写入内置角色")
        void roleRegistry() {
            runner.withPropertyValues(SECRETS)
                    .run(context -> assertThat(context).doesNotHaveBean(RoleRegistry.class));

            runner.withPropertyValues(SECRETS)
                    .withPropertyValues("session-auth.rbac.enabled=true")
                    .run(context -> {
                        assertThat(context).hasSingleBean(RoleRegistry.class);
                        context.getBean("roleRegistryInitializer", ApplicationRunner.class)
                                .run(new DefaultApplicationArguments());
                        assertThat(context.getBean(RoleRegistry.class).getRoleByName("admin")).isPresent();
                    });
        }

        @Test
        @DisplayName("关闭内置角色初始化时不注册初始化器")
        void roleRegistryWithoutDefaults() {
            runner.withPropertyValues(SECRETS)
                    .withPropertyValues("session-auth.rbac.enabled=true", "session-auth.rbac.initialize-defaults=false")
                    .run(context -> {
                        assertThat(context).hasSingleBean(RoleRegistry.class);
                        assertThat(context).doesNotHaveBean("roleRegistryInitializer");
                    });
        }

        @Test
        @DisplayName("重置令牌存储默认装配")
        void resetTokenStore() {
            runner.withPropertyValues(SECRETS)
                    .run(context -> assertThat(context).hasSingleBean(ResetTokenStore.class));
        }

        @Test
        @DisplayName("用户自定义的 SessionRepository 优先")
        void userRepositoryWins() {
            SessionRepository custom = mock(SessionRepository.class);
            runner.withPropertyValues(SECRETS)
                    .withBean(SessionRepository.class, () -> custom)
                    .run(context -> assertThat(context.getBean(SessionRepository.class)).isSameAs(custom));
        }
    }

    @Nested
    @DisplayName("Servlet 环境")
    class ServletBeans {

        private final WebApplicationContextRunner webRunner = new WebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(SessionAuthAutoConfiguration.class))
                .withBean(KeyValueCache.class, () -> new InMemoryKeyValueCache(Clock.systemUTC()))
                .withPropertyValues(SECRETS);

        @Test
        @DisplayName("默认注册过滤器与异常处理")
        void filterRegistered() {
            webRunner.run(context -> {
                assertThat(context).hasSingleBean(AuthExceptionHandler.class);
                FilterRegistrationBean<?> registration =
                        context.getBean("sessionAuthFilterRegistration", FilterRegistrationBean.class);
                assertThat(registration.getFilter()).isInstanceOf(SessionAuthFilter.class);
                assertThat(registration.getUrlPatterns()).containsExactly("/*");
                assertThat(registration.getOrder()).isEqualTo(-100);
            });
        }

        @Test
        @DisplayName("session-auth.filter.enabled=false 时不注册过滤器")
        void filterDisabled() {
            webRunner.withPropertyValues("session-auth.filter.enabled=false")
                    .run(context -> assertThat(context).doesNotHaveBean("sessionAuthFilterRegistration"));
        }
    }
}
