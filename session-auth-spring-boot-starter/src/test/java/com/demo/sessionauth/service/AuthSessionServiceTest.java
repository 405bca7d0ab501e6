package com.demo.sessionauth.service;

import com.demo.sessionauth.audit.AuthEventLog;
import com.demo.sessionauth.cache.CacheCodec;
import com.demo.sessionauth.exception.AuthErrorCode;
import com.demo.sessionauth.exception.AuthException;
import com.demo.sessionauth.properties.SessionAuthProperties;
import com.demo.sessionauth.rbac.CacheRoleRegistry;
import com.demo.sessionauth.security.BCryptPasswordHasher;
import com.demo.sessionauth.session.CacheSessionStore;
import com.demo.sessionauth.session.DeviceInfo;
import com.demo.sessionauth.spi.AuthUser;
import com.demo.sessionauth.spi.AuthUserService;
import com.demo.sessionauth.store.BlacklistFailurePolicy;
import com.demo.sessionauth.store.CacheBlacklistStore;
import com.demo.sessionauth.store.CacheRefreshTokenStore;
import com.demo.sessionauth.support.InMemoryKeyValueCache;
import com.demo.sessionauth.support.MutableClock;
import com.demo.sessionauth.token.JwtTokenService;
import com.demo.sessionauth.token.TokenFailure;
import com.demo.sessionauth.token.TokenPair;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static com.demo.sessionauth.support.TestFixtures.tokenService;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AuthSessionService 测试")
class AuthSessionServiceTest {

    private static final BCryptPasswordHasher HASHER = new BCryptPasswordHasher(4);
    private static final String ALICE_HASH = HASHER.hash("wonderland");

    private MutableClock clock;
    private JwtTokenService tokens;
    private CacheSessionStore sessions;
    private Map<String, AuthUser> users;
    private AuthSessionService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-05-01T10:00:00Z");
        InMemoryKeyValueCache cache = new InMemoryKeyValueCache(clock);
        CacheCodec codec = new CacheCodec();
        tokens = tokenService(new CacheBlacklistStore(cache, codec), new CacheRefreshTokenStore(cache),
                BlacklistFailurePolicy.FAIL_OPEN, clock);
        sessions = new CacheSessionStore(cache, codec,
                new AuthEventLog(cache, codec, Duration.ofHours(24), true, clock),
                new SessionAuthProperties.Session(), clock);

        users = new HashMap<>();
        putAlice(Set.of("editor"), true);
        service = new AuthSessionService(new MapUserService(users), HASHER, sessions, tokens, tokens, true);
    }

    private void putAlice(Set<String> roles, boolean enabled) {
        users.put("u1", new AuthUser("u1", "alice", ALICE_HASH, roles, Set.of("article:read"),
                Map.of("name", "Alice"), enabled));
    }

    private LoginResult loginAlice() {
        return service.login("alice", "wonderland", new DeviceInfo("curl", "10.0.0.1", "linux"), "dev-1");
    }

    // ===== 登录 =====

    @Test
    @DisplayName("登录成功：创建会话，签发绑定该会话的 token 对")
    void loginSucceeds() {
        // When
        LoginResult result = loginAlice();

        // Then
        assertThat(result.userId()).isEqualTo("u1");
        assertThat(result.accessTokenTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(sessions.peekSession(result.sessionId())).isPresent();

        var access = tokens.verifyAccessToken(result.accessToken());
        assertThat(access.valid()).isTrue();
        assertThat(access.claims().sessionId()).isEqualTo(result.sessionId());
        assertThat(access.claims().roles()).containsExactly("editor");

        var refresh = tokens.verifyRefreshToken(result.refreshToken());
        assertThat(refresh.valid()).isTrue();
        assertThat(refresh.claims().sessionId()).isEqualTo(result.sessionId());
    }

    @Test
    @DisplayName("密码错误、用户不存在、用户被禁用：统一返回 INVALID_CREDENTIALS")
    void loginFailures() {
        assertThatThrownBy(() -> service.login("alice", "nope", null, null))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getErrorCode())
                .isEqualTo(AuthErrorCode.INVALID_CREDENTIALS);
        assertThatThrownBy(() -> service.login("bob", "wonderland", null, null))
                .isInstanceOf(AuthException.class);

        putAlice(Set.of("editor"), false);
        assertThatThrownBy(() -> service.login("alice", "wonderland", null, null))
                .isInstanceOf(AuthException.class);
        assertThat(sessions.getUserSessions("u1")).isEmpty();
    }

    @Test
    @DisplayName("用户资料含 null 字段时登录成功")
    void loginWithNullProfileField() {
        // Given
        Map<String, Object> profile = new HashMap<>();
        profile.put("name", "Alice");
        profile.put("avatarUrl", null);
        users.put("u1", new AuthUser("u1", "alice", ALICE_HASH, Set.of("editor"), Set.of("article:read"),
                profile, true));

        // When
        LoginResult result = loginAlice();

        // Then
        var access = tokens.verifyAccessToken(result.accessToken());
        assertThat(access.valid()).isTrue();
        assertThat(access.claims().userData()).containsEntry("name", "Alice");
    }

    @Test
    @DisplayName("启用角色注册表：token 中合并注册表分配的角色，并按角色解析权限")
    void loginResolvesRegistryGrants() {
        // Given
        CacheRoleRegistry registry = new CacheRoleRegistry(new InMemoryKeyValueCache(clock), new CacheCodec(),
                Duration.ofDays(30), clock);
        registry.initializeDefaultRoles();
        registry.assignRoleToUser("u1", "moderator");
        AuthSessionService withRegistry = new AuthSessionService(new MapUserService(users), HASHER, sessions,
                tokens, tokens, true, registry);

        // When
        LoginResult result = withRegistry.login("alice", "wonderland", null, null);

        // Then
        var claims = tokens.verifyAccessToken(result.accessToken()).claims();
        assertThat(claims.roles()).containsExactlyInAnyOrder("editor", "moderator");
        assertThat(claims.permissions()).containsExactlyInAnyOrder("article:read", "user.read", "user.write");

        // 刷新同样按注册表解析
        registry.removeRoleFromUser("u1", "moderator");
        TokenPair pair = withRegistry.refresh(result.refreshToken());
        assertThat(tokens.verifyAccessToken(pair.accessToken()).claims().permissions())
                .containsExactly("article:read");
    }

    @Test
    @DisplayName("角色注册表不可用时仍可登录，只使用用户记录中的角色和权限")
    void loginWhenRegistryUnavailable() {
        // Given
        InMemoryKeyValueCache registryCache = new InMemoryKeyValueCache(clock);
        CacheRoleRegistry registry = new CacheRoleRegistry(registryCache, new CacheCodec(), Duration.ofDays(30), clock);
        registry.initializeDefaultRoles();
        registry.assignRoleToUser("u1", "admin");
        registryCache.setUnavailable(true);
        AuthSessionService withRegistry = new AuthSessionService(new MapUserService(users), HASHER, sessions,
                tokens, tokens, true, registry);

        // When
        LoginResult result = withRegistry.login("alice", "wonderland", null, null);

        // Then
        var claims = tokens.verifyAccessToken(result.accessToken()).claims();
        assertThat(claims.roles()).containsExactly("editor");
        assertThat(claims.permissions()).containsExactly("article:read");
    }

    // ===== 刷新 =====

    @Test
    @DisplayName("刷新：按最新的用户角色签发，旧 refresh token 失效")
    void refreshRotatesAndReloadsRoles() {
        // Given
        LoginResult login = loginAlice();
        putAlice(Set.of("editor", "admin"), true);

        // When
        TokenPair pair = service.refresh(login.refreshToken());

        // Then
        assertThat(tokens.verifyAccessToken(pair.accessToken()).claims().roles())
                .containsExactlyInAnyOrder("editor", "admin");
        assertThat(pair.refreshToken()).isNotEqualTo(login.refreshToken());
        assertThat(tokens.verifyRefreshToken(login.refreshToken()).failure()).isEqualTo(TokenFailure.NOT_STORED);
        assertThatThrownBy(() -> service.refresh(login.refreshToken()))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getErrorCode())
                .isEqualTo(AuthErrorCode.REFRESH_TOKEN_INVALID);
    }

    @Test
    @DisplayName("会话已销毁时刷新失败，并吊销 refresh token")
    void refreshWithoutSession() {
        LoginResult login = loginAlice();
        sessions.destroySession(login.sessionId());

        assertThatThrownBy(() -> service.refresh(login.refreshToken()))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getErrorCode())
                .isEqualTo(AuthErrorCode.SESSION_MISSING);
        assertThat(tokens.verifyRefreshToken(login.refreshToken()).valid()).isFalse();
    }

    @Test
    @DisplayName("用户被禁用后刷新失败")
    void refreshForDisabledUser() {
        LoginResult login = loginAlice();
        putAlice(Set.of("editor"), false);

        assertThatThrownBy(() -> service.refresh(login.refreshToken()))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getErrorCode())
                .isEqualTo(AuthErrorCode.REFRESH_TOKEN_INVALID);
    }

    // ===== 登出 =====

    @Test
    @DisplayName("登出：access token 拉黑、refresh token 吊销、会话销毁；重复登出不报错")
    void logout() {
        // Given
        LoginResult login = loginAlice();

        // When
        service.logout(login.accessToken());

        // Then
        assertThat(tokens.verifyAccessToken(login.accessToken()).failure()).isEqualTo(TokenFailure.BLACKLISTED);
        assertThat(tokens.verifyRefreshToken(login.refreshToken()).valid()).isFalse();
        assertThat(sessions.peekSession(login.sessionId())).isEmpty();
        assertThatCode(() -> service.logout(login.accessToken())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("access token 已过期也可以登出")
    void logoutWithExpiredToken() {
        LoginResult login = loginAlice();
        clock.advance(Duration.ofHours(2));

        service.logout(login.accessToken());

        assertThat(sessions.peekSession(login.sessionId())).isEmpty();
    }

    @Test
    @DisplayName("无效 token 登出返回对应错误")
    void logoutWithGarbage() {
        assertThatThrownBy(() -> service.logout("garbage"))
                .isInstanceOf(AuthException.class)
                .extracting(e -> ((AuthException) e).getErrorCode())
                .isEqualTo(AuthErrorCode.TOKEN_INVALID);
    }

    @Test
    @DisplayName("全部下线：所有会话销毁，已签发的 access token 被拉黑")
    void logoutEverywhere() {
        LoginResult phone = loginAlice();
        LoginResult laptop = loginAlice();

        int revoked = service.logoutEverywhere("u1", null);

        assertThat(revoked).isEqualTo(2);
        assertThat(sessions.getUserSessions("u1")).isEmpty();
        assertThat(tokens.verifyAccessToken(phone.accessToken()).failure()).isEqualTo(TokenFailure.BLACKLISTED);
        assertThat(tokens.verifyAccessToken(laptop.accessToken()).failure()).isEqualTo(TokenFailure.BLACKLISTED);
        assertThat(tokens.verifyRefreshToken(laptop.refreshToken()).valid()).isFalse();
    }

    @Test
    @DisplayName("除当前会话外全部下线")
    void logoutEverywhereExceptCurrent() {
        LoginResult other = loginAlice();
        LoginResult current = loginAlice();

        int revoked = service.logoutEverywhere("u1", current.sessionId());

        assertThat(revoked).isEqualTo(1);
        assertThat(sessions.peekSession(other.sessionId())).isEmpty();
        assertThat(sessions.peekSession(current.sessionId())).isPresent();
        assertThat(tokens.verifyAccessToken(current.accessToken()).valid()).isTrue();
        assertThat(tokens.verifyRefreshToken(current.refreshToken()).valid()).isTrue();
        assertThat(tokens.verifyRefreshToken(other.refreshToken()).valid()).isFalse();
    }

    private static final class MapUserService implements AuthUserService {

        private final Map<String, AuthUser> byId;

        private MapUserService(Map<String, AuthUser> byId) {
            this.byId = byId;
        }

        @Override
        public AuthUser loadByUsername(String username) {
            return byId.values().stream()
                    .filter(u -> u.username().equals(username))
                    .findFirst()
                    .orElse(null);
        }

        @Override
        public AuthUser loadByUserId(String userId) {
            return byId.get(userId);
        }
    }
}
