package com.demo.sessionauth.support;

import com.demo.sessionauth.properties.SessionAuthProperties;
import com.demo.sessionauth.store.BlacklistFailurePolicy;
import com.demo.sessionauth.store.BlacklistStore;
import com.demo.sessionauth.store.RefreshTokenStore;
import com.demo.sessionauth.token.JwtCodec;
import com.demo.sessionauth.token.JwtTokenService;

import java.time.Clock;
import java.time.Duration;

/**
 * 测试公共构造方法。
 */
public final class TestFixtures {

    public static final String ACCESS_SECRET = "access-secret-for-tests-0123456789abcdef";
    public static final String REFRESH_SECRET = "refresh-secret-for-tests-0123456789abcdef";

    private TestFixtures() {
    }

    public static SessionAuthProperties.TokenSettings settings(String secret, Duration ttl) {
        SessionAuthProperties.TokenSettings s = new SessionAuthProperties.TokenSettings(ttl);
        s.setSecret(secret);
        return s;
    }

    public static JwtCodec accessCodec(Clock clock) {
        return new JwtCodec("access", settings(ACCESS_SECRET, Duration.ofHours(1)), Duration.ZERO, clock);
    }

    public static JwtCodec refreshCodec(Clock clock) {
        return new JwtCodec("refresh", settings(REFRESH_SECRET, Duration.ofDays(7)), Duration.ZERO, clock);
    }

    public static JwtTokenService tokenService(BlacklistStore blacklist, RefreshTokenStore refresh,
                                               BlacklistFailurePolicy policy, Clock clock) {
        return new JwtTokenService(accessCodec(clock), refreshCodec(clock), blacklist, refresh, policy, true, clock);
    }
}
