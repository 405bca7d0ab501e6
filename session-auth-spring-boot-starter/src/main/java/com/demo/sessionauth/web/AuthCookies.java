package com.demo.sessionauth.web;

import org.springframework.http.ResponseCookie;

import java.time.Duration;
import java.util.Objects;

/**
 * 登录/登出 Cookie。
 * <p>
 * 登录：{@code <name>=<token>; Max-Age=<秒>; Path=/; HttpOnly; SameSite=Strict}
 * 登出：同名空值，Max-Age=0。
 */
public class AuthCookies {

    private final String cookieName;

    public AuthCookies(String cookieName) {
        this.cookieName = Objects.requireNonNull(cookieName, "cookieName must not be null");
    }

    public ResponseCookie loginCookie(String accessToken, Duration maxAge) {
        Objects.requireNonNull(accessToken, "accessToken must not be null");
        return base(accessToken).maxAge(maxAge).build();
    }

    public ResponseCookie logoutCookie() {
        return base("").maxAge(Duration.ZERO).build();
    }

    public String getCookieName() {
        return cookieName;
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(cookieName, value)
                .httpOnly(true)
                .sameSite("Strict")
                .path("/");
    }
}
