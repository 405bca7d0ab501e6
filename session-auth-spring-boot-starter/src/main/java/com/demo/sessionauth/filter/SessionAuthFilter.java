package com.demo.sessionauth.filter;

import com.demo.sessionauth.middleware.AuthContext;
import com.demo.sessionauth.middleware.AuthDecision;
import com.demo.sessionauth.middleware.AuthGuard;
import com.demo.sessionauth.web.response.ApiError;
import com.demo.sessionauth.web.response.JsonResponseWriter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 会话鉴权过滤器
 * <p>
 * 功能：在请求进入 MVC 之前执行一个 {@link AuthGuard}。
 * - 拒绝：直接写出 {@link ApiError}，不再往下传递；
 * - 已认证：AuthContext 写入请求属性，同时写入 SecurityContext
 *   （authorities = ROLE_角色 + 权限字符串），请求结束后清理；
 * - 匿名：原样放行，由 {@code @RequireAuth} 或业务授权规则决定是否需要认证。
 */
public class SessionAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthFilter.class);

    static final String ROLE_PREFIX = "ROLE_";

    private final AuthGuard guard;
    private final JsonResponseWriter responseWriter;
    private final Clock clock;

    public SessionAuthFilter(AuthGuard guard, JsonResponseWriter responseWriter, Clock clock) {
        this.guard = Objects.requireNonNull(guard, "guard must not be null");
        this.responseWriter = Objects.requireNonNull(responseWriter, "responseWriter must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        AuthDecision decision = guard.check(new ServletAuthRequest(req));

        if (decision.isRejected()) {
            log.debug("Request rejected: {} {} -> {}", req.getMethod(), req.getRequestURI(), decision);
            responseWriter.write(res, ApiError.of(decision.getErrorCode(), decision.getMessage(), clock));
            return;
        }

        if (!decision.isAuthenticated()) {
            chain.doFilter(req, res);
            return;
        }

        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(toAuthentication(decision.getContext()));
        SecurityContextHolder.setContext(context);
        try {
            chain.doFilter(req, res);
        } finally {
            SecurityContextHolder.clearContext();
        }
    }

    static UsernamePasswordAuthenticationToken toAuthentication(AuthContext ctx) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        for (String role : ctx.roles()) {
            if (role == null || role.isBlank()) continue;
            String r = role.trim();
            authorities.add(new SimpleGrantedAuthority(r.startsWith(ROLE_PREFIX) ? r : ROLE_PREFIX + r));
        }
        for (String perm : ctx.permissions()) {
            if (perm == null || perm.isBlank()) continue;
            authorities.add(new SimpleGrantedAuthority(perm.trim()));
        }
        return UsernamePasswordAuthenticationToken.authenticated(ctx, null, authorities);
    }
}
