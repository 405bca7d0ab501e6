package com.demo.sessionauth.aop;

import com.demo.sessionauth.annotation.RequireAuth;
import com.demo.sessionauth.exception.AuthErrorCode;
import com.demo.sessionauth.exception.AuthException;
import com.demo.sessionauth.middleware.AuthContext;
import com.demo.sessionauth.rbac.Authorizer;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.lang.reflect.Method;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 拦截 @RequireAuth，在调用目标方法前校验当前请求的认证上下文。
 * <p>
 * 认证上下文来自 SessionAuthFilter 写入的 SecurityContext（principal 为 {@link AuthContext}）。
 * - 未认证：AUTHENTICATION_REQUIRED（401）
 * - 角色不满足（OR）：INSUFFICIENT_ROLE（403）
 * - 权限不满足（AND）：INSUFFICIENT_PERMISSION（403）
 */
@Aspect
public class RequireAuthAspect {

    private final Authorizer authorizer;

    public RequireAuthAspect(Authorizer authorizer) {
        this.authorizer = Objects.requireNonNull(authorizer, "authorizer must not be null");
    }

    /**
     * 拦截 类 + 方法上的 RequireAuth 注解
     */
    @Before("@within(com.demo.sessionauth.annotation.RequireAuth) || @annotation(com.demo.sessionauth.annotation.RequireAuth)")
    public void check(JoinPoint jp) {
        // 1) 当前用户
        AuthContext ctx = currentContext();
        if (ctx == null) {
            throw new AuthException(AuthErrorCode.AUTHENTICATION_REQUIRED);
        }

        // 2) 类注解 + 方法注解合并
        Method method = ((MethodSignature) jp.getSignature()).getMethod();
        Requirement req = resolve(method, jp.getTarget() == null ? method.getDeclaringClass() : jp.getTarget().getClass());

        // 3) 角色 OR，权限 AND
        if (!authorizer.hasAnyRole(ctx.roles(), req.roles())) {
            throw new AuthException(AuthErrorCode.INSUFFICIENT_ROLE);
        }
        if (!authorizer.hasAllPermissions(ctx.permissions(), req.permissions())) {
            throw new AuthException(AuthErrorCode.INSUFFICIENT_PERMISSION);
        }
    }

    private static AuthContext currentContext() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()) {
            return null;
        }
        return auth.getPrincipal() instanceof AuthContext ctx ? ctx : null;
    }

    private static Requirement resolve(Method method, Class<?> targetClass) {
        RequireAuth onMethod = AnnotatedElementUtils.findMergedAnnotation(method, RequireAuth.class);
        RequireAuth onClass = AnnotatedElementUtils.findMergedAnnotation(targetClass, RequireAuth.class);
        if (onMethod == null && onClass == null) {
            throw new IllegalStateException("No @RequireAuth found on " + method);
        }

        Set<String> roles = new LinkedHashSet<>();
        Set<String> permissions = new LinkedHashSet<>();
        if (onClass != null) {
            addAll(roles, onClass.roles(), "roles");
            addAll(permissions, onClass.permissions(), "permissions");
        }
        if (onMethod != null) {
            addAll(roles, onMethod.roles(), "roles");
            addAll(permissions, onMethod.permissions(), "permissions");
        }
        return new Requirement(roles, permissions);
    }

    private static void addAll(Set<String> set, String[] values, String attribute) {
        for (String v : values) {
            if (v == null || v.isBlank()) {
                throw new IllegalArgumentException("@RequireAuth." + attribute + "() contains blank value");
            }
            set.add(v.trim());
        }
    }

    private record Requirement(Set<String> roles, Set<String> permissions) {
    }
}
