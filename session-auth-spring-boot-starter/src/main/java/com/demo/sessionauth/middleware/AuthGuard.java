package com.demo.sessionauth.middleware;

import java.util.List;

/**
 * 请求级守卫：给出放行或拒绝的判定。由 {@link AuthMiddleware} 的各个工厂方法构造。
 */
@FunctionalInterface
public interface AuthGuard {

    AuthDecision check(AuthRequest request);

    /**
     * 依次执行，第一个拒绝即返回；全部放行时返回最后一个已认证的判定（没有则为匿名）。
     */
    static AuthGuard combine(AuthGuard... guards) {
        List<AuthGuard> chain = List.of(guards);
        return request -> {
            AuthDecision result = AuthDecision.anonymous();
            for (AuthGuard guard : chain) {
                AuthDecision decision = guard.check(request);
                if (decision.isRejected()) {
                    return decision;
                }
                if (decision.isAuthenticated()) {
                    result = decision;
                }
            }
            return result;
        };
    }
}
