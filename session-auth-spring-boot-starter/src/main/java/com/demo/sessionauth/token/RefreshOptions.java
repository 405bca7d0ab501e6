package com.demo.sessionauth.token;

import java.util.Map;
import java.util.Set;

/**
 * 刷新 token 时由调用方重新提供的授权数据。
 * <p>
 * refresh token 不携带角色/权限，新的 access token 完全以这里的数据为准
 * （通常来自最新读取的用户记录）。
 *
 * @param rotate 是否轮换 refresh token；null 表示使用全局配置
 */
public record RefreshOptions(
        Set<String> roles,
        Set<String> permissions,
        Map<String, Object> userData,
        Boolean rotate
) {

    public static RefreshOptions of(Set<String> roles, Set<String> permissions, Map<String, Object> userData) {
        return new RefreshOptions(roles, permissions, userData, null);
    }

    public RefreshOptions withRotate(boolean rotate) {
        return new RefreshOptions(roles, permissions, userData, rotate);
    }
}
