package com.demo.sessionauth.token;

import com.demo.sessionauth.util.Copies;

import java.util.Map;
import java.util.Set;

/**
 * 签发 access token 的输入：身份 + 授权数据。
 * <p>
 * 角色与权限直接写入 token，请求期的 RBAC 判定不需要再查存储。
 */
public record AccessTokenPayload(
        String userId,
        String sessionId,
        Set<String> roles,
        Set<String> permissions,
        Map<String, Object> userData
) {

    public AccessTokenPayload {
        roles = Copies.stringSet(roles);
        permissions = Copies.stringSet(permissions);
        userData = Copies.map(userData);
    }
}
