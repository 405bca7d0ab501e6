package com.demo.sessionauth.middleware;

import com.demo.sessionauth.util.Copies;

import java.util.Map;
import java.util.Set;

/**
 * 认证通过后挂到请求上的身份信息。
 *
 * @param sessionId 可为 null（token 未绑定会话）
 * @param deviceId  来自会话，可为 null
 */
public record AuthContext(
        String userId,
        String sessionId,
        Set<String> roles,
        Set<String> permissions,
        Map<String, Object> userData,
        String deviceId,
        String ipAddress,
        String userAgent
) {

    public AuthContext {
        roles = Copies.stringSet(roles);
        permissions = Copies.stringSet(permissions);
        userData = Copies.map(userData);
    }
}
