package com.demo.sessionauth.spi;

import com.demo.sessionauth.util.Copies;

import java.util.Map;
import java.util.Set;

/**
 * 业务侧提供的用户信息。
 *
 * @param passwordHash 由 {@link PasswordHasher} 生成的哈希
 * @param userData     写入 access token 的附加数据，勿放敏感信息
 */
public record AuthUser(
        String id,
        String username,
        String passwordHash,
        Set<String> roles,
        Set<String> permissions,
        Map<String, Object> userData,
        boolean enabled
) {

    public AuthUser {
        roles = Copies.stringSet(roles);
        permissions = Copies.stringSet(permissions);
        userData = Copies.map(userData);
    }
}
