package com.demo.sessionauth.rbac;

import com.demo.sessionauth.util.Copies;

import java.time.Instant;
import java.util.Set;

/**
 * 角色定义。
 *
 * @param permissions 权限名集合
 * @param system      内置角色，不可删除
 * @param active      停用的角色不参与权限解析，也不能再分配
 */
public record Role(
        String id,
        String name,
        String description,
        Set<String> permissions,
        boolean system,
        boolean active,
        Instant createdAt,
        Instant updatedAt
) {

    public Role {
        permissions = Copies.stringSet(permissions);
    }
}
