package com.demo.sessionauth.rbac;

import java.util.Collection;

/**
 * 角色/权限判定，只基于 token 中已有的声明，不访问存储。
 * <p>
 * 业务可替换 Authorizer 以支持角色继承、通配符等策略。
 */
public interface Authorizer {

    /**
     * OR 语义：满足任意一个所需角色即可。所需角色为空时返回 true。
     */
    boolean hasAnyRole(Collection<String> userRoles, Collection<String> requiredRoles);

    /**
     * AND 语义：所需权限必须全部具备。所需权限为空时返回 true。
     */
    boolean hasAllPermissions(Collection<String> userPermissions, Collection<String> requiredPermissions);
}
