package com.demo.sessionauth.rbac;

import java.util.Collection;
import java.util.Objects;

/**
 * 默认判定：字符串精确匹配。
 * <p>
 * 角色与权限的默认策略不同（角色 OR，权限 AND），两者不能互换。
 */
public class DefaultAuthorizer implements Authorizer {

    @Override
    public boolean hasAnyRole(Collection<String> userRoles, Collection<String> requiredRoles) {
        if (requiredRoles == null || requiredRoles.isEmpty()) return true;
        if (userRoles == null || userRoles.isEmpty()) return false;

        for (String role : requiredRoles) {
            if (role != null && userRoles.contains(role)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean hasAllPermissions(Collection<String> userPermissions, Collection<String> requiredPermissions) {
        if (requiredPermissions == null || requiredPermissions.isEmpty()) return true;
        if (userPermissions == null || userPermissions.isEmpty()) return false;

        return requiredPermissions.stream()
                .filter(Objects::nonNull)
                .allMatch(userPermissions::contains);
    }
}
