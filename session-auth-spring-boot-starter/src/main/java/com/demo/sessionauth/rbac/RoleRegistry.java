package com.demo.sessionauth.rbac;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 角色注册表：角色、权限定义以及用户与角色的关系。
 * <p>
 * 与 {@link Authorizer} 分工：注册表在登录/刷新时把角色解析为权限写入 token，
 * 请求期的判定仍只看 token 声明。
 */
public interface RoleRegistry {

    /**
     * @throws IllegalArgumentException 同名角色已存在
     */
    Role createRole(String name, String description, Collection<String> permissions, boolean system);

    Optional<Role> getRole(String roleId);

    Optional<Role> getRoleByName(String name);

    /**
     * 部分更新，参数为 null 表示保持不变。
     *
     * @throws IllegalArgumentException 角色不存在，或新名称已被占用
     */
    Role updateRole(String roleId, String name, String description, Collection<String> permissions, Boolean active);

    /**
     * 删除角色并解除它与所有用户的关系。
     *
     * @return 角色不存在时返回 false
     * @throws IllegalStateException 内置角色
     */
    boolean deleteRole(String roleId);

    /**
     * @return 按名称排序
     */
    List<Role> listRoles(boolean includeInactive);

    /**
     * @throws IllegalArgumentException 同名权限已存在
     */
    Permission createPermission(String name, String description, String resource, String action, boolean system);

    Optional<Permission> getPermissionByName(String name);

    /**
     * @return 按名称排序
     */
    List<Permission> listPermissions();

    /**
     * @throws IllegalArgumentException 角色不存在或已停用
     */
    void assignRoleToUser(String userId, String roleName);

    void removeRoleFromUser(String userId, String roleName);

    Set<String> getUserRoles(String userId);

    /**
     * 用户所有角色的权限并集。
     */
    Set<String> getUserPermissions(String userId);

    /**
     * 给定角色的权限并集；不存在或已停用的角色忽略。
     */
    Set<String> resolvePermissions(Collection<String> roleNames);

    Set<String> getUsersWithRole(String roleName);

    /**
     * 写入内置权限与 user / moderator / admin 角色；已存在的跳过。
     */
    void initializeDefaultRoles();
}
