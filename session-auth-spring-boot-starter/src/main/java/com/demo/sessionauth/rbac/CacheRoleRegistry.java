package com.demo.sessionauth.rbac;

import com.demo.sessionauth.cache.CacheCodec;
import com.demo.sessionauth.cache.KeyValueCache;
import com.demo.sessionauth.util.Copies;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 基于 {@link KeyValueCache} 的角色注册表
 * <p>
 * 键空间：
 * - {@code rbac:role:<id>} / {@code rbac:permission:<id>}：定义（JSON）
 * - {@code rbac:role-name:<name>} / {@code rbac:permission-name:<name>}：名称 → id
 * - {@code rbac:roles} / {@code rbac:permissions}：id 列表
 * - {@code rbac:user-roles:<userId>}：用户的角色名列表
 * - {@code rbac:role-users:<roleName>}：持有该角色的用户列表
 * <p>
 * 索引是读-改-写的 JSON 列表，并发修改同一索引时后写覆盖先写；角色管理属于低频操作。
 * 所有 key 写入时刷新为同一个 TTL。
 */
public class CacheRoleRegistry implements RoleRegistry {

    private static final Logger log = LoggerFactory.getLogger(CacheRoleRegistry.class);

    static final String ROLE_PREFIX = "rbac:role:";
    static final String ROLE_NAME_PREFIX = "rbac:role-name:";
    static final String ROLES_INDEX = "rbac:roles";
    static final String PERMISSION_PREFIX = "rbac:permission:";
    static final String PERMISSION_NAME_PREFIX = "rbac:permission-name:";
    static final String PERMISSIONS_INDEX = "rbac:permissions";
    static final String USER_ROLES_PREFIX = "rbac:user-roles:";
    static final String ROLE_USERS_PREFIX = "rbac:role-users:";

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final KeyValueCache cache;
    private final CacheCodec codec;
    private final Duration ttl;
    private final Clock clock;

    public CacheRoleRegistry(KeyValueCache cache, CacheCodec codec, Duration ttl, Clock clock) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }
    }

    // =========================
    // 角色
    // =========================

    @Override
    public Role createRole(String name, String description, Collection<String> permissions, boolean system) {
        requireName(name, "role");
        if (cache.exists(ROLE_NAME_PREFIX + name)) {
            throw new IllegalArgumentException("Role already exists: " + name);
        }
        Instant now = clock.instant();
        Role role = new Role(UUID.randomUUID().toString(), name, description, Copies.stringSet(permissions),
                system, true, now, now);
        saveRole(role);
        cache.set(ROLE_NAME_PREFIX + name, role.id(), ttl);
        addToList(ROLES_INDEX, role.id());
        log.info("Role created: name={}, id={}", name, role.id());
        return role;
    }

    @Override
    public Optional<Role> getRole(String roleId) {
        if (!StringUtils.hasText(roleId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(codec.read(cache.get(ROLE_PREFIX + roleId), Role.class));
    }

    @Override
    public Optional<Role> getRoleByName(String name) {
        if (!StringUtils.hasText(name)) {
            return Optional.empty();
        }
        return getRole(cache.get(ROLE_NAME_PREFIX + name));
    }

    @Override
    public Role updateRole(String roleId, String name, String description, Collection<String> permissions,
                           Boolean active) {
        Role existing = getRole(roleId)
                .orElseThrow(() -> new IllegalArgumentException("Role not found: " + roleId));

        String newName = StringUtils.hasText(name) ? name : existing.name();
        boolean renamed = !newName.equals(existing.name());
        if (renamed && cache.exists(ROLE_NAME_PREFIX + newName)) {
            throw new IllegalArgumentException("Role already exists: " + newName);
        }

        Role updated = new Role(
                existing.id(),
                newName,
                description != null ? description : existing.description(),
                permissions != null ? Copies.stringSet(permissions) : existing.permissions(),
                existing.system(),
                active != null ? active : existing.active(),
                existing.createdAt(),
                clock.instant());
        saveRole(updated);

        if (renamed) {
            cache.delete(ROLE_NAME_PREFIX + existing.name());
            cache.set(ROLE_NAME_PREFIX + newName, existing.id(), ttl);
            renameUserLinks(existing.name(), newName);
        }
        log.info("Role updated: id={}, name={}", roleId, newName);
        return updated;
    }

    @Override
    public boolean deleteRole(String roleId) {
        Optional<Role> found = getRole(roleId);
        if (found.isEmpty()) {
            return false;
        }
        Role role = found.get();
        if (role.system()) {
            throw new IllegalStateException("Cannot delete system role: " + role.name());
        }

        for (String userId : getUsersWithRole(role.name())) {
            removeFromList(USER_ROLES_PREFIX + userId, role.name());
        }
        cache.delete(ROLE_USERS_PREFIX + role.name());
        cache.delete(ROLE_NAME_PREFIX + role.name());
        cache.delete(ROLE_PREFIX + roleId);
        removeFromList(ROLES_INDEX, roleId);
        log.info("Role deleted: name={}, id={}", role.name(), roleId);
        return true;
    }

    @Override
    public List<Role> listRoles(boolean includeInactive) {
        List<Role> roles = new ArrayList<>();
        for (String id : readList(ROLES_INDEX)) {
            getRole(id)
                    .filter(r -> includeInactive || r.active())
                    .ifPresent(roles::add);
        }
        roles.sort(Comparator.comparing(Role::name));
        return roles;
    }

    // =========================
    // 权限
    // =========================

    @Override
    public Permission createPermission(String name, String description, String resource, String action,
                                       boolean system) {
        requireName(name, "permission");
        if (cache.exists(PERMISSION_NAME_PREFIX + name)) {
            throw new IllegalArgumentException("Permission already exists: " + name);
        }
        Permission permission = new Permission(UUID.randomUUID().toString(), name, description, resource, action,
                system);
        cache.set(PERMISSION_PREFIX + permission.id(), codec.write(permission), ttl);
        cache.set(PERMISSION_NAME_PREFIX + name, permission.id(), ttl);
        addToList(PERMISSIONS_INDEX, permission.id());
        log.info("Permission created: name={}", name);
        return permission;
    }

    @Override
    public Optional<Permission> getPermissionByName(String name) {
        if (!StringUtils.hasText(name)) {
            return Optional.empty();
        }
        String id = cache.get(PERMISSION_NAME_PREFIX + name);
        if (id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(codec.read(cache.get(PERMISSION_PREFIX + id), Permission.class));
    }

    @Override
    public List<Permission> listPermissions() {
        List<Permission> permissions = new ArrayList<>();
        for (String id : readList(PERMISSIONS_INDEX)) {
            Permission p = codec.read(cache.get(PERMISSION_PREFIX + id), Permission.class);
            if (p != null) {
                permissions.add(p);
            }
        }
        permissions.sort(Comparator.comparing(Permission::name));
        return permissions;
    }

    // =========================
    // 用户 ↔ 角色
    // =========================

    @Override
    public void assignRoleToUser(String userId, String roleName) {
        requireName(userId, "user");
        Role role = getRoleByName(roleName)
                .filter(Role::active)
                .orElseThrow(() -> new IllegalArgumentException("Role not found or inactive: " + roleName));
        addToList(USER_ROLES_PREFIX + userId, role.name());
        addToList(ROLE_USERS_PREFIX + role.name(), userId);
        log.info("Role {} assigned to user {}", role.name(), userId);
    }

    @Override
    public void removeRoleFromUser(String userId, String roleName) {
        removeFromList(USER_ROLES_PREFIX + userId, roleName);
        removeFromList(ROLE_USERS_PREFIX + roleName, userId);
        log.info("Role {} removed from user {}", roleName, userId);
    }

    @Override
    public Set<String> getUserRoles(String userId) {
        if (!StringUtils.hasText(userId)) {
            return Set.of();
        }
        return Copies.stringSet(readList(USER_ROLES_PREFIX + userId));
    }

    @Override
    public Set<String> getUserPermissions(String userId) {
        return resolvePermissions(getUserRoles(userId));
    }

    @Override
    public Set<String> resolvePermissions(Collection<String> roleNames) {
        if (roleNames == null || roleNames.isEmpty()) {
            return Set.of();
        }
        Set<String> permissions = new LinkedHashSet<>();
        for (String roleName : roleNames) {
            getRoleByName(roleName)
                    .filter(Role::active)
                    .ifPresent(r -> permissions.addAll(r.permissions()));
        }
        return Copies.stringSet(permissions);
    }

    @Override
    public Set<String> getUsersWithRole(String roleName) {
        if (!StringUtils.hasText(roleName)) {
            return Set.of();
        }
        return Copies.stringSet(readList(ROLE_USERS_PREFIX + roleName));
    }

    // =========================
    // 内置角色
    // =========================

    @Override
    public void initializeDefaultRoles() {
        createPermissionIfMissing("user.read", "Read user data", "user", "read");
        createPermissionIfMissing("user.write", "Write user data", "user", "write");
        createPermissionIfMissing("user.delete", "Delete user data", "user", "delete");
        createPermissionIfMissing("admin.access", "Access admin panel", "admin", "access");
        createPermissionIfMissing("system.manage", "Manage system settings", "system", "manage");

        createRoleIfMissing("user", "Standard user role", List.of("user.read"));
        createRoleIfMissing("moderator", "Moderator role with user management permissions",
                List.of("user.read", "user.write"));
        createRoleIfMissing("admin", "Administrator role with full access",
                List.of("user.read", "user.write", "user.delete", "admin.access", "system.manage"));
        log.info("Default roles initialized");
    }

    // =========================
    // 内部辅助方法
    // =========================

    private void createPermissionIfMissing(String name, String description, String resource, String action) {
        if (getPermissionByName(name).isEmpty()) {
            createPermission(name, description, resource, action, true);
        }
    }

    private void createRoleIfMissing(String name, String description, List<String> permissions) {
        if (getRoleByName(name).isEmpty()) {
            createRole(name, description, permissions, true);
        }
    }

    private void renameUserLinks(String oldName, String newName) {
        List<String> users = readList(ROLE_USERS_PREFIX + oldName);
        for (String userId : users) {
            removeFromList(USER_ROLES_PREFIX + userId, oldName);
            addToList(USER_ROLES_PREFIX + userId, newName);
        }
        cache.delete(ROLE_USERS_PREFIX + oldName);
        if (!users.isEmpty()) {
            cache.set(ROLE_USERS_PREFIX + newName, codec.write(users), ttl);
        }
    }

    private void saveRole(Role role) {
        cache.set(ROLE_PREFIX + role.id(), codec.write(role), ttl);
    }

    private List<String> readList(String key) {
        List<String> values = codec.read(cache.get(key), STRING_LIST);
        return values == null ? List.of() : values;
    }

    private void addToList(String key, String value) {
        List<String> values = new ArrayList<>(readList(key));
        if (!values.contains(value)) {
            values.add(value);
        }
        cache.set(key, codec.write(values), ttl);
    }

    private void removeFromList(String key, String value) {
        List<String> remaining = readList(key).stream()
                .filter(v -> !v.equals(value))
                .toList();
        if (remaining.isEmpty()) {
            cache.delete(key);
        } else {
            cache.set(key, codec.write(remaining), ttl);
        }
    }

    private static void requireName(String value, String what) {
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException(what + " name must not be blank");
        }
    }
}
