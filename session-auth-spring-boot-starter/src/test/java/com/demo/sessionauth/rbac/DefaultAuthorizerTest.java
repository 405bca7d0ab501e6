package com.demo.sessionauth.rbac;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DefaultAuthorizer 测试")
class DefaultAuthorizerTest {

    private final Authorizer authorizer = new DefaultAuthorizer();

    @Test
    @DisplayName("角色：具备任意一个即通过")
    void rolesUseOr() {
        assertThat(authorizer.hasAnyRole(Set.of("editor"), List.of("admin", "editor"))).isTrue();
        assertThat(authorizer.hasAnyRole(Set.of("viewer"), List.of("admin", "editor"))).isFalse();
    }

    @Test
    @DisplayName("权限：必须全部具备")
    void permissionsUseAnd() {
        assertThat(authorizer.hasAllPermissions(Set.of("read"), List.of("read", "write"))).isFalse();
        assertThat(authorizer.hasAllPermissions(Set.of("read", "write", "delete"), List.of("read", "write"))).isTrue();
    }

    @Test
    @DisplayName("没有要求时一律通过，即使用户什么都没有")
    void emptyRequirementPasses() {
        assertThat(authorizer.hasAnyRole(Set.of(), List.of())).isTrue();
        assertThat(authorizer.hasAllPermissions(null, null)).isTrue();
    }

    @Test
    @DisplayName("有要求但用户为空时拒绝")
    void emptyUserFails() {
        assertThat(authorizer.hasAnyRole(null, List.of("admin"))).isFalse();
        assertThat(authorizer.hasAllPermissions(Set.of(), List.of("read"))).isFalse();
    }

    @Test
    @DisplayName("精确匹配，大小写敏感")
    void exactMatchOnly() {
        assertThat(authorizer.hasAnyRole(Set.of("Admin"), List.of("admin"))).isFalse();
    }
}
