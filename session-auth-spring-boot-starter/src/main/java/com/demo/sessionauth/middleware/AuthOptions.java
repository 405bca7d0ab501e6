package com.demo.sessionauth.middleware;

import com.demo.sessionauth.util.Copies;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 认证选项。
 *
 * @param required              false 时缺失或无效凭证按匿名放行
 * @param roles                 任意一个即可（OR）
 * @param permissions           必须全部具备（AND）
 * @param skipSessionValidation 跳过服务端会话校验
 * @param allowExpired          接受仅因过期而失效的 access token
 */
public record AuthOptions(
        boolean required,
        Set<String> roles,
        Set<String> permissions,
        boolean skipSessionValidation,
        boolean allowExpired
) {

    public AuthOptions {
        roles = Copies.stringSet(roles);
        permissions = Copies.stringSet(permissions);
    }

    public static AuthOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .required(required)
                .roles(roles)
                .permissions(permissions)
                .skipSessionValidation(skipSessionValidation)
                .allowExpired(allowExpired);
    }

    public static final class Builder {

        private boolean required = true;
        private final Set<String> roles = new LinkedHashSet<>();
        private final Set<String> permissions = new LinkedHashSet<>();
        private boolean skipSessionValidation;
        private boolean allowExpired;

        private Builder() {
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder roles(String... roles) {
            return roles(Arrays.asList(roles));
        }

        public Builder roles(Collection<String> roles) {
            this.roles.clear();
            if (roles != null) this.roles.addAll(roles);
            return this;
        }

        public Builder permissions(String... permissions) {
            return permissions(Arrays.asList(permissions));
        }

        public Builder permissions(Collection<String> permissions) {
            this.permissions.clear();
            if (permissions != null) this.permissions.addAll(permissions);
            return this;
        }

        public Builder skipSessionValidation(boolean skipSessionValidation) {
            this.skipSessionValidation = skipSessionValidation;
            return this;
        }

        public Builder allowExpired(boolean allowExpired) {
            this.allowExpired = allowExpired;
            return this;
        }

        public AuthOptions build() {
            return new AuthOptions(required, roles, permissions, skipSessionValidation, allowExpired);
        }
    }
}
