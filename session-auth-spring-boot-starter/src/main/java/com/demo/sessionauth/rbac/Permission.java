package com.demo.sessionauth.rbac;

/**
 * 权限定义。名称约定为 {@code <resource>.<action>}，如 {@code user.read}。
 */
public record Permission(
        String id,
        String name,
        String description,
        String resource,
        String action,
        boolean system
) {
}
